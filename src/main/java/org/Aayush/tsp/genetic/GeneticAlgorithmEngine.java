package org.Aayush.tsp.genetic;

import lombok.extern.log4j.Log4j;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.move.CostTracking;
import org.Aayush.tsp.move.MoveGenerator;
import org.Aayush.tsp.search.SearchOutcome;
import org.Aayush.tsp.search.TourSolver;

import java.util.Objects;
import java.util.function.DoubleConsumer;
import java.util.random.RandomGenerator;

/**
 * Generational genetic algorithm with single-individual elitism.
 *
 * <p>Every generation is rebuilt from scratch: index 0 receives a copy of the best route seen so far,
 * and every other slot receives a child of two selected parents, mutated by one random move with
 * probability {@code mutation_prob}. Costs are recomputed in full for each new generation.</p>
 */
@Log4j
public final class GeneticAlgorithmEngine implements TourSolver {
    private final GeneticAlgorithmConfig config;

    public GeneticAlgorithmEngine(GeneticAlgorithmConfig config) {
        this.config = Objects.requireNonNull(config, "config").validated();
    }

    @Override
    public SearchOutcome solve(DistanceMatrix matrix, RandomGenerator random) {
        return solve(matrix, random, null);
    }

    /**
     * Runs the algorithm, reporting the best-ever cost after every generation.
     *
     * @param matrix distance table.
     * @param random random stream.
     * @param bestCostObserver optional sink, called once per generation.
     * @return best route across all generations.
     */
    public SearchOutcome solve(DistanceMatrix matrix, RandomGenerator random, DoubleConsumer bestCostObserver) {
        int n = matrix.size();
        MoveGenerator mutations = new MoveGenerator(matrix, config.getMutationType(), CostTracking.FULL_RECOMPUTE);
        ParentSelector selector = new ParentSelector(config.getSelection(), config.getTournamentSize());
        Crossover crossover = new Crossover(config.getCrossover());

        Population population = Population.random(matrix, config.getPopulationSize(), random);
        int bestIndex = population.bestIndex();
        int[] bestRoute = population.route(bestIndex).clone();
        double bestCost = population.cost(bestIndex);

        for (int generation = 0; generation < config.getGenerations(); generation++) {
            int[][] offspring = new int[config.getPopulationSize()][];
            offspring[0] = bestRoute.clone();
            for (int slot = 1; slot < offspring.length; slot++) {
                int[] parent1 = population.route(selector.select(population.costs(), random));
                int[] parent2 = population.route(selector.select(population.costs(), random));
                int[] child = crossover.cross(parent1, parent2, random);
                if (random.nextDouble() < config.getMutationProb()) {
                    child = MoveGenerator.apply(child, mutations.sample(n, random));
                }
                offspring[slot] = child;
            }

            population = Population.evaluate(matrix, offspring);
            bestIndex = population.bestIndex();
            if (population.cost(bestIndex) < bestCost) {
                bestCost = population.cost(bestIndex);
                bestRoute = population.route(bestIndex).clone();
            }
            if (bestCostObserver != null) {
                bestCostObserver.accept(bestCost);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("genetic algorithm finished after " + config.getGenerations() + " generations, best="
                    + bestCost);
        }
        return new SearchOutcome(bestRoute, bestCost);
    }
}
