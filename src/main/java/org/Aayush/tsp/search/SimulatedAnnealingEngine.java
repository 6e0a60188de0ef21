package org.Aayush.tsp.search;

import lombok.extern.log4j.Log4j;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.cost.TourCost;
import org.Aayush.tsp.move.CostTracking;
import org.Aayush.tsp.move.MoveGenerator;
import org.Aayush.tsp.move.Neighbor;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Single-trajectory simulated annealing.
 *
 * <p>Per iteration: one random neighbor, Metropolis acceptance at the current temperature, then
 * {@code T *= alpha}. Runs while {@code T > T_min} and fewer than {@code max_iter} iterations have
 * elapsed. The incremental and full-recompute cost paths draw the same random values in the same order.
 * A new best-ever cost is always recomputed in full before it is recorded.</p>
 */
@Log4j
public final class SimulatedAnnealingEngine implements TourSolver {
    private final AnnealingConfig config;

    public SimulatedAnnealingEngine(AnnealingConfig config) {
        this.config = Objects.requireNonNull(config, "config").validated();
    }

    @Override
    public SearchOutcome solve(DistanceMatrix matrix, RandomGenerator random) {
        MoveGenerator moves = new MoveGenerator(
                matrix,
                config.getNeighborhoodType(),
                CostTracking.fromUseDelta(config.isUseDelta())
        );
        int[] current = RandomTours.shuffled(matrix.size(), random);
        double currentCost = TourCost.length(matrix, current);
        int[] best = current;
        double bestCost = currentCost;

        double temperature = config.getInitialTemperature();
        int iterations = 0;
        long accepted = 0L;
        while (temperature > config.getMinTemperature() && iterations < config.getMaxIter()) {
            Neighbor candidate = moves.neighbor(current, currentCost, random);
            if (AnnealingAcceptance.accepts(candidate.delta(), temperature, random)) {
                current = candidate.route();
                currentCost = moves.reconcile(current, candidate.cost(), ++accepted);
                if (currentCost < bestCost) {
                    currentCost = moves.exactCost(current, currentCost);
                    if (currentCost < bestCost) {
                        best = current;
                        bestCost = currentCost;
                    }
                }
            }
            temperature *= config.getAlpha();
            iterations++;
        }

        if (log.isDebugEnabled()) {
            log.debug("simulated annealing finished after " + iterations + " iterations, accepted=" + accepted
                    + " finalT=" + temperature + " best=" + bestCost);
        }
        return new SearchOutcome(best.clone(), bestCost);
    }
}
