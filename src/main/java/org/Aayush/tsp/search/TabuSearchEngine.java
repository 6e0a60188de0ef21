package org.Aayush.tsp.search;

import lombok.extern.log4j.Log4j;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.cost.TourCost;
import org.Aayush.tsp.move.CostTracking;
import org.Aayush.tsp.move.Move;
import org.Aayush.tsp.move.MoveGenerator;

import java.util.Objects;
import java.util.function.DoubleConsumer;
import java.util.random.RandomGenerator;

/**
 * Tabu search with aspiration over sampled candidate moves.
 *
 * <p>Each iteration samples {@code n_neighbors} moves from the current route and prices them by
 * delta. A candidate whose key is tabu is skipped unless its cost is strictly below the best-ever
 * cost. The cheapest surviving candidate is accepted even when it worsens the current route; ties keep
 * the first candidate sampled. Only the accepted candidate is materialized (for move keys). Candidates
 * are priced from the tracked current cost; a new best-ever is recomputed in full before it is recorded.</p>
 *
 * <p>With {@link TabuKeyType#MOVE} the key is the move's position pair. Swap, insert and two-opt
 * moves at the same positions share a key even though they change different edges.</p>
 */
@Log4j
public final class TabuSearchEngine implements TourSolver {
    private final TabuSearchConfig config;

    public TabuSearchEngine(TabuSearchConfig config) {
        this.config = Objects.requireNonNull(config, "config").validated();
    }

    @Override
    public SearchOutcome solve(DistanceMatrix matrix, RandomGenerator random) {
        MoveGenerator moves = new MoveGenerator(matrix, config.getNeighborhoodType(), CostTracking.INCREMENTAL);
        return search(moves, RandomTours.shuffled(matrix.size(), random), random);
    }

    SearchOutcome search(MoveGenerator moves, int[] start, RandomGenerator random) {
        return search(moves, start, random, null);
    }

    /**
     * Runs the search from an explicit start route.
     *
     * @param currentCostObserver optional sink receiving the current cost after every iteration.
     */
    SearchOutcome search(MoveGenerator moves, int[] start, RandomGenerator random, DoubleConsumer currentCostObserver) {
        int n = start.length;
        boolean routeKeys = config.getTabuKey() == TabuKeyType.ROUTE;
        TabuMemory<Object> tabu = new TabuMemory<>(config.getTabuTenure());

        int[] current = start.clone();
        double currentCost = TourCost.length(moves.matrix(), current);
        int[] best = current;
        double bestCost = currentCost;

        int noImprove = 0;
        long accepted = 0L;
        int iterations = 0;
        while (iterations < config.getMaxIter()) {
            iterations++;
            Move chosenMove = null;
            Object chosenKey = null;
            int[] chosenRoute = null;
            double chosenCost = Double.POSITIVE_INFINITY;

            for (int k = 0; k < config.getNNeighbors(); k++) {
                Move move = moves.sample(n, random);
                double cost = currentCost + moves.delta(current, move);
                int[] candidateRoute = null;
                Object key;
                if (routeKeys) {
                    candidateRoute = MoveGenerator.apply(current, move);
                    key = new RouteKey(candidateRoute);
                } else {
                    key = move.positionKey();
                }
                if (!admissible(tabu.contains(key), cost, bestCost)) {
                    continue;
                }
                if (cost < chosenCost) {
                    chosenMove = move;
                    chosenKey = key;
                    chosenRoute = candidateRoute;
                    chosenCost = cost;
                }
            }

            if (chosenMove == null) {
                if (currentCostObserver != null) {
                    currentCostObserver.accept(currentCost);
                }
                if (++noImprove >= config.getStopNoImprove()) {
                    break;
                }
                continue;
            }

            current = chosenRoute != null ? chosenRoute : MoveGenerator.apply(current, chosenMove);
            currentCost = moves.reconcile(current, chosenCost, ++accepted);
            tabu.push(chosenKey);
            if (currentCost < bestCost) {
                currentCost = moves.exactCost(current, currentCost);
            }

            if (currentCostObserver != null) {
                currentCostObserver.accept(currentCost);
            }
            if (currentCost < bestCost) {
                best = current;
                bestCost = currentCost;
                noImprove = 0;
            } else {
                noImprove++;
            }
            if (noImprove >= config.getStopNoImprove()) {
                break;
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("tabu search finished after " + iterations + " iterations, accepted=" + accepted
                    + " best=" + bestCost);
        }
        return new SearchOutcome(best.clone(), bestCost);
    }

    /**
     * Tabu filter with aspiration: a tabu candidate survives only when it beats the best-ever cost.
     */
    static boolean admissible(boolean tabu, double candidateCost, double bestCost) {
        return !tabu || candidateCost < bestCost;
    }
}
