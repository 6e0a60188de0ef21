package org.Aayush.tsp.search;

import lombok.extern.log4j.Log4j;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.cost.TourCost;
import org.Aayush.tsp.move.CostTracking;
import org.Aayush.tsp.move.MoveGenerator;
import org.Aayush.tsp.move.Neighbor;

import java.util.Objects;
import java.util.function.DoubleConsumer;
import java.util.random.RandomGenerator;

/**
 * Multistart first-improvement hill climbing.
 *
 * <p>Each trajectory starts from a fresh random permutation and moves only to strictly cheaper neighbors.
 * A trajectory ends after {@code stopNoImprove} consecutive rejected neighbors or {@code maxIter}
 * iterations. Trajectories are independent; the cheapest result across all of them is reported.</p>
 *
 * <p>In incremental mode a neighbor that looks cheaper by delta is recomputed in full before it is
 * accepted, so the best cost is always exact and never increases.</p>
 */
@Log4j
public final class HillClimbingEngine implements TourSolver {
    private final HillClimbingConfig config;

    public HillClimbingEngine(HillClimbingConfig config) {
        this.config = Objects.requireNonNull(config, "config").validated();
    }

    @Override
    public SearchOutcome solve(DistanceMatrix matrix, RandomGenerator random) {
        MoveGenerator moves = new MoveGenerator(
                matrix,
                config.getNeighborhoodType(),
                CostTracking.fromUseDelta(config.isUseDelta())
        );
        SearchOutcome best = null;
        for (int start = 0; start < config.getNStarts(); start++) {
            int[] route = RandomTours.shuffled(matrix.size(), random);
            SearchOutcome local = climb(moves, route, config.getMaxIter(), config.getStopNoImprove(), random, null);
            if (best == null || local.cost() < best.cost()) {
                best = local;
            }
            if (log.isDebugEnabled()) {
                log.debug("hill climbing start " + (start + 1) + "/" + config.getNStarts()
                        + " cost=" + local.cost() + " best=" + best.cost());
            }
        }
        return best;
    }

    /**
     * Runs one trajectory from {@code start}.
     *
     * @param moves neighbor source (carries operator and cost-tracking mode).
     * @param start initial route; not modified.
     * @param maxIter iteration cap.
     * @param stopNoImprove stagnation limit.
     * @param random random stream.
     * @param bestCostObserver optional sink receiving the best cost after every iteration.
     * @return best route of the trajectory, with its exact cost.
     */
    static SearchOutcome climb(
            MoveGenerator moves,
            int[] start,
            int maxIter,
            int stopNoImprove,
            RandomGenerator random,
            DoubleConsumer bestCostObserver
    ) {
        int[] bestRoute = start.clone();
        double bestCost = TourCost.length(moves.matrix(), bestRoute);
        int noImprove = 0;

        for (int iter = 0; iter < maxIter; iter++) {
            Neighbor candidate = moves.neighbor(bestRoute, bestCost, random);
            double candidateCost = candidate.cost() < bestCost
                    ? moves.exactCost(candidate.route(), candidate.cost())
                    : candidate.cost();
            if (candidateCost < bestCost) {
                bestRoute = candidate.route();
                bestCost = candidateCost;
                noImprove = 0;
            } else {
                noImprove++;
            }
            if (bestCostObserver != null) {
                bestCostObserver.accept(bestCost);
            }
            if (noImprove >= stopNoImprove) {
                break;
            }
        }
        return new SearchOutcome(bestRoute, bestCost);
    }
}
