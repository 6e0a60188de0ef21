package org.Aayush.tsp.search;

import lombok.extern.log4j.Log4j;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.move.CostTracking;
import org.Aayush.tsp.move.MoveGenerator;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Greedy randomized adaptive search: repeated RCL construction, each refined by one hill-climbing
 * trajectory. Reports the cheapest refined tour.
 */
@Log4j
public final class GraspEngine implements TourSolver {
    private final GraspConfig config;

    public GraspEngine(GraspConfig config) {
        this.config = Objects.requireNonNull(config, "config").validated();
    }

    @Override
    public SearchOutcome solve(DistanceMatrix matrix, RandomGenerator random) {
        MoveGenerator moves = new MoveGenerator(
                matrix,
                config.getNeighborhoodType(),
                CostTracking.fromUseDelta(config.isUseDelta())
        );
        GreedyRandomizedConstructor constructor = new GreedyRandomizedConstructor(matrix, config.getAlpha());

        SearchOutcome best = null;
        for (int iteration = 0; iteration < config.getIterations(); iteration++) {
            int[] constructed = constructor.construct(random);
            SearchOutcome local = HillClimbingEngine.climb(
                    moves,
                    constructed,
                    config.getIhcMaxIter(),
                    config.getIhcStopNoImprove(),
                    random,
                    null
            );
            if (best == null || local.cost() < best.cost()) {
                best = local;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("grasp finished after " + config.getIterations() + " constructions, best=" + best.cost());
        }
        return best;
    }
}
