package org.Aayush.tsp.search;

import org.Aayush.tsp.cost.DistanceMatrix;

import java.util.random.RandomGenerator;

/**
 * One configured TSP heuristic.
 *
 * <p>Implementations are immutable once constructed. All randomness is drawn from the supplied
 * generator, so two calls with equally seeded generators return identical outcomes.</p>
 */
public interface TourSolver {

    /**
     * Runs the heuristic to completion.
     *
     * @param matrix distance table.
     * @param random random stream owned by the caller for the duration of the call.
     * @return best complete tour found.
     */
    SearchOutcome solve(DistanceMatrix matrix, RandomGenerator random);
}
