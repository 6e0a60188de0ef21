package org.Aayush.tsp.search;

import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.config.SolverConfigurationException;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.cost.TourCost;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Deterministic nearest-neighbor tour. From the start city, always moves to the closest unvisited
 * city; the lowest city index wins ties. O(n^2). Works for any {@code n >= 1} and ignores the random
 * stream.
 */
public final class NearestNeighborConstructor implements TourSolver {
    private final NearestNeighborConfig config;

    public NearestNeighborConstructor(NearestNeighborConfig config) {
        this.config = Objects.requireNonNull(config, "config").validated();
    }

    @Override
    public SearchOutcome solve(DistanceMatrix matrix, RandomGenerator random) {
        int n = matrix.size();
        int start = config.getStartCity();
        if (start >= n) {
            throw new SolverConfigurationException(
                    ParameterMap.REASON_OUT_OF_RANGE,
                    NearestNeighborConfig.START_CITY + " must be in [0," + (n - 1) + "], got " + start
            );
        }

        boolean[] visited = new boolean[n];
        int[] route = new int[n];
        route[0] = start;
        visited[start] = true;
        int current = start;
        for (int idx = 1; idx < n; idx++) {
            int next = -1;
            double nearest = Double.POSITIVE_INFINITY;
            for (int city = 0; city < n; city++) {
                if (visited[city]) {
                    continue;
                }
                double d = matrix.distance(current, city);
                if (next < 0 || d < nearest) {
                    next = city;
                    nearest = d;
                }
            }
            route[idx] = next;
            visited[next] = true;
            current = next;
        }
        return new SearchOutcome(route, TourCost.length(matrix, route));
    }
}
