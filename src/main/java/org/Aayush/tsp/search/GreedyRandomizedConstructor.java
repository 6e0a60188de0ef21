package org.Aayush.tsp.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.cost.DistanceMatrix;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Greedy-randomized tour construction with a restricted candidate list (RCL).
 *
 * <p>Starting from a uniformly random city, each step collects the unvisited cities whose distance from
 * the current city is at most {@code min + alpha * (max - min)} and picks one uniformly. {@code alpha = 0}
 * keeps only the nearest cities; {@code alpha = 1} admits every unvisited city. Equal distances fall into
 * the same list and are drawn uniformly.</p>
 */
public final class GreedyRandomizedConstructor {
    private final DistanceMatrix matrix;
    private final double alpha;

    public GreedyRandomizedConstructor(DistanceMatrix matrix, double alpha) {
        this.matrix = Objects.requireNonNull(matrix, "matrix");
        this.alpha = ParameterMap.requireClosedRange(GraspConfig.ALPHA, alpha, 0.0d, 1.0d);
    }

    public int[] construct(RandomGenerator random) {
        int n = matrix.size();
        int[] route = new int[n];
        IntArrayList remaining = new IntArrayList(n);
        for (int city = 0; city < n; city++) {
            remaining.add(city);
        }

        int current = random.nextInt(n);
        route[0] = current;
        remaining.removeInt(current);

        IntArrayList rcl = new IntArrayList(n);
        for (int idx = 1; idx < n; idx++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int k = 0; k < remaining.size(); k++) {
                double d = matrix.distance(current, remaining.getInt(k));
                min = Math.min(min, d);
                max = Math.max(max, d);
            }
            double threshold = alpha >= 1.0d ? max : min + alpha * (max - min);

            rcl.clear();
            for (int k = 0; k < remaining.size(); k++) {
                if (matrix.distance(current, remaining.getInt(k)) <= threshold) {
                    rcl.add(k);
                }
            }
            int chosen = rcl.getInt(random.nextInt(rcl.size()));
            current = remaining.removeInt(chosen);
            route[idx] = current;
        }
        return route;
    }
}
