package org.Aayush.tsp.testutil;

import org.Aayush.tsp.cost.DistanceMatrix;

import java.util.Random;

/**
 * Shared distance-matrix fixtures for solver tests.
 */
public final class TspFixtureFactory {
    /** Five-city symmetric instance whose nearest-neighbor tour from city 0 is [0,4,1,3,2] (cost 25). */
    public static final double[][] FIVE_CITY = {
            {0, 2, 9, 10, 1},
            {2, 0, 6, 4, 3},
            {9, 6, 0, 8, 7},
            {10, 4, 8, 0, 5},
            {1, 3, 7, 5, 0}
    };

    private TspFixtureFactory() {
    }

    public static DistanceMatrix fiveCity() {
        return DistanceMatrix.of(FIVE_CITY);
    }

    /**
     * Random points in a 1000 x 1000 square with Euclidean distances.
     */
    public static DistanceMatrix euclidean(int n, long seed) {
        Random random = new Random(seed);
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = random.nextDouble() * 1000.0d;
            y[i] = random.nextDouble() * 1000.0d;
        }
        double[][] rows = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                rows[i][j] = Math.hypot(x[i] - x[j], y[i] - y[j]);
            }
        }
        return DistanceMatrix.of(rows);
    }

    /**
     * Independent random entries in [0, 100) per direction, zero diagonal.
     */
    public static DistanceMatrix asymmetric(int n, long seed) {
        Random random = new Random(seed);
        double[][] rows = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                rows[i][j] = i == j ? 0.0d : random.nextDouble() * 100.0d;
            }
        }
        return DistanceMatrix.of(rows);
    }

    /**
     * Symmetric integer-valued distances in [1, 100], so every partial sum is exact in double arithmetic.
     */
    public static DistanceMatrix integerSymmetric(int n, long seed) {
        Random random = new Random(seed);
        double[][] rows = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = 1 + random.nextInt(100);
                rows[i][j] = d;
                rows[j][i] = d;
            }
        }
        return DistanceMatrix.of(rows);
    }

    /**
     * Ring with cheap edges {@code i <-> i+1 (mod n)} of 1.1 and all other edges near 1.234567e12.
     * Summing deltas on this table loses the low-order digits of the ring cost, so tracked costs drift.
     */
    public static DistanceMatrix wideRangeRing(int n, long seed) {
        Random random = new Random(seed);
        double[][] rows = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                boolean ringEdge = j == i + 1 || (i == 0 && j == n - 1);
                double d = ringEdge ? 1.1d : 1.234567e12d + random.nextDouble();
                rows[i][j] = d;
                rows[j][i] = d;
            }
        }
        return DistanceMatrix.of(rows);
    }
}
