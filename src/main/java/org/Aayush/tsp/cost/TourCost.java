package org.Aayush.tsp.cost;

import lombok.experimental.UtilityClass;

/**
 * Ground-truth closed-tour length.
 *
 * <pre>
 * cost = sum(d[r[k], r[k+1]] for k in 0..n-2) + d[r[n-1], r[0]]
 * </pre>
 *
 * <p>O(n). Incremental costs tracked by the search engines are always reconciled against this value.</p>
 */
@UtilityClass
public final class TourCost {

    /**
     * Computes the length of the Hamiltonian cycle described by {@code route}.
     *
     * @param matrix distance table.
     * @param route city order; the closing edge back to {@code route[0]} is included.
     * @return closed-tour cost (0 for an empty route).
     */
    public static double length(DistanceMatrix matrix, int[] route) {
        int n = route.length;
        if (n == 0) {
            return 0.0d;
        }
        double total = 0.0d;
        for (int k = 0; k < n - 1; k++) {
            total += matrix.distance(route[k], route[k + 1]);
        }
        total += matrix.distance(route[n - 1], route[0]);
        return total;
    }

    /**
     * Returns whether two costs agree within a relative tolerance.
     *
     * <p>The tolerance is scaled by {@code max(1, |expected|)} so that tours of length close to zero
     * are compared absolutely.</p>
     */
    public static boolean approximatelyEqual(double expected, double actual, double relativeTolerance) {
        double scale = Math.max(1.0d, Math.abs(expected));
        return Math.abs(expected - actual) <= relativeTolerance * scale;
    }
}
