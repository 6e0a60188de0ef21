package org.Aayush.tsp.move;

import org.Aayush.tsp.cost.DistanceMatrix;

import java.util.Objects;

/**
 * Exact tour-cost change of one move, computed from the cities adjacent to the changed positions.
 *
 * <p>All routes are closed cycles: the successor of {@code route[n-1]} is {@code route[0]}. For every
 * operator the contract is</p>
 * <pre>
 * TourCost.length(apply(route, move)) == TourCost.length(route) + delta(route, move)
 * </pre>
 * <p>up to floating-point rounding. Positive deltas are worsening moves.</p>
 */
public final class MoveDeltaCalculator {
    private final DistanceMatrix matrix;

    public MoveDeltaCalculator(DistanceMatrix matrix) {
        this.matrix = Objects.requireNonNull(matrix, "matrix");
    }

    /**
     * Dispatches on the move's operator.
     */
    public double delta(int[] route, Move move) {
        return switch (move.type()) {
            case SWAP -> swapDelta(route, move.i(), move.j());
            case INSERT -> insertDelta(route, move.i(), move.j());
            case TWO_OPT -> twoOptDelta(route, move.i(), move.j());
        };
    }

    /**
     * Cost change of exchanging the cities at positions {@code i} and {@code j}.
     *
     * <p>Adjacent positions replace three edges, the wraparound pair {@code (0, n-1)} replaces the three
     * cyclic edges around the seam, and any other pair replaces four edges.</p>
     */
    public double swapDelta(int[] route, int i, int j) {
        if (i == j) {
            return 0.0d;
        }
        int n = route.length;
        if (i > j) {
            int tmp = i;
            i = j;
            j = tmp;
        }
        int a = route[i];
        int b = route[j];
        int aPrev = route[i > 0 ? i - 1 : n - 1];
        int aNext = route[i < n - 1 ? i + 1 : 0];
        int bPrev = route[j > 0 ? j - 1 : n - 1];
        int bNext = route[j < n - 1 ? j + 1 : 0];

        if (j == i + 1) {
            // aPrev -> a -> b -> bNext  becomes  aPrev -> b -> a -> bNext
            return d(aPrev, b) + d(b, a) + d(a, bNext)
                    - d(aPrev, a) - d(a, b) - d(b, bNext);
        }
        if (i == 0 && j == n - 1) {
            // bPrev -> b -> a -> aNext across the seam becomes bPrev -> a -> b -> aNext
            return d(bPrev, a) + d(a, b) + d(b, aNext)
                    - d(bPrev, b) - d(b, a) - d(a, aNext);
        }
        return d(aPrev, b) + d(b, aNext) + d(bPrev, a) + d(a, bNext)
                - d(aPrev, a) - d(a, aNext) - d(bPrev, b) - d(b, bNext);
    }

    /**
     * Cost change of reversing {@code route[i..j-1]} (two-opt).
     *
     * <p>The edges entering position {@code i} and leaving position {@code j-1} are replaced. On an
     * asymmetric matrix the reversed segment also travels its internal edges backwards, which is
     * accounted for in O(j-i); on a symmetric matrix the result is O(1).</p>
     */
    public double twoOptDelta(int[] route, int i, int j) {
        if (i == j) {
            return 0.0d;
        }
        int n = route.length;
        if (i > j) {
            int tmp = i;
            i = j;
            j = tmp;
        }
        int before = route[i > 0 ? i - 1 : n - 1];
        int first = route[i];
        int last = route[j - 1];
        int after = route[j < n ? j : 0];

        double delta = d(before, last) + d(first, after) - d(before, first) - d(last, after);
        if (!matrix.isSymmetric()) {
            for (int k = i; k < j - 1; k++) {
                delta += d(route[k + 1], route[k]) - d(route[k], route[k + 1]);
            }
        }
        return delta;
    }

    /**
     * Cost change of removing the city at {@code i} and re-inserting it at {@code j}.
     *
     * <p>Removal stitches {@code prev -> next}. Insertion then splits the edge between the new left and
     * right neighbors. When the insertion point is cyclically adjacent to the removal point, the
     * natural neighbor is the removed city itself and the already displaced neighbor is used instead.</p>
     */
    public double insertDelta(int[] route, int i, int j) {
        if (i == j) {
            return 0.0d;
        }
        int n = route.length;
        int a = route[i];
        int aPrev = route[Math.floorMod(i - 1, n)];
        int aNext = route[Math.floorMod(i + 1, n)];

        double delta = d(aPrev, aNext) - d(aPrev, a) - d(a, aNext);

        int left;
        int right;
        if (i < j) {
            // cities i+1..j shift one position left; a lands between old route[j] and old route[j+1]
            left = route[j];
            int rightIndex = (j + 1) % n;
            right = rightIndex == i ? aNext : route[rightIndex];
        } else {
            // cities j..i-1 shift one position right; a lands between old route[j-1] and old route[j]
            int leftIndex = Math.floorMod(j - 1, n);
            left = leftIndex == i ? aPrev : route[leftIndex];
            right = route[j];
        }
        delta += d(left, a) + d(a, right) - d(left, right);
        return delta;
    }

    private double d(int from, int to) {
        return matrix.distance(from, to);
    }
}
