package org.Aayush.tsp.move;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.log4j.Log4j;
import org.Aayush.tsp.config.SolverConfigurationException;
import org.Aayush.tsp.cost.DistanceMatrix;
import org.Aayush.tsp.cost.TourCost;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Samples, prices and applies neighborhood moves of one operator over one distance matrix.
 *
 * <p>Instances hold no mutable state and may be shared by concurrent searches; every call reads only
 * its arguments and the supplied random stream.</p>
 */
@Log4j
@Getter
@Accessors(fluent = true)
public final class MoveGenerator {
    public static final int MIN_CITIES = 4;
    public static final String REASON_TOO_FEW_CITIES = "TSP_MOVE_TOO_FEW_CITIES";

    private final DistanceMatrix matrix;
    private final MoveType moveType;
    private final CostTracking costTracking;
    private final CostReconciliationPolicy reconciliation;
    @Getter(AccessLevel.NONE)
    private final MoveDeltaCalculator deltas;

    public MoveGenerator(DistanceMatrix matrix, MoveType moveType, CostTracking costTracking) {
        this(matrix, moveType, costTracking, CostReconciliationPolicy.defaults());
    }

    public MoveGenerator(
            DistanceMatrix matrix,
            MoveType moveType,
            CostTracking costTracking,
            CostReconciliationPolicy reconciliation
    ) {
        this.matrix = Objects.requireNonNull(matrix, "matrix");
        this.moveType = Objects.requireNonNull(moveType, "moveType");
        this.costTracking = Objects.requireNonNull(costTracking, "costTracking");
        this.reconciliation = Objects.requireNonNull(reconciliation, "reconciliation");
        requireSupportedSize(matrix.size());
        this.deltas = new MoveDeltaCalculator(matrix);
    }

    /**
     * Fails when a move-based search cannot run on {@code n} cities.
     */
    public static void requireSupportedSize(int n) {
        if (n < MIN_CITIES) {
            throw new SolverConfigurationException(
                    REASON_TOO_FEW_CITIES,
                    "move-based search requires at least " + MIN_CITIES + " cities, got " + n
            );
        }
    }

    /**
     * Draws a uniformly random position pair {@code i != j} for this generator's operator.
     */
    public Move sample(int n, RandomGenerator random) {
        int i = random.nextInt(n);
        int j = random.nextInt(n - 1);
        if (j >= i) {
            j++;
        }
        return new Move(moveType, i, j);
    }

    /**
     * Exact cost change of {@code move} on {@code route}.
     */
    public double delta(int[] route, Move move) {
        return deltas.delta(route, move);
    }

    /**
     * Cost of {@code route} after {@code move}, obtained through this generator's tracking mode.
     *
     * <p>The incremental path never allocates. The full path materializes the candidate and recomputes.</p>
     */
    public double candidateCost(int[] route, double currentCost, Move move) {
        if (costTracking == CostTracking.INCREMENTAL) {
            return currentCost + deltas.delta(route, move);
        }
        return TourCost.length(matrix, apply(route, move));
    }

    /**
     * Samples one move and materializes the resulting neighbor into a fresh buffer.
     */
    public Neighbor neighbor(int[] route, double currentCost, RandomGenerator random) {
        Move move = sample(route.length, random);
        int[] candidate = apply(route, move);
        double cost = costTracking == CostTracking.INCREMENTAL
                ? currentCost + deltas.delta(route, move)
                : TourCost.length(matrix, candidate);
        return new Neighbor(move, candidate, cost, cost - currentCost);
    }

    /**
     * Resynchronizes an incrementally tracked cost when a reconciliation is due.
     *
     * <p>Returns the exact cost of {@code route} on due checks and {@code trackedCost} otherwise. Drift
     * beyond the policy tolerance is logged and corrected; it never fails the search.</p>
     *
     * @param route current route.
     * @param trackedCost incrementally maintained cost of {@code route}.
     * @param acceptedMoves number of moves accepted so far on this trajectory.
     * @return cost to continue tracking from.
     */
    public double reconcile(int[] route, double trackedCost, long acceptedMoves) {
        if (costTracking != CostTracking.INCREMENTAL || !reconciliation.isDue(acceptedMoves)) {
            return trackedCost;
        }
        double exact = TourCost.length(matrix, route);
        if (!TourCost.approximatelyEqual(exact, trackedCost, reconciliation.tolerance()) && log.isDebugEnabled()) {
            log.debug("tracked cost " + trackedCost + " drifted from recomputed cost " + exact
                    + " after " + acceptedMoves + " accepted moves, resyncing");
        }
        return exact;
    }

    /**
     * Exact cost of {@code route}. Recomputes only in incremental mode, where {@code trackedCost} may
     * carry accumulated rounding error.
     */
    public double exactCost(int[] route, double trackedCost) {
        if (costTracking != CostTracking.INCREMENTAL) {
            return trackedCost;
        }
        return TourCost.length(matrix, route);
    }

    /**
     * Returns a fresh route with {@code move} applied. The source route is never modified.
     */
    public static int[] apply(int[] route, Move move) {
        int[] next = route.clone();
        int i = move.i();
        int j = move.j();
        switch (move.type()) {
            case SWAP -> {
                next[i] = route[j];
                next[j] = route[i];
            }
            case INSERT -> {
                int city = route[i];
                if (i < j) {
                    System.arraycopy(route, i + 1, next, i, j - i);
                } else {
                    System.arraycopy(route, j, next, j + 1, i - j);
                }
                next[j] = city;
            }
            case TWO_OPT -> {
                for (int lo = i, hi = j - 1; lo < hi; lo++, hi--) {
                    next[lo] = route[hi];
                    next[hi] = route[lo];
                }
            }
            default -> throw new IllegalStateException("unsupported move type " + move.type());
        }
        return next;
    }
}
