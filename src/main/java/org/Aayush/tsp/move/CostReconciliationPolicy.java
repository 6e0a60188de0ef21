package org.Aayush.tsp.move;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Periodic reconciliation of incrementally tracked tour costs against a full recomputation.
 *
 * <p>Defaults are read from system properties:</p>
 * <ul>
 * <li>{@code tsp.search.reconcileInterval}: accepted moves between checks ({@code <= 0} disables).</li>
 * <li>{@code tsp.search.reconcileTolerance}: relative drift above which a resync is logged.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
public final class CostReconciliationPolicy {
    public static final long DEFAULT_INTERVAL = 10_000L;
    public static final double DEFAULT_TOLERANCE = 1e-6d;

    private static final String PROP_INTERVAL = "tsp.search.reconcileInterval";
    private static final String PROP_TOLERANCE = "tsp.search.reconcileTolerance";

    private final long interval;
    private final double tolerance;

    private CostReconciliationPolicy(long interval, double tolerance) {
        this.interval = Math.max(0L, interval);
        this.tolerance = tolerance > 0.0d && Double.isFinite(tolerance) ? tolerance : DEFAULT_TOLERANCE;
    }

    /**
     * Creates a policy with explicit bounds.
     */
    public static CostReconciliationPolicy of(long interval, double tolerance) {
        return new CostReconciliationPolicy(interval, tolerance);
    }

    /**
     * Policy that never recomputes.
     */
    public static CostReconciliationPolicy disabled() {
        return new CostReconciliationPolicy(0L, DEFAULT_TOLERANCE);
    }

    /**
     * Loads the policy from system properties.
     */
    public static CostReconciliationPolicy defaults() {
        return of(
                readLong(PROP_INTERVAL, DEFAULT_INTERVAL),
                readDouble(PROP_TOLERANCE, DEFAULT_TOLERANCE)
        );
    }

    /**
     * Returns whether a check is due after the given number of accepted moves.
     */
    public boolean isDue(long acceptedMoves) {
        return interval > 0L && acceptedMoves > 0L && acceptedMoves % interval == 0L;
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
