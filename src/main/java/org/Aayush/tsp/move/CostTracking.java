package org.Aayush.tsp.move;

/**
 * How candidate tour costs are obtained.
 */
public enum CostTracking {
    /** Candidate cost = current cost + O(1) move delta. */
    INCREMENTAL,
    /** Candidate cost = full O(n) recomputation of the candidate tour. */
    FULL_RECOMPUTE;

    /**
     * Maps a {@code use_delta} flag to a tracking mode.
     */
    public static CostTracking fromUseDelta(boolean useDelta) {
        return useDelta ? INCREMENTAL : FULL_RECOMPUTE;
    }
}
