package org.Aayush.tsp.core;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Client-facing solve result.
 */
@Value
@Builder
public class SolveResponse {
    /** Best tour, a permutation of {@code 0..n-1}. */
    int[] route;
    /** Closed-tour cost of {@code route}, recomputed from the matrix. */
    double cost;
    /** Wall-clock duration of the search in seconds. */
    double runtimeSeconds;
    /** Heuristic that produced this response. */
    SolverAlgorithm algorithm;
    /** Effective parameters, defaults included, in canonical order and form. */
    Map<String, Object> meta;

    /**
     * Returns a copy of the route.
     */
    public int[] getRoute() {
        return route.clone();
    }
}
