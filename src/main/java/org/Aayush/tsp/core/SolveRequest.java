package org.Aayush.tsp.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.tsp.cost.DistanceMatrix;

import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Client-facing solve request.
 *
 * <p>Randomness is explicit: {@code random} wins when both it and {@code seed} are set; when neither is
 * set, the facade creates a fresh unseeded generator for the call.</p>
 */
@Value
@Builder
public class SolveRequest {
    /** Precomputed city-to-city costs. */
    DistanceMatrix distanceMatrix;
    /** Heuristic to run. */
    SolverAlgorithm algorithm;
    /** Algorithm parameters by name; absent names take their defaults. */
    @Singular
    Map<String, Object> parameters;
    /** Seed for a per-call {@code SplittableRandom}. */
    Long seed;
    /** Caller-owned random stream; must not be shared across concurrent calls. */
    RandomGenerator random;
}
