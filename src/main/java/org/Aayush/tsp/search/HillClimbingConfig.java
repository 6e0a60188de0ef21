package org.Aayush.tsp.search;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.move.MoveType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Multistart hill-climbing parameters.
 */
@Value
@Builder
public class HillClimbingConfig {
    public static final String N_STARTS = "n_starts";
    public static final String MAX_ITER = "max_iter";
    public static final String STOP_NO_IMPROVE = "stop_no_improve";
    public static final String NEIGHBORHOOD_TYPE = "neighborhood_type";
    public static final String USE_DELTA = "use_delta";

    public static final Set<String> PARAMETER_NAMES =
            Set.of(N_STARTS, MAX_ITER, STOP_NO_IMPROVE, NEIGHBORHOOD_TYPE, USE_DELTA);

    /** Independent trajectories, each from a fresh random permutation. */
    @Builder.Default
    int nStarts = 10;
    /** Iteration cap per trajectory. */
    @Builder.Default
    int maxIter = 500;
    /** Consecutive non-improving iterations that end a trajectory. */
    @Builder.Default
    int stopNoImprove = 50;
    @Builder.Default
    MoveType neighborhoodType = MoveType.SWAP;
    /** Price neighbors by O(1) delta instead of full recomputation. */
    @Builder.Default
    boolean useDelta = false;

    /**
     * Binds a caller parameter map, applying defaults for absent names.
     */
    public static HillClimbingConfig fromMap(Map<String, ?> raw) {
        ParameterMap params = ParameterMap.of(raw, PARAMETER_NAMES);
        return HillClimbingConfig.builder()
                .nStarts(params.intValue(N_STARTS, 10))
                .maxIter(params.intValue(MAX_ITER, 500))
                .stopNoImprove(params.intValue(STOP_NO_IMPROVE, 50))
                .neighborhoodType(params.optionValue(NEIGHBORHOOD_TYPE, MoveType.SWAP, MoveType::fromId))
                .useDelta(params.booleanValue(USE_DELTA, false))
                .build()
                .validated();
    }

    /**
     * Range-checks every field and returns this config.
     */
    public HillClimbingConfig validated() {
        ParameterMap.requireAtLeast(N_STARTS, nStarts, 1);
        ParameterMap.requireAtLeast(MAX_ITER, maxIter, 0);
        ParameterMap.requireAtLeast(STOP_NO_IMPROVE, stopNoImprove, 1);
        ParameterMap.requirePresent(NEIGHBORHOOD_TYPE, neighborhoodType);
        return this;
    }

    /**
     * Effective parameters in canonical form.
     */
    public Map<String, Object> toMeta() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(N_STARTS, nStarts);
        meta.put(MAX_ITER, maxIter);
        meta.put(STOP_NO_IMPROVE, stopNoImprove);
        meta.put(NEIGHBORHOOD_TYPE, neighborhoodType.id());
        meta.put(USE_DELTA, useDelta);
        return meta;
    }
}
