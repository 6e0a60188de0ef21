package org.Aayush.tsp.search;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.move.MoveType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * GRASP parameters: construction greediness plus the hill-climbing refinement applied to every
 * constructed tour.
 */
@Value
@Builder
public class GraspConfig {
    public static final String ALPHA = "alpha";
    public static final String ITERATIONS = "iterations";
    public static final String NEIGHBORHOOD_TYPE = "neighborhood_type";
    public static final String IHC_MAX_ITER = "ihc_max_iter";
    public static final String IHC_STOP_NO_IMPROVE = "ihc_stop_no_improve";
    public static final String USE_DELTA = "use_delta";

    public static final Set<String> PARAMETER_NAMES =
            Set.of(ALPHA, ITERATIONS, NEIGHBORHOOD_TYPE, IHC_MAX_ITER, IHC_STOP_NO_IMPROVE, USE_DELTA);

    /** RCL width in [0, 1]: 0 is pure greedy, 1 is uniform. */
    @Builder.Default
    double alpha = 0.3d;
    @Builder.Default
    int iterations = 100;
    @Builder.Default
    MoveType neighborhoodType = MoveType.SWAP;
    @Builder.Default
    int ihcMaxIter = 300;
    @Builder.Default
    int ihcStopNoImprove = 100;
    @Builder.Default
    boolean useDelta = true;

    public static GraspConfig fromMap(Map<String, ?> raw) {
        ParameterMap params = ParameterMap.of(raw, PARAMETER_NAMES);
        return GraspConfig.builder()
                .alpha(params.doubleValue(ALPHA, 0.3d))
                .iterations(params.intValue(ITERATIONS, 100))
                .neighborhoodType(params.optionValue(NEIGHBORHOOD_TYPE, MoveType.SWAP, MoveType::fromId))
                .ihcMaxIter(params.intValue(IHC_MAX_ITER, 300))
                .ihcStopNoImprove(params.intValue(IHC_STOP_NO_IMPROVE, 100))
                .useDelta(params.booleanValue(USE_DELTA, true))
                .build()
                .validated();
    }

    public GraspConfig validated() {
        ParameterMap.requireClosedRange(ALPHA, alpha, 0.0d, 1.0d);
        ParameterMap.requireAtLeast(ITERATIONS, iterations, 1);
        ParameterMap.requirePresent(NEIGHBORHOOD_TYPE, neighborhoodType);
        ParameterMap.requireAtLeast(IHC_MAX_ITER, ihcMaxIter, 0);
        ParameterMap.requireAtLeast(IHC_STOP_NO_IMPROVE, ihcStopNoImprove, 1);
        return this;
    }

    public Map<String, Object> toMeta() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ALPHA, alpha);
        meta.put(ITERATIONS, iterations);
        meta.put(NEIGHBORHOOD_TYPE, neighborhoodType.id());
        meta.put(IHC_MAX_ITER, ihcMaxIter);
        meta.put(IHC_STOP_NO_IMPROVE, ihcStopNoImprove);
        meta.put(USE_DELTA, useDelta);
        return meta;
    }
}
