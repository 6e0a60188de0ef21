package org.Aayush.tsp.search;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.move.MoveType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Simulated-annealing parameters with a geometric cooling schedule {@code T *= alpha}.
 */
@Value
@Builder
public class AnnealingConfig {
    public static final String T0 = "T0";
    public static final String T_MIN = "T_min";
    public static final String ALPHA = "alpha";
    public static final String MAX_ITER = "max_iter";
    public static final String NEIGHBORHOOD_TYPE = "neighborhood_type";
    public static final String USE_DELTA = "use_delta";

    public static final Set<String> PARAMETER_NAMES =
            Set.of(T0, T_MIN, ALPHA, MAX_ITER, NEIGHBORHOOD_TYPE, USE_DELTA);

    @Builder.Default
    double initialTemperature = 1000.0d;
    /** Search stops once the temperature is at or below this value. */
    @Builder.Default
    double minTemperature = 1.0d;
    /** Cooling factor in (0, 1). */
    @Builder.Default
    double alpha = 0.99d;
    @Builder.Default
    int maxIter = 5000;
    @Builder.Default
    MoveType neighborhoodType = MoveType.SWAP;
    @Builder.Default
    boolean useDelta = false;

    public static AnnealingConfig fromMap(Map<String, ?> raw) {
        ParameterMap params = ParameterMap.of(raw, PARAMETER_NAMES);
        return AnnealingConfig.builder()
                .initialTemperature(params.doubleValue(T0, 1000.0d))
                .minTemperature(params.doubleValue(T_MIN, 1.0d))
                .alpha(params.doubleValue(ALPHA, 0.99d))
                .maxIter(params.intValue(MAX_ITER, 5000))
                .neighborhoodType(params.optionValue(NEIGHBORHOOD_TYPE, MoveType.SWAP, MoveType::fromId))
                .useDelta(params.booleanValue(USE_DELTA, false))
                .build()
                .validated();
    }

    public AnnealingConfig validated() {
        ParameterMap.requirePositive(T0, initialTemperature);
        ParameterMap.requirePositive(T_MIN, minTemperature);
        ParameterMap.requireOpenRange(ALPHA, alpha, 0.0d, 1.0d);
        ParameterMap.requireAtLeast(MAX_ITER, maxIter, 0);
        ParameterMap.requirePresent(NEIGHBORHOOD_TYPE, neighborhoodType);
        return this;
    }

    public Map<String, Object> toMeta() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(T0, initialTemperature);
        meta.put(T_MIN, minTemperature);
        meta.put(ALPHA, alpha);
        meta.put(MAX_ITER, maxIter);
        meta.put(NEIGHBORHOOD_TYPE, neighborhoodType.id());
        meta.put(USE_DELTA, useDelta);
        return meta;
    }
}
