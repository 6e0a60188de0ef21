package org.Aayush.tsp.search;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tsp.config.ParameterMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class NearestNeighborConfig {
    public static final String START_CITY = "start_city";
    public static final String N_CITIES = "n_cities";
    public static final String METHOD = "method";
    public static final String METHOD_ID = "nearest_neighbor";

    public static final Set<String> PARAMETER_NAMES = Set.of(START_CITY);

    @Builder.Default
    int startCity = 0;

    public static NearestNeighborConfig fromMap(Map<String, ?> raw) {
        ParameterMap params = ParameterMap.of(raw, PARAMETER_NAMES);
        return NearestNeighborConfig.builder()
                .startCity(params.intValue(START_CITY, 0))
                .build()
                .validated();
    }

    public NearestNeighborConfig validated() {
        ParameterMap.requireAtLeast(START_CITY, startCity, 0);
        return this;
    }

    /**
     * Effective parameters plus the instance size and method tag.
     */
    public Map<String, Object> toMeta(int cityCount) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(START_CITY, startCity);
        meta.put(N_CITIES, cityCount);
        meta.put(METHOD, METHOD_ID);
        return meta;
    }
}
