package org.Aayush.tsp.search;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tsp.config.ParameterMap;
import org.Aayush.tsp.move.MoveType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tabu-search parameters.
 */
@Value
@Builder
public class TabuSearchConfig {
    public static final String MAX_ITER = "max_iter";
    public static final String STOP_NO_IMPROVE = "stop_no_improve";
    public static final String TABU_TENURE = "tabu_tenure";
    public static final String NEIGHBORHOOD_TYPE = "neighborhood_type";
    public static final String N_NEIGHBORS = "n_neighbors";
    public static final String TABU_KEY = "tabu_key";

    public static final Set<String> PARAMETER_NAMES =
            Set.of(MAX_ITER, STOP_NO_IMPROVE, TABU_TENURE, NEIGHBORHOOD_TYPE, N_NEIGHBORS, TABU_KEY);

    @Builder.Default
    int maxIter = 2000;
    /** Consecutive iterations without a new best-ever cost that end the search. */
    @Builder.Default
    int stopNoImprove = 200;
    /** Number of most recent accepted keys that stay tabu. */
    @Builder.Default
    int tabuTenure = 10;
    @Builder.Default
    MoveType neighborhoodType = MoveType.TWO_OPT;
    /** Candidate moves sampled per iteration. */
    @Builder.Default
    int nNeighbors = 30;
    @Builder.Default
    TabuKeyType tabuKey = TabuKeyType.MOVE;

    public static TabuSearchConfig fromMap(Map<String, ?> raw) {
        ParameterMap params = ParameterMap.of(raw, PARAMETER_NAMES);
        return TabuSearchConfig.builder()
                .maxIter(params.intValue(MAX_ITER, 2000))
                .stopNoImprove(params.intValue(STOP_NO_IMPROVE, 200))
                .tabuTenure(params.intValue(TABU_TENURE, 10))
                .neighborhoodType(params.optionValue(NEIGHBORHOOD_TYPE, MoveType.TWO_OPT, MoveType::fromId))
                .nNeighbors(params.intValue(N_NEIGHBORS, 30))
                .tabuKey(params.optionValue(TABU_KEY, TabuKeyType.MOVE, TabuKeyType::fromId))
                .build()
                .validated();
    }

    public TabuSearchConfig validated() {
        ParameterMap.requireAtLeast(MAX_ITER, maxIter, 0);
        ParameterMap.requireAtLeast(STOP_NO_IMPROVE, stopNoImprove, 1);
        ParameterMap.requireAtLeast(TABU_TENURE, tabuTenure, 1);
        ParameterMap.requirePresent(NEIGHBORHOOD_TYPE, neighborhoodType);
        ParameterMap.requireAtLeast(N_NEIGHBORS, nNeighbors, 1);
        ParameterMap.requirePresent(TABU_KEY, tabuKey);
        return this;
    }

    public Map<String, Object> toMeta() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(MAX_ITER, maxIter);
        meta.put(STOP_NO_IMPROVE, stopNoImprove);
        meta.put(TABU_TENURE, tabuTenure);
        meta.put(NEIGHBORHOOD_TYPE, neighborhoodType.id());
        meta.put(N_NEIGHBORS, nNeighbors);
        meta.put(TABU_KEY, tabuKey.id());
        return meta;
    }
}
