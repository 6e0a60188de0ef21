package org.Aayush.tsp.core;

import java.util.Locale;

/**
 * Heuristics exposed by {@link TourCore}.
 */
public enum SolverAlgorithm {
    HILL_CLIMBING("ihc"),
    SIMULATED_ANNEALING("sa"),
    TABU_SEARCH("tabu"),
    GRASP("grasp"),
    GENETIC_ALGORITHM("ga"),
    NEAREST_NEIGHBOR("nn");

    private final String id;

    SolverAlgorithm(String id) {
        this.id = id;
    }

    /**
     * @return short id used on the command line and in logs.
     */
    public String id() {
        return id;
    }

    /**
     * Resolves a short id or enum name (case-insensitive), or returns null.
     */
    public static SolverAlgorithm fromId(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SolverAlgorithm algorithm : values()) {
            if (algorithm.id.equals(normalized) || algorithm.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return algorithm;
            }
        }
        return null;
    }
}
