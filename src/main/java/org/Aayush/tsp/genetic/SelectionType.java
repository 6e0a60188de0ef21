package org.Aayush.tsp.genetic;

import java.util.Locale;

/**
 * Parent selection scheme.
 */
public enum SelectionType {
    /** Best of {@code tournament_size} distinct random individuals. */
    TOURNAMENT("tournament"),
    /** Fitness-proportional with weight {@code 1 / (cost + 1e-9)}. */
    ROULETTE("roulette"),
    /** Rank-proportional: best gets weight N, worst gets 1. */
    RANKING("ranking");

    private final String id;

    SelectionType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static SelectionType fromId(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SelectionType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
