package org.Aayush.tsp.genetic;

import java.util.Locale;

/**
 * Permutation crossover operator.
 */
public enum CrossoverType {
    /** Order crossover. */
    OX,
    /** Partially matched crossover. */
    PMX,
    /** Cycle crossover. */
    CX;

    public String id() {
        return name();
    }

    public static CrossoverType fromId(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (CrossoverType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
