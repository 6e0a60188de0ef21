package org.Aayush.tsp.search;

import java.util.Locale;

/**
 * What identifies an accepted step in tabu memory.
 */
public enum TabuKeyType {
    /** Position pair {@code (i, j)} of the move, independent of operator. */
    MOVE("move"),
    /** Whole resulting permutation. */
    ROUTE("route");

    private final String id;

    TabuKeyType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Case-insensitive lookup; null for unknown ids.
     */
    public static TabuKeyType fromId(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TabuKeyType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
