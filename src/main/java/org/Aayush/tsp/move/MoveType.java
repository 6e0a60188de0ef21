package org.Aayush.tsp.move;

import java.util.Locale;

/**
 * Neighborhood operators over a closed tour.
 *
 * <p>{@code SWAP} exchanges the cities at two positions.</p>
 * <p>{@code INSERT} removes the city at one position and re-inserts it at another.</p>
 * <p>{@code TWO_OPT} reverses the contiguous sub-sequence between two positions.</p>
 */
public enum MoveType {
    SWAP("swap"),
    INSERT("insert"),
    TWO_OPT("two_opt");

    private final String id;

    MoveType(String id) {
        this.id = id;
    }

    /**
     * @return canonical parameter id ({@code swap}, {@code insert}, {@code two_opt}).
     */
    public String id() {
        return id;
    }

    /**
     * Resolves a parameter id (case-insensitive), or returns null when it is not recognized.
     */
    public static MoveType fromId(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (MoveType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
