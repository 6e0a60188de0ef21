package org.Aayush.tsp.move;

import java.util.Objects;

/**
 * One neighborhood move identified by its operator and two affected positions.
 *
 * <p>For {@link MoveType#INSERT}, {@code i} is the removal position and {@code j} the insertion
 * position. {@link MoveType#SWAP} and {@link MoveType#TWO_OPT} are symmetric in their positions and are
 * normalized so that {@code i < j}.</p>
 *
 * @param type operator.
 * @param i first position (0-based).
 * @param j second position (0-based, distinct from {@code i}).
 */
public record Move(MoveType type, int i, int j) {

    public Move {
        Objects.requireNonNull(type, "type");
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("move positions must be >= 0, got (" + i + "," + j + ")");
        }
        if (i == j) {
            throw new IllegalArgumentException("move positions must differ, got (" + i + "," + j + ")");
        }
        if (type != MoveType.INSERT && i > j) {
            int tmp = i;
            i = j;
            j = tmp;
        }
    }

    /**
     * Returns the tabu key of this move: the position pair, independent of the operator.
     */
    public PositionKey positionKey() {
        return new PositionKey(i, j);
    }

    /**
     * Position-pair identity used by tabu memory.
     *
     * @param i first position.
     * @param j second position.
     */
    public record PositionKey(int i, int j) {
    }
}
