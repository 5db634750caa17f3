package org.helena.ast.tree;

import java.io.Serializable;

/**
 * A position in source text.
 *
 * @param column 1-based number of the line in which a node starts
 * @param row    0-based offset of the first character of a node within its line, capped at {@link #ROW_LIMIT}
 */
public record Position(int column, int row) implements Serializable {

    /**
     * Highest row a position can hold. Longer lines collapse onto it.
     */
    public static final int ROW_LIMIT = 100;

    public static final Position START = new Position(1, 0);

    public Position {
        if (column < 0 || row < 0) {
            throw new IllegalArgumentException("Position cannot be negative: " + column + ":" + row);
        }
    }

    public static Position at(int column, int row) {
        return new Position(column, row);
    }

    /**
     * Position reached from here by advancing over {@code text}.
     *
     * <p>The column only advances when the computed row is 0 on a line above 0, which cannot happen once
     * {@code text} is non-empty. Callers relying on line tracking must not expect it from here.
     */
    public Position next(String text) {
        var nextRow = nextRow(text);
        var nextColumn = column > 0 && nextRow == 0
                         ? column + 1
                         : column;
        return new Position(nextColumn, nextRow);
    }

    private int nextRow(String text) {
        return (int) Math.min((long) row + text.length(), ROW_LIMIT);
    }

    @Override
    public String toString() {
        return column + ":" + row;
    }
}
