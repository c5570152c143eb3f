package io.lighting.zweig.ast;

/**
 * Source position of a node: 1-based line and 0-based column offset.
 */
public record Position(int line, int column) {
    public Position {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1: " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must be >= 0: " + column);
        }
    }
}
