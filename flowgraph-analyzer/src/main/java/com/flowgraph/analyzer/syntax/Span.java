package com.flowgraph.analyzer.syntax;

/**
 * Byte and row/column extent of a syntax node. Rows and columns are zero-based.
 */
public record Span(int startByte, int endByte, int startRow, int startColumn, int endRow, int endColumn) {

    public static final Span EMPTY = new Span(0, 0, 0, 0, 0, 0);

    /** One-based source line of the node start. */
    public int line() {
        return startRow + 1;
    }
}
