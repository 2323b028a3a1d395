package org.pragmatica.combinator.tree;

/**
 * A range on a single source line (line and columns, all 1-based, end column inclusive).
 */
public record Span(int line, int colStart, int colEnd) {

    /**
     * Span used when no token is available, e.g. for empty input.
     */
    public static final Span DEFAULT = new Span(1, 1, 1);

    public Span {
        if (line < 1 || colStart < 1) {
            throw new IllegalArgumentException("Span coordinates are 1-based: " + line + ":" + colStart);
        }
        if (colEnd < colStart) {
            throw new IllegalArgumentException("Span end column " + colEnd + " precedes start column " + colStart);
        }
    }

    public static Span at(int line, int colStart, int colEnd) {
        return new Span(line, colStart, colEnd);
    }

    /**
     * Number of columns covered by this span.
     */
    public int width() {
        return colEnd - colStart + 1;
    }

    @Override
    public String toString() {
        return line + ":" + colStart + "-" + colEnd;
    }
}
