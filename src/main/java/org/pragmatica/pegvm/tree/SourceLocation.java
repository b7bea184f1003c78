package org.pragmatica.pegvm.tree;

/**
 * A position in grammar source text (line and column, both 1-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
