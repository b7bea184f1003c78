package org.pragmatica.pegvm.tree;

/**
 * A range in grammar source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    /**
     * Span used for expressions built programmatically rather than read from text.
     */
    public static final SourceSpan UNKNOWN = new SourceSpan(SourceLocation.START, SourceLocation.START);

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
