package org.pragmatica.pegvm.generator;

/**
 * The side tables instructions index into.
 */
public enum TableKind {
    MATCHERS(true),
    STRINGS(true),
    ACTION_THUNKS(false),
    PREDICATE_THUNKS(false);

    private final boolean deduplicated;

    TableKind(boolean deduplicated) {
        this.deduplicated = deduplicated;
    }

    /**
     * Whether inserting an entry equal to an existing one returns the existing index.
     */
    public boolean deduplicated() {
        return deduplicated;
    }
}
