package org.pragmatica.pegvm.generator;

import com.google.common.collect.ImmutableList;
import org.pragmatica.pegvm.vm.Matcher;
import org.pragmatica.pegvm.vm.ThunkInfo;

/**
 * The four side tables of a program under construction.
 *
 * <p>Matchers and strings are deduplicated by structural equality; thunks are not, so two
 * identical code blocks at different grammar positions keep distinct entries. Indices start
 * at 0, are assigned in insertion order and never change.
 */
public final class TableBuilder {
    private final Table<Matcher> matchers = Table.of(TableKind.MATCHERS);
    private final Table<String> strings = Table.of(TableKind.STRINGS);
    private final Table<ThunkInfo> actionThunks = Table.of(TableKind.ACTION_THUNKS);
    private final Table<ThunkInfo> predicateThunks = Table.of(TableKind.PREDICATE_THUNKS);

    public int insertMatcher(Matcher matcher) {
        return matchers.insert(matcher);
    }

    public int insertString(String value) {
        return strings.insert(value);
    }

    public int insertAction(ThunkInfo thunk) {
        return actionThunks.insert(thunk);
    }

    public int insertPredicate(ThunkInfo thunk) {
        return predicateThunks.insert(thunk);
    }

    public int size(TableKind kind) {
        return switch (kind) {
            case MATCHERS -> matchers.size();
            case STRINGS -> strings.size();
            case ACTION_THUNKS -> actionThunks.size();
            case PREDICATE_THUNKS -> predicateThunks.size();
        };
    }

    public ImmutableList<Matcher> matchers() {
        return matchers.snapshot();
    }

    public ImmutableList<String> strings() {
        return strings.snapshot();
    }

    public ImmutableList<ThunkInfo> actionThunks() {
        return actionThunks.snapshot();
    }

    public ImmutableList<ThunkInfo> predicateThunks() {
        return predicateThunks.snapshot();
    }
}
