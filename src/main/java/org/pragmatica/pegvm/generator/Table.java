package org.pragmatica.pegvm.generator;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only, insertion-ordered table with optional deduplication.
 */
final class Table<T> {
    private final List<T> entries = new ArrayList<>();
    private final Map<T, Integer> indices;

    private Table(boolean deduplicated) {
        this.indices = deduplicated ? new HashMap<>() : null;
    }

    static <T> Table<T> of(TableKind kind) {
        return new Table<>(kind.deduplicated());
    }

    int insert(T entry) {
        if (indices != null) {
            var existing = indices.get(entry);
            if (existing != null) {
                return existing;
            }
            indices.put(entry, entries.size());
        }
        entries.add(entry);
        return entries.size() - 1;
    }

    int size() {
        return entries.size();
    }

    ImmutableList<T> snapshot() {
        return ImmutableList.copyOf(entries);
    }
}
