package org.pragmatica.pegvm.generator;

import com.google.common.primitives.ImmutableIntArray;

/**
 * Ordered set of label string indices visible at a point of a rule body.
 */
record LabelScope(ImmutableIntArray labels) {

    static final LabelScope EMPTY = new LabelScope(ImmutableIntArray.of());

    LabelScope with(int label) {
        if (labels.contains(label)) {
            return this;
        }
        return new LabelScope(ImmutableIntArray.builder(labels.length() + 1)
                                               .addAll(labels)
                                               .add(label)
                                               .build());
    }

    LabelScope withAll(LabelScope other) {
        var result = this;
        for (int i = 0; i < other.labels.length(); i++) {
            result = result.with(other.labels.get(i));
        }
        return result;
    }
}
