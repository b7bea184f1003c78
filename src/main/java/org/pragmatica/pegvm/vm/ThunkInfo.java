package org.pragmatica.pegvm.vm;

import com.google.common.primitives.ImmutableIntArray;
import org.pragmatica.pegvm.tree.SourceSpan;

/**
 * A semantic code block the machine invokes through {@code CallA} or {@code CallB}.
 *
 * @param code         raw code as written in the grammar
 * @param paramIndices string-table indices of the labels passed to the code, in order
 * @param ruleIndex    rule that owns the code block
 * @param span         position of the code block in the grammar
 */
public record ThunkInfo(String code, ImmutableIntArray paramIndices, int ruleIndex, SourceSpan span) {}
