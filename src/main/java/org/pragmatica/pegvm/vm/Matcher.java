package org.pragmatica.pegvm.vm;

/**
 * Compiled, reusable test of the input at a position. Equality is structural, which is
 * what lets the matcher table share entries.
 */
public sealed interface Matcher permits LiteralMatcher, CharClassMatcher, AnyMatcher {

    /**
     * Try to match at {@code pos}.
     *
     * @return number of chars consumed, or -1 when the input does not match
     */
    int match(CharSequence input, int pos);
}
