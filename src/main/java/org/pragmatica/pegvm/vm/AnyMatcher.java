package org.pragmatica.pegvm.vm;

/**
 * Matches any single character.
 */
public record AnyMatcher() implements Matcher {

    @Override
    public int match(CharSequence input, int pos) {
        if (pos >= input.length()) {
            return -1;
        }
        return Character.charCount(Character.codePointAt(input, pos));
    }

    @Override
    public String toString() {
        return ".";
    }
}
