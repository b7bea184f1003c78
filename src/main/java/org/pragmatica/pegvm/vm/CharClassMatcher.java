package org.pragmatica.pegvm.vm;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Matches one character against a class such as {@code [a-z_]}, {@code [^"\\]} or {@code [a-f]i}.
 *
 * <p>Two matchers are equal when their patterns are equal.
 */
public final class CharClassMatcher implements Matcher {
    private final String pattern;
    private final boolean inverted;
    private final boolean ignoreCase;
    private final char[] lows;
    private final char[] highs;

    private CharClassMatcher(String pattern, boolean inverted, boolean ignoreCase, char[] lows, char[] highs) {
        this.pattern = pattern;
        this.inverted = inverted;
        this.ignoreCase = ignoreCase;
        this.lows = lows;
        this.highs = highs;
    }

    public static CharClassMatcher of(String pattern) {
        var ignoreCase = pattern.endsWith("]i");
        var close = ignoreCase ? pattern.length() - 2 : pattern.length() - 1;
        Preconditions.checkArgument(pattern.startsWith("[") && close > 0 && pattern.charAt(close) == ']',
                                    "Malformed character class %s", pattern);
        var start = 1;
        var inverted = close > 1 && pattern.charAt(1) == '^';
        if (inverted) {
            start = 2;
        }
        var lows = new char[close];
        var highs = new char[close];
        var count = 0;
        var i = start;
        while (i < close) {
            var low = pattern.charAt(i);
            var consumed = 1;
            if (low == '\\' && i + 1 < close) {
                var escape = readEscape(pattern, i + 1, close);
                low = escape[0];
                consumed = 1 + escape[1];
            }
            i += consumed;
            var high = low;
            if (i + 1 < close && pattern.charAt(i) == '-') {
                high = pattern.charAt(i + 1);
                consumed = 1;
                if (high == '\\' && i + 2 < close) {
                    var escape = readEscape(pattern, i + 2, close);
                    high = escape[0];
                    consumed = 1 + escape[1];
                }
                i += 1 + consumed;
            }
            if (ignoreCase) {
                low = Character.toLowerCase(low);
                high = Character.toLowerCase(high);
            }
            lows[count] = low;
            highs[count] = high;
            count++;
        }
        return new CharClassMatcher(pattern, inverted, ignoreCase, Arrays.copyOf(lows, count), Arrays.copyOf(highs, count));
    }

    // Returns {char, chars consumed after the backslash}
    private static char[] readEscape(String pattern, int at, int limit) {
        var escaped = pattern.charAt(at);
        switch (escaped) {
            case 'n':
                return new char[]{'\n', 1};
            case 'r':
                return new char[]{'\r', 1};
            case 't':
                return new char[]{'\t', 1};
            case 'x':
                if (at + 3 <= limit && isHex(pattern, at + 1, 2)) {
                    return new char[]{(char) Integer.parseInt(pattern.substring(at + 1, at + 3), 16), 3};
                }
                return new char[]{'x', 1};
            case 'u':
                if (at + 5 <= limit && isHex(pattern, at + 1, 4)) {
                    return new char[]{(char) Integer.parseInt(pattern.substring(at + 1, at + 5), 16), 5};
                }
                return new char[]{'u', 1};
            default:
                return new char[]{escaped, 1};
        }
    }

    private static boolean isHex(String text, int from, int length) {
        for (int i = from; i < from + length; i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    public String pattern() {
        return pattern;
    }

    public boolean inverted() {
        return inverted;
    }

    public boolean ignoreCase() {
        return ignoreCase;
    }

    @Override
    public int match(CharSequence input, int pos) {
        if (pos >= input.length()) {
            return -1;
        }
        var c = input.charAt(pos);
        var test = ignoreCase ? Character.toLowerCase(c) : c;
        var inClass = false;
        for (int i = 0; i < lows.length && !inClass; i++) {
            inClass = test >= lows[i] && test <= highs[i];
        }
        return inClass != inverted ? 1 : -1;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CharClassMatcher other && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
