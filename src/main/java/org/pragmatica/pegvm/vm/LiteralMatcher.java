package org.pragmatica.pegvm.vm;

/**
 * Matches a fixed string, optionally ignoring case. Case-insensitive text is kept in lower case,
 * so literals differing only in case are equal.
 */
public record LiteralMatcher(String text, boolean ignoreCase) implements Matcher {

    public LiteralMatcher {
        if (ignoreCase) {
            text = lowerCase(text);
        }
    }

    @Override
    public int match(CharSequence input, int pos) {
        if (input.length() - pos < text.length()) {
            return -1;
        }
        for (int i = 0; i < text.length(); i++) {
            char expected = text.charAt(i);
            char actual = input.charAt(pos + i);
            if (ignoreCase) {
                if (expected != Character.toLowerCase(actual)) {
                    return -1;
                }
            } else if (expected != actual) {
                return -1;
            }
        }
        return text.length();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        if (ignoreCase) {
            sb.append('i');
        }
        return sb.toString();
    }

    private static String lowerCase(String text) {
        var chars = text.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }
}
