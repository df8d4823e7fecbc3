package io.github.eutro.llair.util;

/**
 * Helpers for writing canonical s-expression forms.
 */
public final class Sexps {
    private Sexps() {
    }

    /**
     * Append {@code s} as a double-quoted string, escaping quotes and backslashes.
     *
     * @param sb The builder to append to.
     * @param s  The string.
     */
    public static void appendQuoted(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        sb.append('"');
    }
}
