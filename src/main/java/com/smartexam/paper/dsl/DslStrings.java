package com.smartexam.paper.dsl;

/**
 * Quoting rules of markup string values: backslash, double quote and newline are escaped.
 */
public final class DslStrings {

    private DslStrings() {}

    public static String quote(String value) {
        return "\"" + escape(value) + "\"";
    }

    public static String escape(String value) {
        if (value == null) return "";
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Lenient inverse of {@link #escape}: unknown escapes keep the escaped character and a dangling
     * backslash is kept as is, since markup may come from other producers.
     */
    public static String unescape(String raw) {
        if (raw == null) return "";
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i + 1 >= raw.length()) {
                sb.append('\\');
                break;
            }
            char n = raw.charAt(++i);
            switch (n) {
                case 'n' -> sb.append('\n');
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                default -> sb.append(n);
            }
        }
        return sb.toString();
    }

    /**
     * Value part of a {@code KEY: value} line with surrounding quotes removed and escapes resolved.
     */
    public static String fieldValue(String line) {
        int colon = line.indexOf(':');
        String value = (colon < 0 ? line : line.substring(colon + 1)).trim();
        if (value.startsWith("\"")) {
            value = value.substring(1);
            if (value.endsWith("\"")) value = value.substring(0, value.length() - 1);
        }
        return unescape(value);
    }
}
