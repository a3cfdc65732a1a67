package com.example.querygate.sql;

/**
 * Finds statement text following a {@code ;} terminator.
 * <p>
 * Quoting and comment syntax differ between databases (backslash escapes, {@code #} comments,
 * {@code $$} strings), so the text is scanned once per combination of those rules. A second statement
 * seen by any of the readings counts, so text after a trailing {@code ;} must be whitespace or further {@code ;}.
 */
public final class StackedStatementDetector {
    private static final int BACKSLASH_ESCAPES = 1;
    private static final int DASH_COMMENTS = 1 << 1;
    private static final int HASH_COMMENTS = 1 << 2;
    private static final int BLOCK_COMMENTS = 1 << 3;
    private static final int DOLLAR_QUOTES = 1 << 4;
    private static final int READINGS = 1 << 5;

    private StackedStatementDetector() {
    }

    public static boolean hasStackedStatement(String sql) {
        if (sql == null || sql.indexOf(';') < 0) {
            return false;
        }
        for (int rules = 0; rules < READINGS; rules++) {
            if (hasStackedStatement(sql, rules)) {
                return true;
            }
        }
        return false;
    }

    static boolean hasStackedStatement(String sql, int rules) {
        boolean terminated = false;
        int length = sql.length();
        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            char next = i + 1 < length ? sql.charAt(i + 1) : '\0';

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if ((enabled(rules, DASH_COMMENTS) && c == '-' && next == '-') || (enabled(rules, HASH_COMMENTS) && c == '#')) {
                int lineEnd = sql.indexOf('\n', i);
                i = lineEnd < 0 ? length : lineEnd + 1;
                continue;
            }
            if (enabled(rules, BLOCK_COMMENTS) && c == '/' && next == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? length : close + 2;
                continue;
            }

            if (c == ';') {
                terminated = true;
                i++;
                continue;
            }
            if (terminated) {
                return true;
            }

            if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(sql, i, enabled(rules, BACKSLASH_ESCAPES));
            } else if (c == '$' && enabled(rules, DOLLAR_QUOTES) && dollarTagEnd(sql, i) > 0) {
                String tag = sql.substring(i, dollarTagEnd(sql, i) + 1);
                int close = sql.indexOf(tag, i + tag.length());
                i = close < 0 ? length : close + tag.length();
            } else {
                i++;
            }
        }
        return false;
    }

    private static int skipQuoted(String sql, int open, boolean backslashEscapes) {
        char quote = sql.charAt(open);
        int i = open + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (backslashEscapes && c == '\\') {
                i += 2;
            } else if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }

    /**
     * Index of the closing {@code $} of a dollar-quote tag such as {@code $$} or {@code $body$}, or -1.
     */
    private static int dollarTagEnd(String sql, int start) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '$') {
                return i;
            }
            if (!(Character.isLetter(c) || c == '_' || (i > start + 1 && Character.isDigit(c)))) {
                return -1;
            }
            i++;
        }
        return -1;
    }

    private static boolean enabled(int rules, int rule) {
        return (rules & rule) != 0;
    }
}
