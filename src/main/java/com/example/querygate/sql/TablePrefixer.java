package com.example.querygate.sql;

import java.util.List;

/**
 * Adds a storage prefix to caller-declared table names inside a SQL string.
 * <p>
 * Only whole identifiers outside single-quoted literals are touched. The rewrite is textual:
 * a column that happens to share a declared table's name is prefixed as well.
 */
public final class TablePrefixer {
    private TablePrefixer() {
    }

    public static String rewrite(String sql, List<String> tables, String prefix) {
        if (sql == null || tables == null || tables.isEmpty() || prefix == null || prefix.isEmpty()) {
            return sql;
        }
        String updated = sql;
        for (String table : tables) {
            if (table == null || table.isBlank()) {
                continue;
            }
            String prefixed = prefixedName(table, prefix);
            if (prefixed == null) {
                continue;
            }
            StringBuilder builder = new StringBuilder(updated.length() + prefix.length() * 4);
            for (LiteralScanner.Segment segment : LiteralScanner.split(updated)) {
                if (segment.literal()) {
                    builder.append(segment.text());
                } else {
                    builder.append(replaceIdentifier(replaceQuoted(segment.text(), table, prefixed), table, prefixed));
                }
            }
            updated = builder.toString();
        }
        return updated;
    }

    /**
     * Returns the prefixed form of a table name, or {@code null} when its table part already carries the prefix.
     * For {@code schema.table} only the table part is prefixed.
     */
    static String prefixedName(String table, String prefix) {
        int dot = table.lastIndexOf('.');
        String schema = dot < 0 ? "" : table.substring(0, dot + 1);
        String name = table.substring(dot + 1);
        if (name.startsWith(prefix)) {
            return null;
        }
        return schema + prefix + name;
    }

    private static String replaceQuoted(String text, String table, String prefixed) {
        return text
                .replace('`' + table + '`', '`' + prefixed + '`')
                .replace('"' + table + '"', '"' + prefixed + '"');
    }

    static String replaceIdentifier(String text, String table, String prefixed) {
        int match = text.indexOf(table);
        if (match < 0) {
            return text;
        }
        StringBuilder builder = new StringBuilder(text.length() + prefixed.length());
        int copied = 0;
        while (match >= 0) {
            int end = match + table.length();
            if (isBoundary(text, match - 1) && isBoundary(text, end)) {
                builder.append(text, copied, match).append(prefixed);
                copied = end;
                match = text.indexOf(table, end);
            } else {
                match = text.indexOf(table, match + 1);
            }
        }
        builder.append(text, copied, text.length());
        return builder.toString();
    }

    private static boolean isBoundary(String text, int index) {
        if (index < 0 || index >= text.length()) {
            return true;
        }
        return !isIdentifierChar(text.charAt(index));
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
