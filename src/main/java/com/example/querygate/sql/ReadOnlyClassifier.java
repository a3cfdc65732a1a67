package com.example.querygate.sql;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a statement is read-only by looking at its leading keyword.
 * Leading whitespace, line comments ({@code --}, {@code #}) and block comments are skipped first.
 * A leading block comment that opens another {@code /*} or starts with {@code /*!} is not skipped and
 * rejects the statement, since nesting and executable comments vary by database. A second statement
 * after a {@code ;} also rejects it.
 */
public final class ReadOnlyClassifier {
    public static final String EMPTY_QUERY_MESSAGE = "Please pass a valid query";
    public static final String NOT_READ_ONLY_MESSAGE =
            "Only read-only queries are allowed (SELECT, SHOW, EXPLAIN, DESCRIBE, DESC, WITH … SELECT).";

    private static final Set<String> ALLOW_LIST = Set.of(
            "SELECT",
            "SHOW",
            "EXPLAIN",
            "DESCRIBE",
            "DESC",
            "WITH",
            "VALUES",
            "TABLE"
    );

    // SELECT must follow the common table expressions
    private static final Pattern WITH_SELECT_PATTERN =
            Pattern.compile("^with\\s+.*\\bselect\\b", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    static final int UNSAFE_COMMENT = -1;

    private ReadOnlyClassifier() {
    }

    public static Classification classify(String query) {
        if (query == null) {
            return Classification.rejected(Classification.Verdict.EMPTY_QUERY, EMPTY_QUERY_MESSAGE);
        }
        int start = skipLeadingComments(query);
        if (start == UNSAFE_COMMENT) {
            return Classification.rejected(Classification.Verdict.NOT_READ_ONLY, NOT_READ_ONLY_MESSAGE);
        }
        int end = start;
        while (end < query.length() && !Character.isWhitespace(query.charAt(end))) {
            end++;
        }
        if (start == end) {
            return Classification.rejected(Classification.Verdict.EMPTY_QUERY, EMPTY_QUERY_MESSAGE);
        }

        String firstWord = query.substring(start, end).toUpperCase(Locale.ROOT);
        boolean readOnly = ALLOW_LIST.contains(firstWord);
        if (readOnly && firstWord.equals("WITH")) {
            readOnly = WITH_SELECT_PATTERN.matcher(query).region(start, query.length()).find();
        }
        if (readOnly && StackedStatementDetector.hasStackedStatement(query)) {
            readOnly = false;
        }

        if (!readOnly) {
            return Classification.rejected(Classification.Verdict.NOT_READ_ONLY, NOT_READ_ONLY_MESSAGE);
        }
        return Classification.accepted();
    }

    static int skipLeadingComments(String query) {
        int i = 0;
        int length = query.length();
        while (i < length) {
            char c = query.charAt(i);
            char next = i + 1 < length ? query.charAt(i + 1) : '\0';

            if (Character.isWhitespace(c)) {
                i++;
            } else if ((c == '-' && next == '-') || c == '#') {
                while (i < length && query.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && next == '*') {
                int close = query.indexOf("*/", i + 2);
                String body = query.substring(i + 2, close < 0 ? length : close);
                if (body.startsWith("!") || body.contains("/*")) {
                    return UNSAFE_COMMENT;
                }
                i = close < 0 ? length : close + 2;
            } else {
                break;
            }
        }
        return i;
    }
}
