package com.example.querygate.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL text into alternating plain and single-quoted literal segments.
 */
public final class LiteralScanner {
    private LiteralScanner() {
    }

    public record Segment(String text, boolean literal) {
    }

    public static List<Segment> split(String sql) {
        List<Segment> segments = new ArrayList<>();
        if (sql == null || sql.isEmpty()) {
            return segments;
        }
        int segmentStart = 0;
        boolean inLiteral = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            char next = i + 1 < sql.length() ? sql.charAt(i + 1) : '\0';

            if (!inLiteral) {
                if (c == '\'') {
                    addSegment(segments, sql, segmentStart, i, false);
                    segmentStart = i;
                    inLiteral = true;
                }
                continue;
            }

            if (c == '\\' && i + 1 < sql.length()) {
                i++;
            } else if (c == '\'' && next == '\'') {
                i++;
            } else if (c == '\'') {
                addSegment(segments, sql, segmentStart, i + 1, true);
                segmentStart = i + 1;
                inLiteral = false;
            }
        }

        // an unterminated literal still runs to the end of the text
        addSegment(segments, sql, segmentStart, sql.length(), inLiteral);
        return segments;
    }

    private static void addSegment(List<Segment> segments, String sql, int start, int end, boolean literal) {
        if (end > start) {
            segments.add(new Segment(sql.substring(start, end), literal));
        }
    }
}
