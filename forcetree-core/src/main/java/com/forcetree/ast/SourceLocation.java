package com.forcetree.ast;

import java.util.List;

/**
 * A span of source text. Lines are 1-based and columns are 0-based.
 *
 * <p>Any component may be null. A null start line means the location is unknown.
 */
public record SourceLocation(Integer startLine, Integer startColumn, Integer endLine, Integer endColumn) {

    public static final SourceLocation UNKNOWN = new SourceLocation(null, null, null, null);

    public boolean isUnknown() {
        return startLine == null;
    }

    /**
     * Extracts the text covered by this location.
     *
     * @return the covered text, or null if this location is unknown
     */
    public String extractFrom(String text) {
        if (isUnknown()) {
            return null;
        }
        List<String> lines = text.lines().toList();
        int last = endLine != null ? Math.min(endLine, lines.size()) : lines.size();
        int first = Math.min(startLine - 1, last);
        List<String> slice = lines.subList(Math.max(first, 0), last);
        if (slice.isEmpty()) {
            return "";
        }
        String joined = String.join("\n", slice);
        String lastLine = slice.get(slice.size() - 1);
        int dropEnd = endColumn != null ? Math.max(lastLine.length() - endColumn, 0) : 0;
        int dropStart = startColumn != null ? startColumn : 0;
        int endIndex = joined.length() - dropEnd;
        if (dropStart >= endIndex) {
            return "";
        }
        return joined.substring(dropStart, endIndex);
    }

    /**
     * Returns the smallest location that encloses all given locations. Unknown locations are
     * ignored unless every location is unknown.
     */
    public static SourceLocation span(SourceLocation... locations) {
        SourceLocation result = UNKNOWN;
        for (SourceLocation location : locations) {
            if (location == null || location.isUnknown()) {
                continue;
            }
            result = result.isUnknown() ? location : result.union(location);
        }
        return result;
    }

    private SourceLocation union(SourceLocation other) {
        Integer[] start = pick(startLine, startColumn, other.startLine, other.startColumn, true);
        Integer[] end = pick(endLine, endColumn, other.endLine, other.endColumn, false);
        return new SourceLocation(start[0], start[1], end[0], end[1]);
    }

    /**
     * Chooses the earlier (or later) of two (line, column) positions. A position without a line
     * loses to one with a line as a whole pair; columns are merged only when the lines agree.
     */
    private static Integer[] pick(Integer lineA, Integer columnA, Integer lineB, Integer columnB, boolean earliest) {
        if (lineA == null && lineB != null) {
            return new Integer[]{lineB, columnB};
        }
        if (lineB == null && lineA != null) {
            return new Integer[]{lineA, columnA};
        }
        if (lineA != null && !lineA.equals(lineB)) {
            boolean aFirst = lineA < lineB;
            return aFirst == earliest ? new Integer[]{lineA, columnA} : new Integer[]{lineB, columnB};
        }
        Integer column = earliest ? minOf(columnA, columnB) : maxOf(columnA, columnB);
        return new Integer[]{lineA, column};
    }

    private static Integer minOf(Integer a, Integer b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return Math.min(a, b);
    }

    private static Integer maxOf(Integer a, Integer b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return Math.max(a, b);
    }

    @Override
    public String toString() {
        if (isUnknown()) {
            return "<unknown>";
        }
        return "[" + component(startLine) + ":" + component(startColumn) + ","
            + component(endLine) + ":" + component(endColumn) + "]";
    }

    private static String component(Integer value) {
        return value != null ? value.toString() : "?";
    }
}
