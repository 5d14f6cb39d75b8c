package com.techwriter.citation;

import java.util.Objects;

/**
 * A {@code path:start-end} reference to a 1-indexed, inclusive line range.
 *
 * <p>This is the only text format that leaves the pipeline: audit tooling scans reports for it, so
 * {@link #format()} and {@link #parse(String)} must stay exact inverses.
 */
public record Citation(String path, int startLine, int endLine) {

    public Citation {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty() || path.indexOf(':') >= 0 || hasBracketEdge(path)) {
            throw new CitationFormatException(path + ":" + startLine + "-" + endLine, "path must be non-empty without ':' or enclosing brackets");
        }
        if (startLine < 1 || endLine < 1) {
            throw new CitationFormatException(path + ":" + startLine + "-" + endLine, "line numbers must be positive");
        }
        if (startLine > endLine) {
            throw new CitationFormatException(path + ":" + startLine + "-" + endLine, "start line is after end line");
        }
    }

    public static Citation parse(String value) {
        if (value == null) {
            throw new CitationFormatException("null", "citation is null");
        }
        int colon = value.indexOf(':');
        if (colon < 0) {
            throw new CitationFormatException(value, "missing ':' between path and range");
        }
        String path = value.substring(0, colon);
        String span = value.substring(colon + 1);
        if (path.isEmpty()) {
            throw new CitationFormatException(value, "missing path");
        }
        if (hasBracketEdge(path)) {
            throw new CitationFormatException(value, "path has enclosing brackets");
        }
        if (span.indexOf(':') >= 0) {
            throw new CitationFormatException(value, "path must not contain ':'");
        }
        int dash = span.indexOf('-');
        if (dash < 0) {
            throw new CitationFormatException(value, "missing '-' in line range");
        }
        int start = parseBound(value, span.substring(0, dash));
        int end = parseBound(value, span.substring(dash + 1));
        if (start > end) {
            throw new CitationFormatException(value, "start line " + start + " is after end line " + end);
        }
        return new Citation(path, start, end);
    }

    public static String format(String path, int startLine, int endLine) {
        return new Citation(path, startLine, endLine).format();
    }

    public static boolean isValid(String value) {
        try {
            parse(value);
            return true;
        } catch (CitationFormatException e) {
            return false;
        }
    }

    public String format() {
        return path + ":" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return format();
    }

    private static int parseBound(String citation, String raw) {
        if (raw.isEmpty()) {
            throw new CitationFormatException(citation, "missing line number");
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                throw new CitationFormatException(citation, "line number '" + raw + "' is not numeric");
            }
        }
        int bound;
        try {
            bound = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new CitationFormatException(citation, "line number '" + raw + "' is out of range");
        }
        if (bound < 1) {
            throw new CitationFormatException(citation, "line numbers must be positive");
        }
        return bound;
    }

    private static boolean hasBracketEdge(String path) {
        char first = path.charAt(0);
        char last = path.charAt(path.length() - 1);
        return first == '[' || first == ']' || last == '[' || last == ']';
    }
}
