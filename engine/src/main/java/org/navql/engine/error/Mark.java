package org.navql.engine.error;

import java.util.Objects;

/**
 * A half-open character range {@code [start, end)} of the query text.
 *
 * <p>Marks identify the syntax fragment responsible for an error. They are
 * provenance only and never take part in the equality of the nodes that
 * carry them.
 *
 * @param text  The full query text
 * @param start Inclusive start offset
 * @param end   Exclusive end offset
 */
public record Mark(String text, int start, int end) {

    public Mark {
        Objects.requireNonNull(text, "Mark text cannot be null");
        if (start < 0 || end < start || end > text.length()) {
            throw new IllegalArgumentException(
                    "Invalid mark range [" + start + ", " + end + ") for text of length " + text.length());
        }
    }

    /**
     * A mark with no source, used for nodes synthesized by the translator.
     */
    public static Mark empty() {
        return new Mark("", 0, 0);
    }

    /**
     * The smallest mark covering all the given marks.
     */
    public static Mark union(Mark... marks) {
        Mark result = null;
        for (Mark mark : marks) {
            if (mark == null || mark.text.isEmpty()) {
                continue;
            }
            if (result == null) {
                result = mark;
            } else if (result.text.equals(mark.text)) {
                result = new Mark(result.text, Math.min(result.start, mark.start), Math.max(result.end, mark.end));
            }
        }
        return result != null ? result : empty();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public String fragment() {
        return text.substring(start, end);
    }

    /**
     * Renders the line containing the mark with a caret line underneath.
     */
    public String excerpt() {
        if (text.isEmpty()) {
            return "";
        }
        int lineStart = text.lastIndexOf('\n', start - 1) + 1;
        int lineEnd = text.indexOf('\n', start);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        int caretEnd = Math.min(Math.max(end, start + 1), lineEnd);
        StringBuilder sb = new StringBuilder();
        sb.append("    ").append(text, lineStart, lineEnd).append('\n');
        sb.append("    ").append(" ".repeat(start - lineStart));
        sb.append("^".repeat(Math.max(caretEnd - start, 1)));
        return sb.toString();
    }
}
