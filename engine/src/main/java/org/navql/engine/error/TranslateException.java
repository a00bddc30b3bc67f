package org.navql.engine.error;

/**
 * Base of the errors caused by the query itself.
 *
 * <p>A translate error carries the {@link Mark} of the offending fragment
 * and an optional hint. Translation stops at the first one; no SQL is
 * executed for a query that fails to translate.
 */
public class TranslateException extends RuntimeException {

    private final Mark mark;
    private final String hint;

    public TranslateException(String message, Mark mark) {
        this(message, mark, null);
    }

    public TranslateException(String message, Mark mark, String hint) {
        super(message);
        this.mark = mark != null ? mark : Mark.empty();
        this.hint = hint;
    }

    public TranslateException(String message, Throwable cause) {
        super(message, cause);
        this.mark = Mark.empty();
        this.hint = null;
    }

    public Mark getMark() {
        return mark;
    }

    public String getHint() {
        return hint;
    }

    public boolean hasLocation() {
        return !mark.isEmpty();
    }

    /**
     * The message followed by the hint and an excerpt of the query.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (hint != null) {
            sb.append(": ").append(hint);
        }
        if (hasLocation()) {
            sb.append('\n').append("While translating:\n").append(mark.excerpt());
        }
        return sb.toString();
    }
}
