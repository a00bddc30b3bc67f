package org.navql.engine.error;

/**
 * Exception thrown when the rewriter meets an expression it cannot simplify.
 */
public class RewriteException extends TranslateException {

    public RewriteException(String message, Mark mark) {
        super(message, mark);
    }

    public RewriteException(String message, Mark mark, String hint) {
        super(message, mark, hint);
    }
}
