package org.navql.engine.error;

/**
 * Exception thrown when an identifier or a function call cannot be resolved.
 */
public class BindException extends TranslateException {

    public BindException(String message, Mark mark) {
        super(message, mark);
    }

    public BindException(String message, Mark mark, String hint) {
        super(message, mark, hint);
    }
}
