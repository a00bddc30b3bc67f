package org.navql.engine.error;

/**
 * Exception thrown when a binding cannot be expressed as a space or a code.
 */
public class EncodeException extends TranslateException {

    public EncodeException(String message, Mark mark) {
        super(message, mark);
    }

    public EncodeException(String message, Mark mark, String hint) {
        super(message, mark, hint);
    }
}
