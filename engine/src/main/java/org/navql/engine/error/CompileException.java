package org.navql.engine.error;

/**
 * Exception thrown when spaces cannot be compiled to a term tree.
 */
public class CompileException extends TranslateException {

    public CompileException(String message, Mark mark) {
        super(message, mark);
    }

    public CompileException(String message, Mark mark, String hint) {
        super(message, mark, hint);
    }
}
