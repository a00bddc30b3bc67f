package org.navql.engine.error;

/**
 * Exception thrown when query text cannot be parsed.
 * Includes the line and column reported by the lexer or the parser.
 */
public class ParseException extends TranslateException {

    private final int line;
    private final int column;

    public ParseException(String message, Mark mark, int line, int column) {
        super("line " + line + ":" + column + " " + message, mark);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
