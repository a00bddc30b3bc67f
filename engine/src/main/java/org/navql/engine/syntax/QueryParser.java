package org.navql.engine.syntax;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.navql.engine.error.Mark;
import org.navql.engine.error.ParseException;

/**
 * Query parser using the ANTLR-generated lexer and parser.
 *
 * <p>Examples:
 * <ul>
 *   <li>{@code /school}</li>
 *   <li>{@code /school?campus='old'{name, count(department)}}</li>
 *   <li>{@code /course^department{*, count(^)}}</li>
 * </ul>
 */
public final class QueryParser {

    private QueryParser() {
        // Static utility class
    }

    /**
     * Parses a query.
     *
     * @param query The query text, starting with {@code /}
     * @return The syntax tree
     * @throws ParseException if the text is not a valid query
     */
    public static QuerySyntax parse(String query) {
        ErrorListener listener = new ErrorListener(query);
        NavqlLexer lexer = new NavqlLexer(CharStreams.fromString(query));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        NavqlParser parser = new NavqlParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        NavqlParser.QueryContext tree = parser.query();
        return (QuerySyntax) new SyntaxBuilder(query).visit(tree);
    }

    private static class ErrorListener extends BaseErrorListener {

        private final String query;

        ErrorListener(String query) {
            this.query = query;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            int start = query.length();
            int end = query.length();
            if (offendingSymbol instanceof Token token && token.getType() != Token.EOF) {
                start = Math.min(token.getStartIndex(), query.length());
                end = Math.max(start, Math.min(token.getStopIndex() + 1, query.length()));
            } else if (recognizer instanceof NavqlLexer lexer) {
                start = Math.min(lexer._tokenStartCharIndex, query.length());
                end = Math.min(start + 1, query.length());
            }
            throw new ParseException(msg, new Mark(query, start, end), line, charPositionInLine);
        }
    }
}
