package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A numeric literal.
 */
public record NumberSyntax(String text, Kind kind, Mark mark) implements Syntax {

    /**
     * The lexical form of the number, which determines its domain.
     */
    public enum Kind {
        INTEGER,
        DECIMAL,
        FLOAT
    }

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return text;
    }
}
