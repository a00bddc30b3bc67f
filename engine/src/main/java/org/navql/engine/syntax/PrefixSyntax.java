package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A unary prefix operator: {@code !}, {@code -} or {@code +}.
 */
public record PrefixSyntax(String symbol, Syntax arm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitPrefix(this);
    }

    @Override
    public String toString() {
        return symbol + arm;
    }
}
