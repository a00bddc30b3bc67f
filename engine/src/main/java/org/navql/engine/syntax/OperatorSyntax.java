package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A binary operator.
 */
public record OperatorSyntax(String symbol, Syntax larm, Syntax rarm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitOperator(this);
    }

    @Override
    public String toString() {
        return larm + symbol + rarm;
    }
}
