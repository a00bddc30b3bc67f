package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A sort direction suffix: {@code arm+} or {@code arm-}.
 */
public record DirectSyntax(String symbol, Syntax arm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitDirect(this);
    }

    @Override
    public String toString() {
        return arm + symbol;
    }
}
