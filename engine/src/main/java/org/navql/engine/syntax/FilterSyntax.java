package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A sieve: {@code larm ? rarm}.
 */
public record FilterSyntax(Syntax larm, Syntax rarm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitFilter(this);
    }

    @Override
    public String toString() {
        return larm + "?" + rarm;
    }
}
