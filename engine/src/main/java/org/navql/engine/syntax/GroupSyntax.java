package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A parenthesized expression.
 */
public record GroupSyntax(Syntax arm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public String toString() {
        return "(" + arm + ")";
    }
}
