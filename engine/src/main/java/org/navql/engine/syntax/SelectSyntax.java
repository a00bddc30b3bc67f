package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A selection: {@code larm {a, b}}.
 */
public record SelectSyntax(Syntax larm, RecordSyntax rarm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitSelect(this);
    }

    @Override
    public String toString() {
        return larm.toString() + rarm;
    }
}
