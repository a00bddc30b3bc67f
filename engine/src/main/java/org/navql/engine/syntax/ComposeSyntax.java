package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * Navigation: {@code larm.rarm}.
 */
public record ComposeSyntax(Syntax larm, Syntax rarm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitCompose(this);
    }

    @Override
    public String toString() {
        return larm + "." + rarm;
    }
}
