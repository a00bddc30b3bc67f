package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A link: {@code larm -> rarm}.
 */
public record LinkSyntax(Syntax larm, Syntax rarm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitLink(this);
    }

    @Override
    public String toString() {
        return larm + "->" + rarm;
    }
}
