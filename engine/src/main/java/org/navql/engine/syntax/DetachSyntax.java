package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A detached expression {@code @arm}, evaluated in the root scope.
 */
public record DetachSyntax(Syntax arm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitDetach(this);
    }

    @Override
    public String toString() {
        return "@" + arm;
    }
}
