package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A quotient: {@code larm ^ rarm}; {@code rarm} is a single kernel or a record of kernels.
 */
public record ProjectSyntax(Syntax larm, Syntax rarm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitProject(this);
    }

    @Override
    public String toString() {
        return larm + "^" + rarm;
    }
}
