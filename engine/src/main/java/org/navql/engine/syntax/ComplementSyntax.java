package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * The complement of a quotient: {@code ^}.
 */
public record ComplementSyntax(Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitComplement(this);
    }

    @Override
    public String toString() {
        return "^";
    }
}
