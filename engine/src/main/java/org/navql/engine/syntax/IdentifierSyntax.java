package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * An identifier.
 */
public record IdentifierSyntax(String name, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
