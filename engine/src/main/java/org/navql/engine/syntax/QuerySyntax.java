package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * The whole query: {@code /} followed by an optional flow; {@code arm} is null for {@code /} alone.
 */
public record QuerySyntax(Syntax arm, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitQuery(this);
    }

    @Override
    public String toString() {
        return "/" + (arm != null ? arm : "");
    }
}
