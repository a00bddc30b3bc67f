package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A reference to an environment parameter: {@code $name}.
 */
public record ReferenceSyntax(String name, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public String toString() {
        return "$" + name;
    }
}
