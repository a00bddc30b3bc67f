package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

/**
 * A string literal; {@code text} is the unquoted value.
 */
public record StringSyntax(String text, Mark mark) implements Syntax {

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String toString() {
        return "'" + text.replace("'", "''") + "'";
    }
}
