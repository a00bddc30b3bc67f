package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A record of expressions: {@code {a, b, c}}.
 */
public record RecordSyntax(List<Syntax> arms, Mark mark) implements Syntax {

    public RecordSyntax {
        arms = List.copyOf(arms);
    }

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitRecord(this);
    }

    @Override
    public String toString() {
        return arms.stream().map(Object::toString).collect(Collectors.joining(",", "{", "}"));
    }
}
