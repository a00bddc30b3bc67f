package org.navql.engine.syntax;

import org.navql.engine.error.Mark;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A function call: {@code name(arguments)}.
 */
public record ApplySyntax(String name, List<Syntax> arguments, Mark mark) implements Syntax {

    public ApplySyntax {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <T> T accept(SyntaxVisitor<T> visitor) {
        return visitor.visitApply(this);
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(Object::toString).collect(Collectors.joining(",", "(", ")"));
    }
}
