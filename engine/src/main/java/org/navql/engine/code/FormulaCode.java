package org.navql.engine.code;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;
import org.navql.engine.signature.Signature;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An operator applied to a list of arguments.
 */
public final class FormulaCode extends Code {

    private final Signature signature;
    private final List<Code> arguments;

    public FormulaCode(Signature signature, Domain domain, List<Code> arguments, Mark mark) {
        super(domain, mark);
        this.signature = Objects.requireNonNull(signature, "Signature cannot be null");
        this.arguments = List.copyOf(arguments);
        if (signature.arity() >= 0 && signature.arity() != this.arguments.size()) {
            throw new IllegalArgumentException(
                    signature + " expects " + signature.arity() + " arguments, got " + this.arguments.size());
        }
    }

    public FormulaCode(Signature signature, Domain domain, Mark mark, Code... arguments) {
        this(signature, domain, List.of(arguments), mark);
    }

    public Signature signature() {
        return signature;
    }

    public List<Code> arguments() {
        return arguments;
    }

    public Code argument(int index) {
        return arguments.get(index);
    }

    public FormulaCode withArguments(List<Code> arguments) {
        return new FormulaCode(signature, domain(), arguments, mark());
    }

    @Override
    protected void collectUnits(Set<Unit> units) {
        for (Code argument : arguments) {
            units.addAll(argument.units());
        }
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitFormula(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(signature, domain(), arguments);
    }

    @Override
    public String toString() {
        return signature + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
