package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;
import org.navql.engine.signature.Signature;

import java.util.List;
import java.util.Objects;

/**
 * An operator or function call evaluated in the base scope.
 */
public record FormulaBinding(Binding base, Signature signature, Domain domain, List<Binding> arguments, Mark mark)
        implements Binding {

    public FormulaBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(signature, "Signature cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
        arguments = List.copyOf(arguments);
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitFormula(this);
    }
}
