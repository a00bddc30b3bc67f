package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * The value of a kernel of the quotient in scope.
 */
public record KernelBinding(Binding base, int index, Domain domain, Mark mark) implements Binding {

    public KernelBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitKernel(this);
    }
}
