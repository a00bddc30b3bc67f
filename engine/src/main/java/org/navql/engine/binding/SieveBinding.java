package org.navql.engine.binding;

import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * The rows of the base satisfying a Boolean filter.
 */
public record SieveBinding(Binding base, Binding filter, Mark mark) implements Binding {

    public SieveBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(filter, "Filter cannot be null");
        if (!(filter.domain() instanceof BooleanDomain)) {
            throw new IllegalArgumentException("A filter must be Boolean");
        }
    }

    @Override
    public Domain domain() {
        return base.domain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitSieve(this);
    }
}
