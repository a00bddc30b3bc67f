package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * {@code fork(kernels)}: the rows of the scope's own space sharing the
 * kernel values with each scope row.
 */
public record ForkBinding(Binding base, List<Binding> kernels, Mark mark) implements Binding {

    public ForkBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        kernels = List.copyOf(kernels);
    }

    @Override
    public Domain domain() {
        return new EntityDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitFork(this);
    }
}
