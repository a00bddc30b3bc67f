package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * The distinct kernel values of a seed: {@code seed ^ kernel}.
 *
 * @param titles The names under which the kernels are looked up
 */
public record QuotientBinding(Binding base, Binding seed, List<Binding> kernels, List<String> titles, Mark mark)
        implements Binding {

    public QuotientBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(seed, "Seed cannot be null");
        kernels = List.copyOf(kernels);
        titles = List.copyOf(titles);
        if (kernels.size() != titles.size()) {
            throw new IllegalArgumentException("Every kernel needs a title");
        }
    }

    @Override
    public Domain domain() {
        return new EntityDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitQuotient(this);
    }
}
