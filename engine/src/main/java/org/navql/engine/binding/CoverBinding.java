package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * {@code moniker(seed)}: the seed rows convergent to each scope row, with
 * the seed's own filters kept apart from the scope.
 */
public record CoverBinding(Binding base, Binding seed, Mark mark) implements Binding {

    public CoverBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(seed, "Seed cannot be null");
    }

    @Override
    public Domain domain() {
        return new EntityDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitCover(this);
    }
}
