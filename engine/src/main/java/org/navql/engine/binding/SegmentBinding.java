package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.VoidDomain;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * The top of a bound query. {@code seed} is null for the empty query {@code /}.
 */
public record SegmentBinding(Binding base, Binding seed, Mark mark) implements Binding {

    public SegmentBinding {
        Objects.requireNonNull(base, "Base cannot be null");
    }

    @Override
    public Domain domain() {
        return seed != null ? seed.domain() : new VoidDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitSegment(this);
    }
}
