package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * The rows of the base ordered by the keys and sliced by limit and offset;
 * either may be null.
 */
public record SortBinding(Binding base, List<SortKey> order, Long limit, Long offset, Mark mark)
        implements Binding {

    public SortBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        order = List.copyOf(order);
    }

    @Override
    public Domain domain() {
        return base.domain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitSort(this);
    }
}
