package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.entity.Join;
import org.navql.engine.entity.TableEntity;
import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * The rows reached from the base through a sequence of joins.
 */
public record ChainBinding(Binding base, List<Join> joins, Mark mark) implements Binding {

    public ChainBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        joins = List.copyOf(joins);
        if (joins.isEmpty()) {
            throw new IllegalArgumentException("A chain needs at least one join");
        }
    }

    public TableEntity table() {
        return joins.get(joins.size() - 1).target();
    }

    @Override
    public Domain domain() {
        return new EntityDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitChain(this);
    }
}
