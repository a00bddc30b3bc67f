package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.entity.TableEntity;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * All rows of a table.
 */
public record TableBinding(Binding base, TableEntity table, Mark mark) implements Binding {

    public TableBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(table, "Table cannot be null");
    }

    @Override
    public Domain domain() {
        return new EntityDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitTable(this);
    }
}
