package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.entity.ColumnEntity;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * A column of the table in scope.
 *
 * @param link The join through which the column navigates when used as a
 *             scope, or null if the column is not a single-column foreign key
 */
public record ColumnBinding(Binding base, ColumnEntity column, ChainBinding link, Mark mark) implements Binding {

    public ColumnBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(column, "Column cannot be null");
    }

    @Override
    public Domain domain() {
        return column.domain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitColumn(this);
    }
}
