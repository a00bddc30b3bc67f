package org.navql.engine.space;

import org.navql.engine.entity.TableEntity;
import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * All rows of a table, attached to a scalar base as a cross product.
 */
public final class DirectTableSpace extends TableSpace {

    public DirectTableSpace(Space base, TableEntity table, Mark mark) {
        super(Objects.requireNonNull(base, "Base cannot be null"), table, false, false, mark);
        if (!base.family().isScalar()) {
            throw new IllegalArgumentException("A table can only be attached to a scalar space: " + base);
        }
    }

    @Override
    public Space withBase(Space base) {
        return new DirectTableSpace(base, table(), mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitDirectTable(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(base(), table());
    }

    @Override
    public String toString() {
        return "(" + base() + " * " + table() + ")";
    }
}
