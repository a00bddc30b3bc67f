package org.navql.engine.code;

import org.navql.engine.entity.ColumnEntity;
import org.navql.engine.error.Mark;
import org.navql.engine.space.Space;
import org.navql.engine.space.TableFamily;

import java.util.List;

/**
 * Reads a column of the table underlying its space.
 */
public final class ColumnUnit extends Unit {

    private final ColumnEntity column;

    public ColumnUnit(ColumnEntity column, Space space, Mark mark) {
        super(space, column.domain(), mark);
        if (!(space.family() instanceof TableFamily family)
                || !family.table().name().equals(column.tableName())
                || !family.table().schemaName().equals(column.schemaName())) {
            throw new IllegalArgumentException("Column " + column + " does not belong to " + space);
        }
        this.column = column;
    }

    public ColumnEntity column() {
        return column;
    }

    public ColumnUnit withColumn(ColumnEntity column, Space space) {
        return new ColumnUnit(column, space, mark());
    }

    @Override
    public Unit withSpace(Space space) {
        return new ColumnUnit(column, space, mark());
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitColumn(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(column, space());
    }

    @Override
    public String toString() {
        return space() + "." + column.name();
    }
}
