package org.navql.engine.space;

import org.navql.engine.entity.TableEntity;
import org.navql.engine.error.Mark;

/**
 * A space whose rows are the rows of a table.
 */
public abstract sealed class TableSpace extends Space permits DirectTableSpace, FiberTableSpace {

    private final TableEntity table;

    protected TableSpace(Space base, TableEntity table, boolean isContracting, boolean isExpanding, Mark mark) {
        super(base, new TableFamily(table), true, isContracting, isExpanding, mark);
        this.table = table;
    }

    public TableEntity table() {
        return table;
    }
}
