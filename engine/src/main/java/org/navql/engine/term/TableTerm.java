package org.navql.engine.term;

import org.navql.engine.code.Unit;
import org.navql.engine.entity.TableEntity;
import org.navql.engine.space.Space;
import org.navql.engine.space.TableFamily;

import java.util.Map;

/**
 * All rows of a table.
 */
public final class TableTerm extends NullaryTerm {

    private final TableEntity table;

    public TableTerm(int tag, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, space, baseline, routes);
        if (!(space.family() instanceof TableFamily family)) {
            throw new IllegalArgumentException("A table term requires a table space: " + space);
        }
        this.table = family.table();
    }

    public TableEntity table() {
        return table;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitTable(this);
    }
}
