package org.navql.engine.space;

import org.navql.engine.entity.TableEntity;

import java.util.Objects;

/**
 * Rows of a table.
 */
public record TableFamily(TableEntity table) implements Family {

    public TableFamily {
        Objects.requireNonNull(table, "Table cannot be null");
    }

    @Override
    public boolean isTable() {
        return true;
    }
}
