package org.navql.engine.entity;

import java.util.List;
import java.util.Objects;

/**
 * A primary or unique key of a table.
 *
 * @param columns   Key columns, in order
 * @param isPrimary Whether this is the primary key
 * @param isPartial Whether the key only holds for rows with no NULL key column
 */
public record UniqueKey(List<ColumnEntity> columns, boolean isPrimary, boolean isPartial) {

    public UniqueKey {
        Objects.requireNonNull(columns, "Key columns cannot be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Key must have at least one column");
        }
        columns = List.copyOf(columns);
    }

    /**
     * @return true if every key column is NOT NULL
     */
    public boolean isTotal() {
        return columns.stream().noneMatch(ColumnEntity::isNullable);
    }
}
