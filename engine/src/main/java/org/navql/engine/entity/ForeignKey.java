package org.navql.engine.entity;

import java.util.List;
import java.util.Objects;

/**
 * A foreign key: origin columns referencing a key of the target table.
 *
 * @param originColumns Referencing columns
 * @param targetColumns Referenced columns, in correspondence
 * @param isPartial     Whether rows with NULL in some origin columns may violate the key
 */
public record ForeignKey(List<ColumnEntity> originColumns, List<ColumnEntity> targetColumns, boolean isPartial) {

    public ForeignKey {
        Objects.requireNonNull(originColumns, "Origin columns cannot be null");
        Objects.requireNonNull(targetColumns, "Target columns cannot be null");
        if (originColumns.isEmpty() || originColumns.size() != targetColumns.size()) {
            throw new IllegalArgumentException("Foreign key columns must be non-empty and of equal length");
        }
        originColumns = List.copyOf(originColumns);
        targetColumns = List.copyOf(targetColumns);
    }

    public String originSchema() {
        return originColumns.get(0).schemaName();
    }

    public String originTable() {
        return originColumns.get(0).tableName();
    }

    public String targetSchema() {
        return targetColumns.get(0).schemaName();
    }

    public String targetTable() {
        return targetColumns.get(0).tableName();
    }

    @Override
    public String toString() {
        return originTable() + originColumns.stream().map(ColumnEntity::name).toList()
                + " -> " + targetTable() + targetColumns.stream().map(ColumnEntity::name).toList();
    }
}
