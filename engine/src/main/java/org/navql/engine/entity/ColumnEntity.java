package org.navql.engine.entity;

import org.navql.engine.domain.Domain;

import java.util.Objects;

/**
 * A column of a relational table.
 *
 * @param schemaName The schema of the owning table (empty for the default schema)
 * @param tableName  The owning table
 * @param name       The column name
 * @param domain     The type of the column values
 * @param isNullable Whether the column admits NULL
 * @param hasDefault Whether the column has a default value
 */
public record ColumnEntity(
        String schemaName,
        String tableName,
        String name,
        Domain domain,
        boolean isNullable,
        boolean hasDefault
) {
    public ColumnEntity {
        Objects.requireNonNull(schemaName, "Schema cannot be null (use empty string for default)");
        Objects.requireNonNull(tableName, "Column table cannot be null");
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(domain, "Column domain cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    @Override
    public String toString() {
        return (schemaName.isEmpty() ? "" : schemaName + ".") + tableName + "." + name;
    }
}
