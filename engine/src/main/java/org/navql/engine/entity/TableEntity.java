package org.navql.engine.entity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A relational table.
 *
 * <p>Tables are identified by their qualified name: two table entities with
 * the same schema and name are equal regardless of the other components.
 *
 * @param schemaName           The schema (empty for the default schema)
 * @param name                 The table name
 * @param columns              Columns in declaration order
 * @param uniqueKeys           All unique keys, the primary key included
 * @param foreignKeys          Keys of this table referencing other tables
 * @param referringForeignKeys Keys of other tables referencing this table
 */
public record TableEntity(
        String schemaName,
        String name,
        List<ColumnEntity> columns,
        List<UniqueKey> uniqueKeys,
        List<ForeignKey> foreignKeys,
        List<ForeignKey> referringForeignKeys
) {
    public TableEntity {
        Objects.requireNonNull(schemaName, "Schema cannot be null (use empty string for default)");
        Objects.requireNonNull(name, "Table name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }
        columns = List.copyOf(columns);
        uniqueKeys = List.copyOf(uniqueKeys);
        foreignKeys = List.copyOf(foreignKeys);
        referringForeignKeys = List.copyOf(referringForeignKeys);
    }

    /**
     * @return The fully qualified table name (schema.table or just table)
     */
    public String qualifiedName() {
        return schemaName.isEmpty() ? name : schemaName + "." + name;
    }

    public Optional<UniqueKey> primaryKey() {
        return uniqueKeys.stream().filter(UniqueKey::isPrimary).findFirst();
    }

    public Optional<ColumnEntity> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equals(columnName))
                .findFirst();
    }

    /**
     * @throws IllegalArgumentException if column not found
     */
    public ColumnEntity getColumn(String columnName) {
        return findColumn(columnName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Column '" + columnName + "' not found in table " + qualifiedName()));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TableEntity table
                && schemaName.equals(table.schemaName)
                && name.equals(table.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaName, name);
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
