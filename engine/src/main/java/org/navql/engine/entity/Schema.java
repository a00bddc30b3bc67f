package org.navql.engine.entity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A namespace of tables.
 *
 * @param name   The schema name (empty for the default schema)
 * @param tables Tables in declaration order
 */
public record Schema(String name, List<TableEntity> tables) {

    public Schema {
        Objects.requireNonNull(name, "Schema name cannot be null");
        tables = List.copyOf(tables);
    }

    public Optional<TableEntity> findTable(String tableName) {
        return tables.stream().filter(t -> t.name().equals(tableName)).findFirst();
    }
}
