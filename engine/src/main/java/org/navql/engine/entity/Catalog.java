package org.navql.engine.entity;

import org.navql.engine.domain.Domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An immutable snapshot of the database structure.
 *
 * <p>Build one with {@link #builder()}:
 * <pre>
 * Catalog catalog = Catalog.builder()
 *         .table("school", t -&gt; t
 *                 .column("code", Domain.text(), false)
 *                 .column("name", Domain.text(), false)
 *                 .primaryKey("code"))
 *         .table("department", t -&gt; t
 *                 .column("code", Domain.text(), false)
 *                 .column("school_code", Domain.text(), true)
 *                 .primaryKey("code")
 *                 .foreignKey(List.of("school_code"), "school", List.of("code")))
 *         .build();
 * </pre>
 */
public final class Catalog {

    private final List<Schema> schemas;

    private Catalog(List<Schema> schemas) {
        this.schemas = List.copyOf(schemas);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Schema> schemas() {
        return schemas;
    }

    public List<TableEntity> tables() {
        List<TableEntity> tables = new ArrayList<>();
        for (Schema schema : schemas) {
            tables.addAll(schema.tables());
        }
        return tables;
    }

    public Optional<TableEntity> findTable(String schemaName, String tableName) {
        return schemas.stream()
                .filter(s -> s.name().equals(schemaName))
                .flatMap(s -> s.findTable(tableName).stream())
                .findFirst();
    }

    /**
     * All tables with the given name, in schema order.
     */
    public List<TableEntity> findTables(String tableName) {
        List<TableEntity> tables = new ArrayList<>();
        for (Schema schema : schemas) {
            schema.findTable(tableName).ifPresent(tables::add);
        }
        return tables;
    }

    /**
     * @throws IllegalArgumentException if the table does not exist
     */
    public TableEntity getTable(String schemaName, String tableName) {
        return findTable(schemaName, tableName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Table '" + tableName + "' not found in schema '" + schemaName + "'"));
    }

    /**
     * The joins leaving a table: direct joins over its foreign keys followed
     * by reverse joins over the keys referring to it.
     */
    public List<Join> joins(TableEntity table) {
        List<Join> joins = new ArrayList<>();
        for (ForeignKey key : table.foreignKeys()) {
            joins.add(new DirectJoin(key, table, getTable(key.targetSchema(), key.targetTable())));
        }
        for (ForeignKey key : table.referringForeignKeys()) {
            joins.add(new ReverseJoin(key, table, getTable(key.originSchema(), key.originTable())));
        }
        return joins;
    }

    /**
     * Collects table definitions and resolves keys on {@link #build()}.
     */
    public static final class Builder {

        private final Map<String, List<TableSpec>> specs = new LinkedHashMap<>();
        private String currentSchema = "";

        private Builder() {
            specs.put(currentSchema, new ArrayList<>());
        }

        /**
         * Subsequent tables are added to the given schema.
         */
        public Builder schema(String name) {
            Objects.requireNonNull(name, "Schema name cannot be null");
            currentSchema = name;
            specs.computeIfAbsent(name, n -> new ArrayList<>());
            return this;
        }

        public Builder table(String name, Consumer<TableSpec> definition) {
            TableSpec spec = new TableSpec(currentSchema, name);
            definition.accept(spec);
            specs.get(currentSchema).add(spec);
            return this;
        }

        public Catalog build() {
            Map<String, ColumnEntity> columns = new LinkedHashMap<>();
            for (List<TableSpec> tables : specs.values()) {
                for (TableSpec spec : tables) {
                    for (ColumnEntity column : spec.columns) {
                        columns.put(key(spec.schema, spec.name, column.name()), column);
                    }
                }
            }
            Map<String, List<ForeignKey>> outgoing = new LinkedHashMap<>();
            Map<String, List<ForeignKey>> incoming = new LinkedHashMap<>();
            for (List<TableSpec> tables : specs.values()) {
                for (TableSpec spec : tables) {
                    for (ForeignKeySpec fk : spec.foreignKeys) {
                        String targetSchema = fk.targetSchema != null ? fk.targetSchema : spec.schema;
                        TableSpec target = findSpec(targetSchema, fk.targetTable);
                        List<String> targetNames = fk.targetColumns;
                        if (targetNames == null) {
                            if (target.primaryKey == null) {
                                throw new IllegalArgumentException("Table " + fk.targetTable
                                        + " has no primary key to reference");
                            }
                            targetNames = target.primaryKey;
                        }
                        ForeignKey key = new ForeignKey(
                                resolve(columns, spec.schema, spec.name, fk.originColumns),
                                resolve(columns, targetSchema, fk.targetTable, targetNames),
                                fk.isPartial);
                        outgoing.computeIfAbsent(key(spec.schema, spec.name, ""), k -> new ArrayList<>()).add(key);
                        incoming.computeIfAbsent(key(targetSchema, fk.targetTable, ""), k -> new ArrayList<>()).add(key);
                    }
                }
            }
            List<Schema> schemas = new ArrayList<>();
            for (Map.Entry<String, List<TableSpec>> entry : specs.entrySet()) {
                List<TableEntity> tables = new ArrayList<>();
                for (TableSpec spec : entry.getValue()) {
                    List<UniqueKey> keys = new ArrayList<>();
                    if (spec.primaryKey != null) {
                        keys.add(new UniqueKey(resolve(columns, spec.schema, spec.name, spec.primaryKey), true, false));
                    }
                    for (UniqueKeySpec unique : spec.uniqueKeys) {
                        keys.add(new UniqueKey(resolve(columns, spec.schema, spec.name, unique.columns),
                                false, unique.isPartial));
                    }
                    String tableKey = key(spec.schema, spec.name, "");
                    tables.add(new TableEntity(spec.schema, spec.name, spec.columns, keys,
                            outgoing.getOrDefault(tableKey, List.of()),
                            incoming.getOrDefault(tableKey, List.of())));
                }
                if (!tables.isEmpty() || !entry.getKey().isEmpty()) {
                    schemas.add(new Schema(entry.getKey(), tables));
                }
            }
            return new Catalog(schemas);
        }

        private TableSpec findSpec(String schema, String name) {
            List<TableSpec> tables = specs.get(schema);
            if (tables != null) {
                for (TableSpec spec : tables) {
                    if (spec.name.equals(name)) {
                        return spec;
                    }
                }
            }
            throw new IllegalArgumentException("Referenced table '" + name + "' is not defined");
        }

        private static List<ColumnEntity> resolve(Map<String, ColumnEntity> columns,
                                                  String schema, String table, List<String> names) {
            List<ColumnEntity> resolved = new ArrayList<>();
            for (String name : names) {
                ColumnEntity column = columns.get(key(schema, table, name));
                if (column == null) {
                    throw new IllegalArgumentException("Column '" + name + "' not found in table " + table);
                }
                resolved.add(column);
            }
            return resolved;
        }

        private static String key(String schema, String table, String column) {
            return schema + "\u0000" + table + "\u0000" + column;
        }
    }

    /**
     * The definition of one table inside {@link Builder#table}.
     */
    public static final class TableSpec {

        private final String schema;
        private final String name;
        private final List<ColumnEntity> columns = new ArrayList<>();
        private final List<UniqueKeySpec> uniqueKeys = new ArrayList<>();
        private final List<ForeignKeySpec> foreignKeys = new ArrayList<>();
        private List<String> primaryKey;

        private TableSpec(String schema, String name) {
            this.schema = schema;
            this.name = name;
        }

        public TableSpec column(String columnName, Domain domain, boolean isNullable) {
            columns.add(new ColumnEntity(schema, name, columnName, domain, isNullable, false));
            return this;
        }

        public TableSpec column(String columnName, Domain domain, boolean isNullable, boolean hasDefault) {
            columns.add(new ColumnEntity(schema, name, columnName, domain, isNullable, hasDefault));
            return this;
        }

        public TableSpec primaryKey(String... columnNames) {
            primaryKey = List.of(columnNames);
            return this;
        }

        public TableSpec uniqueKey(String... columnNames) {
            uniqueKeys.add(new UniqueKeySpec(List.of(columnNames), false));
            return this;
        }

        public TableSpec partialUniqueKey(String... columnNames) {
            uniqueKeys.add(new UniqueKeySpec(List.of(columnNames), true));
            return this;
        }

        public TableSpec foreignKey(List<String> originColumns, String targetTable, List<String> targetColumns) {
            foreignKeys.add(new ForeignKeySpec(originColumns, null, targetTable, targetColumns, false));
            return this;
        }

        public TableSpec foreignKey(List<String> originColumns, String targetSchema, String targetTable,
                                    List<String> targetColumns) {
            foreignKeys.add(new ForeignKeySpec(originColumns, targetSchema, targetTable, targetColumns, false));
            return this;
        }

        /**
         * A foreign key referencing the primary key of the target table.
         */
        public TableSpec foreignKey(String originColumn, String targetTable) {
            foreignKeys.add(new ForeignKeySpec(List.of(originColumn), null, targetTable, null, false));
            return this;
        }
    }

    private record UniqueKeySpec(List<String> columns, boolean isPartial) {
    }

    private record ForeignKeySpec(List<String> originColumns, String targetSchema, String targetTable,
                                  List<String> targetColumns, boolean isPartial) {
    }
}
