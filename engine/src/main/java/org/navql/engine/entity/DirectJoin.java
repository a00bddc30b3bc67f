package org.navql.engine.entity;

import java.util.List;
import java.util.Objects;

/**
 * A join from the referencing table to the referenced table.
 */
public record DirectJoin(ForeignKey foreignKey, TableEntity origin, TableEntity target) implements Join {

    public DirectJoin {
        Objects.requireNonNull(foreignKey, "Foreign key cannot be null");
        Objects.requireNonNull(origin, "Origin cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
    }

    @Override
    public List<ColumnEntity> originColumns() {
        return foreignKey.originColumns();
    }

    @Override
    public List<ColumnEntity> targetColumns() {
        return foreignKey.targetColumns();
    }

    @Override
    public boolean isExpanding() {
        return !foreignKey.isPartial()
                && foreignKey.originColumns().stream().noneMatch(ColumnEntity::isNullable);
    }

    @Override
    public boolean isContracting() {
        return target.uniqueKeys().stream()
                .anyMatch(key -> foreignKey.targetColumns().containsAll(key.columns()));
    }

    @Override
    public Join reverse() {
        return new ReverseJoin(foreignKey, target, origin);
    }

    @Override
    public String toString() {
        return origin + " -> " + target;
    }
}
