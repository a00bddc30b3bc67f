package org.navql.engine.entity;

import java.util.List;
import java.util.Objects;

/**
 * A join from the referenced table back to the referencing table.
 */
public record ReverseJoin(ForeignKey foreignKey, TableEntity origin, TableEntity target) implements Join {

    public ReverseJoin {
        Objects.requireNonNull(foreignKey, "Foreign key cannot be null");
        Objects.requireNonNull(origin, "Origin cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
    }

    @Override
    public List<ColumnEntity> originColumns() {
        return foreignKey.targetColumns();
    }

    @Override
    public List<ColumnEntity> targetColumns() {
        return foreignKey.originColumns();
    }

    // Not every referenced row is necessarily referenced.
    @Override
    public boolean isExpanding() {
        return false;
    }

    @Override
    public boolean isContracting() {
        return target.uniqueKeys().stream()
                .anyMatch(key -> foreignKey.originColumns().containsAll(key.columns()));
    }

    @Override
    public Join reverse() {
        return new DirectJoin(foreignKey, target, origin);
    }

    @Override
    public String toString() {
        return origin + " <- " + target;
    }
}
