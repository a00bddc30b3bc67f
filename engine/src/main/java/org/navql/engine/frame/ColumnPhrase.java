package org.navql.engine.frame;

import org.navql.engine.domain.Domain;
import org.navql.engine.entity.ColumnEntity;

import java.util.Objects;

/**
 * A column of the table read by the frame with the given tag.
 */
public record ColumnPhrase(int tag, ColumnEntity column, boolean isNullable) implements ExportPhrase {

    public ColumnPhrase {
        Objects.requireNonNull(column, "Column cannot be null");
    }

    @Override
    public Domain domain() {
        return column.domain();
    }

    @Override
    public <T> T accept(PhraseVisitor<T> visitor) {
        return visitor.visitColumn(this);
    }
}
