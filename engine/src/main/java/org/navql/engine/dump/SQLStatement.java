package org.navql.engine.dump;

import java.util.List;
import java.util.Objects;

/**
 * The text of a serialized statement with its parameter markers.
 */
public record SQLStatement(String sql, List<Placeholder> placeholders) {

    public SQLStatement {
        Objects.requireNonNull(sql, "SQL cannot be null");
        placeholders = List.copyOf(placeholders);
    }
}
