package org.navql.engine.plan;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The result of running a query: its profile and its rows. {@code rows} is
 * null when the query has no segment, such as {@code /}.
 */
public record Product(Profile profile, List<List<Object>> rows) {

    public Product {
        Objects.requireNonNull(profile, "Profile cannot be null");
        if (rows != null) {
            rows = Collections.unmodifiableList(rows);
        }
    }

    public boolean hasData() {
        return rows != null;
    }
}
