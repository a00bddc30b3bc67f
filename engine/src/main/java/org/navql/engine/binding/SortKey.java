package org.navql.engine.binding;

import java.util.Objects;

/**
 * A sort key with direction +1 (ascending) or -1 (descending).
 */
public record SortKey(Binding binding, int direction) {

    public SortKey {
        Objects.requireNonNull(binding, "Key cannot be null");
    }
}
