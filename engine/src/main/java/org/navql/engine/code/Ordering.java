package org.navql.engine.code;

import java.util.Objects;

/**
 * A sort key: a code with direction +1 (ascending) or -1 (descending).
 */
public record Ordering(Code code, int direction) {

    public Ordering {
        Objects.requireNonNull(code, "Code cannot be null");
        if (direction != 1 && direction != -1) {
            throw new IllegalArgumentException("Direction must be +1 or -1, got " + direction);
        }
    }

    public Ordering withCode(Code code) {
        return new Ordering(code, direction);
    }

    @Override
    public String toString() {
        return code + (direction > 0 ? "+" : "-");
    }
}
