package org.navql.engine.space;

/**
 * Rows with no columns: the root and scalar spaces.
 */
public record ScalarFamily() implements Family {

    @Override
    public boolean isScalar() {
        return true;
    }
}
