package org.navql.engine.space;

/**
 * The kind of rows a space produces.
 */
public sealed interface Family permits ScalarFamily, TableFamily, QuotientFamily {

    default boolean isScalar() {
        return false;
    }

    default boolean isTable() {
        return false;
    }

    default boolean isQuotient() {
        return false;
    }
}
