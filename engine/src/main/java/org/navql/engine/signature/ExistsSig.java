package org.navql.engine.signature;

/**
 * True if the correlated operand produces at least one row.
 */
public record ExistsSig() implements Signature {

    @Override
    public int arity() {
        return 1;
    }

    @Override
    public boolean isNullRegular() {
        return false;
    }
}
