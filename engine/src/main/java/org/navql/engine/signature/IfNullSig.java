package org.navql.engine.signature;

/**
 * {@code if_null(op, default)}: the first operand unless it is null.
 */
public record IfNullSig() implements Signature {

    @Override
    public int arity() {
        return 2;
    }

    @Override
    public boolean isNullRegular() {
        return false;
    }
}
