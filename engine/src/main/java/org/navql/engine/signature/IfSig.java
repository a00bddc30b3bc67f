package org.navql.engine.signature;

/**
 * {@code if(condition, then, else)}; the else branch is optional and
 * defaults to null.
 */
public record IfSig() implements Signature {

    @Override
    public int arity() {
        return 3;
    }

    @Override
    public boolean isNullRegular() {
        return false;
    }
}
