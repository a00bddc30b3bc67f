package org.navql.engine.signature;

/**
 * Numeric addition.
 */
public record AddSig() implements Signature {

    @Override
    public int arity() {
        return 2;
    }
}
