package org.navql.engine.signature;

/**
 * Numeric subtraction.
 */
public record SubtractSig() implements Signature {

    @Override
    public int arity() {
        return 2;
    }
}
