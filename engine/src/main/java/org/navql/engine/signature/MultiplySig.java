package org.navql.engine.signature;

/**
 * Numeric multiplication.
 */
public record MultiplySig() implements Signature {

    @Override
    public int arity() {
        return 2;
    }
}
