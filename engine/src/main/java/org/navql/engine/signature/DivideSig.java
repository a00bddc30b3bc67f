package org.navql.engine.signature;

/**
 * Numeric division; integer operands are divided as decimals.
 */
public record DivideSig() implements Signature {

    @Override
    public int arity() {
        return 2;
    }
}
