package org.navql.engine.signature;

/**
 * Number of characters of a text value.
 */
public record LengthSig() implements Signature {

    @Override
    public int arity() {
        return 1;
    }
}
