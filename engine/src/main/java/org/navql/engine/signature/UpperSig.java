package org.navql.engine.signature;

/**
 * Converts text to upper case.
 */
public record UpperSig() implements Signature {

    @Override
    public int arity() {
        return 1;
    }
}
