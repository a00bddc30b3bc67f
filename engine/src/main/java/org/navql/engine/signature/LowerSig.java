package org.navql.engine.signature;

/**
 * Converts text to lower case.
 */
public record LowerSig() implements Signature {

    @Override
    public int arity() {
        return 1;
    }
}
