package org.navql.engine.signature;

/**
 * Text concatenation.
 */
public record ConcatSig() implements Signature {

    @Override
    public int arity() {
        return 2;
    }
}
