package org.navql.engine.signature;

/**
 * Logical negation: {@code !op}.
 */
public record NotSig() implements Signature {

    @Override
    public int arity() {
        return 1;
    }
}
