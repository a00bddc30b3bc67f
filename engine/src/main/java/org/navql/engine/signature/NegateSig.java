package org.navql.engine.signature;

/**
 * Unary minus.
 */
public record NegateSig() implements Signature {

    @Override
    public int arity() {
        return 1;
    }
}
