package org.navql.engine.signature;

/**
 * Conjunction of one or more predicates.
 */
public record AndSig() implements Signature {

    @Override
    public int arity() {
        return -1;
    }
}
