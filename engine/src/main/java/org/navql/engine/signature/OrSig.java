package org.navql.engine.signature;

/**
 * Disjunction of one or more predicates.
 */
public record OrSig() implements Signature {

    @Override
    public int arity() {
        return -1;
    }
}
