package org.navql.engine.signature;

/**
 * Regular equality ({@code =}) for polarity +1, disequality ({@code !=}) for -1.
 * Comparing with null yields null.
 */
public record IsEqualSig(int polarity) implements Signature {

    public IsEqualSig {
        Polarity.check(polarity);
    }

    @Override
    public int arity() {
        return 2;
    }
}
