package org.navql.engine.signature;

/**
 * {@code IS NULL} for polarity +1, {@code IS NOT NULL} for -1.
 */
public record IsNullSig(int polarity) implements Signature {

    public IsNullSig {
        Polarity.check(polarity);
    }

    @Override
    public int arity() {
        return 1;
    }

    @Override
    public boolean isNullRegular() {
        return false;
    }
}
