package org.navql.engine.signature;

/**
 * Case-insensitive substring test: {@code ~} for polarity +1, {@code !~} for -1.
 */
public record ContainsSig(int polarity) implements Signature {

    public ContainsSig {
        Polarity.check(polarity);
    }

    @Override
    public int arity() {
        return 2;
    }
}
