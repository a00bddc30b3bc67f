package org.navql.engine.signature;

/**
 * {@code exists(op)} for polarity +1, {@code every(op)} for -1. Encoded as a
 * correlated existence test over the plural operand.
 */
public record QuantifySig(int polarity) implements Signature {

    public QuantifySig {
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
