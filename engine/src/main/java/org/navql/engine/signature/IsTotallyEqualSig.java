package org.navql.engine.signature;

/**
 * Total equality ({@code ==}, {@code !==}): null is treated as an ordinary
 * value, so the result is never null.
 */
public record IsTotallyEqualSig(int polarity) implements Signature {

    public IsTotallyEqualSig {
        Polarity.check(polarity);
    }

    @Override
    public int arity() {
        return 2;
    }

    @Override
    public boolean isNullRegular() {
        return false;
    }
}
