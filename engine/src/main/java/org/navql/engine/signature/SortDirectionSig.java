package org.navql.engine.signature;

/**
 * Wraps an ORDER BY item; {@code direction} is +1 for ascending, -1 for descending.
 */
public record SortDirectionSig(int direction) implements Signature {

    public SortDirectionSig {
        Polarity.check(direction);
    }

    @Override
    public int arity() {
        return 1;
    }
}
