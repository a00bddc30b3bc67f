package org.navql.engine.signature;

/**
 * Sum of the values.
 */
public record SumSig() implements AggregateSig {

    @Override
    public String function() {
        return "SUM";
    }
}
