package org.navql.engine.signature;

/**
 * Largest value.
 */
public record MaxSig() implements AggregateSig {

    @Override
    public String function() {
        return "MAX";
    }
}
