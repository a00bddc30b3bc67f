package org.navql.engine.signature;

/**
 * Average of the values.
 */
public record AvgSig() implements AggregateSig {

    @Override
    public String function() {
        return "AVG";
    }
}
