package org.navql.engine.signature;

/**
 * Number of non-null values.
 */
public record CountSig() implements AggregateSig {

    @Override
    public String function() {
        return "COUNT";
    }
}
