package org.navql.engine.signature;

/**
 * Smallest value.
 */
public record MinSig() implements AggregateSig {

    @Override
    public String function() {
        return "MIN";
    }
}
