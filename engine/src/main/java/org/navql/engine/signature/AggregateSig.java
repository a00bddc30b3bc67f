package org.navql.engine.signature;

/**
 * An aggregate function applied to the values of a plural operand.
 */
public sealed interface AggregateSig extends Signature permits CountSig, SumSig, AvgSig, MinSig, MaxSig {

    /**
     * @return The SQL function name
     */
    String function();

    @Override
    default int arity() {
        return 1;
    }
}
