package org.navql.engine.signature;

/**
 * Identifies the operator of a formula.
 *
 * <p>Signatures are value objects: the same operator with the same
 * parameters (polarity, relation, direction) is always equal. The arguments
 * of a formula are kept by the formula itself, in the order documented on
 * each signature.
 */
public sealed interface Signature permits IsEqualSig, IsTotallyEqualSig, CompareSig, AndSig, OrSig, NotSig,
        IsNullSig, NullIfSig, IfNullSig, IfSig, ContainsSig, AddSig, SubtractSig, MultiplySig, DivideSig, NegateSig,
        ConcatSig, UpperSig, LowerSig, LengthSig, AggregateSig, ExistsSig, QuantifySig, SortDirectionSig {

    /**
     * @return The number of arguments, or -1 for variadic operators
     */
    int arity();

    /**
     * @return true if the result is null whenever any argument is null
     */
    default boolean isNullRegular() {
        return true;
    }
}
