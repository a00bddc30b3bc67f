package org.navql.engine.code;

/**
 * Visitor over the code variants.
 *
 * @param <T> The result type
 */
public interface CodeVisitor<T> {

    T visitLiteral(LiteralCode code);

    T visitParameter(ParameterCode code);

    T visitCast(CastCode code);

    T visitFormula(FormulaCode code);

    T visitCorrelation(CorrelationCode code);

    T visitColumn(ColumnUnit unit);

    T visitScalar(ScalarUnit unit);

    T visitAggregate(AggregateUnit unit);

    T visitCorrelated(CorrelatedUnit unit);

    T visitKernel(KernelUnit unit);

    T visitComplement(ComplementUnit unit);
}
