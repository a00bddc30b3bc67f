package org.navql.engine.binding;

/**
 * Visitor over the binding variants.
 *
 * @param <T> The result type
 */
public interface BindingVisitor<T> {

    T visitRoot(RootBinding binding);

    T visitHome(HomeBinding binding);

    T visitTable(TableBinding binding);

    T visitChain(ChainBinding binding);

    T visitColumn(ColumnBinding binding);

    T visitQuotient(QuotientBinding binding);

    T visitKernel(KernelBinding binding);

    T visitComplement(ComplementBinding binding);

    T visitCover(CoverBinding binding);

    T visitFork(ForkBinding binding);

    T visitLink(LinkBinding binding);

    T visitSieve(SieveBinding binding);

    T visitSort(SortBinding binding);

    T visitSelection(SelectionBinding binding);

    T visitLiteral(LiteralBinding binding);

    T visitParameter(ParameterBinding binding);

    T visitCast(CastBinding binding);

    T visitFormula(FormulaBinding binding);

    T visitSegment(SegmentBinding binding);
}
