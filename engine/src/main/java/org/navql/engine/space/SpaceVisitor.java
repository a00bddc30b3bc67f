package org.navql.engine.space;

/**
 * Visitor over the space variants.
 *
 * @param <T> The result type
 */
public interface SpaceVisitor<T> {

    T visitRoot(RootSpace space);

    T visitScalar(ScalarSpace space);

    T visitDirectTable(DirectTableSpace space);

    T visitFiberTable(FiberTableSpace space);

    T visitQuotient(QuotientSpace space);

    T visitComplement(ComplementSpace space);

    T visitMoniker(MonikerSpace space);

    T visitForked(ForkedSpace space);

    T visitAttach(AttachSpace space);

    T visitFiltered(FilteredSpace space);

    T visitOrdered(OrderedSpace space);
}
