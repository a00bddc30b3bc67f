package org.navql.engine.term;

/**
 * Visitor over the term hierarchy.
 *
 * @param <T> The result type
 */
public interface TermVisitor<T> {

    T visitScalar(ScalarTerm term);

    T visitTable(TableTerm term);

    T visitFilter(FilterTerm term);

    T visitOrder(OrderTerm term);

    T visitProjection(ProjectionTerm term);

    T visitWrapper(WrapperTerm term);

    T visitPermanent(PermanentTerm term);

    T visitCorrelation(CorrelationTerm term);

    T visitSegment(SegmentTerm term);

    T visitJoin(JoinTerm term);

    T visitEmbedding(EmbeddingTerm term);
}
