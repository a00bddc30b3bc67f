package org.navql.engine.term;

import org.navql.engine.code.Code;
import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Map;

/**
 * The left kid with the right kid embedded as a correlated subquery. The
 * correlations are the codes of the left kid the subquery refers to.
 */
public final class EmbeddingTerm extends BinaryTerm {

    private final List<Code> correlations;

    public EmbeddingTerm(int tag, Term lkid, Term rkid, List<Code> correlations, Space space, Space baseline,
                         Map<Unit, Integer> routes) {
        super(tag, lkid, rkid, space, baseline, routes);
        this.correlations = List.copyOf(correlations);
    }

    public List<Code> correlations() {
        return correlations;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitEmbedding(this);
    }
}
