package org.navql.engine.term;

import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Map;

public abstract sealed class UnaryTerm extends Term
        permits FilterTerm, OrderTerm, ProjectionTerm, WrapperTerm, CorrelationTerm, SegmentTerm {

    private final Term kid;

    protected UnaryTerm(int tag, Term kid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, List.of(kid), space, baseline, routes);
        this.kid = kid;
    }

    public Term kid() {
        return kid;
    }
}
