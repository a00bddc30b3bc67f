package org.navql.engine.term;

import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.Map;

/**
 * A correlated subquery: the rows of the kid evaluated once per row of
 * the enclosing term.
 */
public final class CorrelationTerm extends UnaryTerm {

    public CorrelationTerm(int tag, Term kid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitCorrelation(this);
    }
}
