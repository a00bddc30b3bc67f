package org.navql.engine.term;

import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.Map;

/**
 * The rows of the kid, unchanged; used to change the space or the routes
 * of a term, or to wrap it into a subquery.
 */
public sealed class WrapperTerm extends UnaryTerm permits PermanentTerm {

    public WrapperTerm(int tag, Term kid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitWrapper(this);
    }
}
