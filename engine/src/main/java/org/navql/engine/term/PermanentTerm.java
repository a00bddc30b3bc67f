package org.navql.engine.term;

import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.Map;

/**
 * A wrapper whose subquery must be kept when the frames are collapsed.
 */
public final class PermanentTerm extends WrapperTerm {

    public PermanentTerm(int tag, Term kid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitPermanent(this);
    }
}
