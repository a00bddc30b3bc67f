package org.navql.engine.term;

import org.navql.engine.code.Code;
import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.Map;

/**
 * The rows of the kid satisfying a condition.
 */
public final class FilterTerm extends UnaryTerm {

    private final Code filter;

    public FilterTerm(int tag, Term kid, Code filter, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
        this.filter = filter;
    }

    public Code filter() {
        return filter;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitFilter(this);
    }
}
