package org.navql.engine.term;

import org.navql.engine.code.Ordering;
import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Map;

/**
 * The rows of the kid sorted and optionally sliced.
 */
public final class OrderTerm extends UnaryTerm {

    private final List<Ordering> order;
    private final Long limit;
    private final Long offset;

    public OrderTerm(int tag, Term kid, List<Ordering> order, Long limit, Long offset,
                     Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
        this.order = List.copyOf(order);
        this.limit = limit;
        this.offset = offset;
    }

    public List<Ordering> order() {
        return order;
    }

    public Long limit() {
        return limit;
    }

    public Long offset() {
        return offset;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitOrder(this);
    }
}
