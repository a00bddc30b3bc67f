package org.navql.engine.term;

import org.navql.engine.code.Code;
import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Map;

/**
 * The top of a query: the output codes evaluated on the rows of the kid.
 */
public final class SegmentTerm extends UnaryTerm {

    private final List<Code> codes;

    public SegmentTerm(int tag, Term kid, List<Code> codes, Space space, Space baseline,
                       Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
        this.codes = List.copyOf(codes);
    }

    public List<Code> codes() {
        return codes;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitSegment(this);
    }
}
