package org.navql.engine.frame;

import org.navql.engine.term.Term;

import java.util.List;

/**
 * The top-level statement of a query, with the output columns it feeds.
 */
public final class SegmentFrame extends BranchFrame {

    private final List<SegmentOutput> outputs;

    public SegmentFrame(Term term, Clauses clauses, List<SegmentOutput> outputs) {
        super(term, clauses);
        this.outputs = List.copyOf(outputs);
    }

    public List<SegmentOutput> outputs() {
        return outputs;
    }

    @Override
    public SegmentFrame withClauses(Clauses clauses) {
        return new SegmentFrame(term(), clauses, outputs);
    }

    @Override
    public <T> T accept(FrameVisitor<T> visitor) {
        return visitor.visitSegment(this);
    }
}
