package org.navql.engine.frame;

import org.navql.engine.term.Term;

import java.util.Objects;

/**
 * A frame with its own {@code SELECT} statement.
 */
public abstract sealed class BranchFrame extends Frame permits NestedFrame, SegmentFrame {

    private final Clauses clauses;

    protected BranchFrame(Term term, Clauses clauses) {
        super(term);
        this.clauses = Objects.requireNonNull(clauses, "Clauses cannot be null");
    }

    public Clauses clauses() {
        return clauses;
    }

    /**
     * A copy of this frame with different clauses.
     */
    public abstract BranchFrame withClauses(Clauses clauses);
}
