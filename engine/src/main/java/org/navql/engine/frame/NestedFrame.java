package org.navql.engine.frame;

import org.navql.engine.term.PermanentTerm;
import org.navql.engine.term.Term;

/**
 * A subquery.
 */
public final class NestedFrame extends BranchFrame {

    public NestedFrame(Term term, Clauses clauses) {
        super(term, clauses);
    }

    @Override
    public boolean isNested() {
        return true;
    }

    /**
     * @return true if the subquery must be kept when the frame tree is collapsed
     */
    public boolean isPermanent() {
        return term() instanceof PermanentTerm;
    }

    @Override
    public NestedFrame withClauses(Clauses clauses) {
        return new NestedFrame(term(), clauses);
    }

    @Override
    public <T> T accept(FrameVisitor<T> visitor) {
        return visitor.visitNested(this);
    }
}
