package org.navql.engine.frame;

import org.navql.engine.term.Term;

/**
 * A single row with no columns.
 */
public final class ScalarFrame extends Frame {

    public ScalarFrame(Term term) {
        super(term);
    }

    @Override
    public <T> T accept(FrameVisitor<T> visitor) {
        return visitor.visitScalar(this);
    }
}
