package org.navql.engine.frame;

import org.navql.engine.term.Term;

import java.util.Objects;

/**
 * A node mirroring a {@code SELECT} statement or one of its sources.
 *
 * <p>Frames are compared by identity. The tag of a frame is the tag of the
 * term it was assembled from; export phrases refer to frames by tag.
 */
public abstract sealed class Frame permits ScalarFrame, TableFrame, BranchFrame {

    private final Term term;

    protected Frame(Term term) {
        this.term = Objects.requireNonNull(term, "Term cannot be null");
    }

    public int tag() {
        return term.tag();
    }

    public Term term() {
        return term;
    }

    public boolean isNested() {
        return false;
    }

    public abstract <T> T accept(FrameVisitor<T> visitor);
}
