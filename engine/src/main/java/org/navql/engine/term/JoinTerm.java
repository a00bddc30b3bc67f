package org.navql.engine.term;

import org.navql.engine.code.Joint;
import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Map;

/**
 * Rows of the left kid matched with rows of the right kid on equal joints.
 *
 * <p>{@code isLeft} keeps left rows with no match, {@code isRight} keeps
 * right rows with no match.
 */
public final class JoinTerm extends BinaryTerm {

    private final List<Joint> joints;
    private final boolean isLeft;
    private final boolean isRight;

    public JoinTerm(int tag, Term lkid, Term rkid, List<Joint> joints, boolean isLeft, boolean isRight,
                    Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, lkid, rkid, space, baseline, routes);
        this.joints = List.copyOf(joints);
        this.isLeft = isLeft;
        this.isRight = isRight;
    }

    public List<Joint> joints() {
        return joints;
    }

    public boolean isLeft() {
        return isLeft;
    }

    public boolean isRight() {
        return isRight;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitJoin(this);
    }
}
