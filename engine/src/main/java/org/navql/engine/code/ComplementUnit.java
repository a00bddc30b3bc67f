package org.navql.engine.code;

import org.navql.engine.error.Mark;
import org.navql.engine.space.CoveringSpace;
import org.navql.engine.space.Space;

import java.util.List;

/**
 * A value of the seed exported through a covering space: a complement,
 * a moniker, a fork or an attachment.
 */
public final class ComplementUnit extends CompoundUnit {

    public ComplementUnit(Code code, Space space, Mark mark) {
        super(code, space, mark);
        if (!(axisOf(space) instanceof CoveringSpace)) {
            throw new IllegalArgumentException("A complement unit requires a covering space: " + space);
        }
    }

    /**
     * The covering operation producing this unit: the closest axis of its
     * space.
     */
    public CoveringSpace covering() {
        return (CoveringSpace) axisOf(space());
    }

    private static Space axisOf(Space space) {
        while (!space.isAxis()) {
            space = space.base();
        }
        return space;
    }

    @Override
    public Unit withSpace(Space space) {
        return new ComplementUnit(code(), space, mark());
    }

    @Override
    public CompoundUnit withCode(Code code) {
        return new ComplementUnit(code, space(), mark());
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitComplement(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(code(), space());
    }

    @Override
    public String toString() {
        return "covering(" + code() + ")";
    }
}
