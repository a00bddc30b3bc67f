package org.navql.engine.space;

import org.navql.engine.entity.Join;
import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * The rows of a table reachable from each base row through a join.
 */
public final class FiberTableSpace extends TableSpace {

    private final Join join;

    public FiberTableSpace(Space base, Join join, Mark mark) {
        super(Objects.requireNonNull(base, "Base cannot be null"), join.target(),
                join.isContracting(), join.isExpanding(), mark);
        if (!(base.family() instanceof TableFamily family) || !family.table().equals(join.origin())) {
            throw new IllegalArgumentException("Join " + join + " does not start at " + base);
        }
        this.join = join;
    }

    public Join join() {
        return join;
    }

    @Override
    public Space withBase(Space base) {
        return new FiberTableSpace(base, join, mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitFiberTable(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(base(), join);
    }

    @Override
    public String toString() {
        return "(" + base() + " . " + table() + ")";
    }
}
