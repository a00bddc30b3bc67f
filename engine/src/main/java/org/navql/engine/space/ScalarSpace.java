package org.navql.engine.space;

import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * One row for every row of the base: the scope of a nested scalar context.
 */
public final class ScalarSpace extends Space {

    public ScalarSpace(Space base, Mark mark) {
        super(Objects.requireNonNull(base, "Base cannot be null"), new ScalarFamily(), true, true, true, mark);
    }

    @Override
    public Space withBase(Space base) {
        return new ScalarSpace(base, mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(base());
    }

    @Override
    public String toString() {
        return "(" + base() + " * I)";
    }
}
