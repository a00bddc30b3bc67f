package org.navql.engine.space;

import org.navql.engine.error.Mark;

import java.util.Collections;
import java.util.List;

/**
 * The unit space: a single row with no columns, the start of every chain.
 */
public final class RootSpace extends Space {

    public RootSpace(Mark mark) {
        super(null, new ScalarFamily(), true, false, false, mark);
    }

    @Override
    public Space withBase(Space base) {
        if (base != null) {
            throw new IllegalArgumentException("The root space has no base");
        }
        return this;
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitRoot(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return Collections.singletonList(null);
    }

    @Override
    public String toString() {
        return "I";
    }
}
