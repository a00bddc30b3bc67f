package org.navql.engine.space;

import org.navql.engine.code.Code;
import org.navql.engine.error.Mark;

import java.util.List;

/**
 * A space whose rows are taken from a seed space and attached to the base
 * through the seed's {@code ground}: the closest axis of the seed the base
 * spans.
 *
 * <p>The companions are a compiler hint: codes that the term for this space
 * should export alongside the requested ones. They do not change the meaning
 * of the space and are excluded from comparison.
 */
public abstract sealed class CoveringSpace extends Space
        permits ComplementSpace, MonikerSpace, ForkedSpace, AttachSpace {

    private final List<Code> companions;

    protected CoveringSpace(Space base, Family family, boolean isContracting, boolean isExpanding,
                            List<Code> companions, Mark mark) {
        super(base, family, true, isContracting, isExpanding, mark);
        this.companions = List.copyOf(companions);
    }

    public abstract Space seed();

    public abstract Space ground();

    public List<Code> companions() {
        return companions;
    }

    public abstract CoveringSpace withCompanions(List<Code> companions);

    /**
     * Walks up from the seed to its closest axis; if the base does not span
     * that axis, continues to the last axis whose parent the base spans.
     */
    static Space coveringGround(Space base, Space seed) {
        Space ground = seed;
        while (!ground.isAxis()) {
            ground = ground.base();
        }
        if (!base.spans(ground)) {
            while (!base.spans(ground.base())) {
                ground = ground.base();
            }
        }
        return ground;
    }
}
