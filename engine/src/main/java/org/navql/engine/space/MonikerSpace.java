package org.navql.engine.space;

import org.navql.engine.code.Code;
import org.navql.engine.error.Mark;

import java.util.List;

/**
 * The rows of the seed convergent to each base row, with the seed's own
 * filters and ordering kept intact.
 */
public final class MonikerSpace extends CoveringSpace {

    private final Space seed;
    private final Space ground;

    public MonikerSpace(Space base, Space seed, List<Code> companions, Mark mark) {
        super(base, seed.family(), base.spans(seed), seed.dominates(base), companions, mark);
        if (!seed.spans(base)) {
            throw new IllegalArgumentException("The seed of a moniker must span its base");
        }
        this.seed = seed;
        this.ground = coveringGround(base, seed);
    }

    @Override
    public Space seed() {
        return seed;
    }

    @Override
    public Space ground() {
        return ground;
    }

    @Override
    public Space withBase(Space base) {
        return new MonikerSpace(base, seed, companions(), mark());
    }

    public MonikerSpace withSeed(Space seed) {
        return new MonikerSpace(base(), seed, companions(), mark());
    }

    @Override
    public CoveringSpace withCompanions(List<Code> companions) {
        return new MonikerSpace(base(), seed, companions, mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitMoniker(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(base(), seed);
    }

    @Override
    public String toString() {
        return "(" + base() + " . (" + seed + "))";
    }
}
