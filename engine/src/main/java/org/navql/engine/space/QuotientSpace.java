package org.navql.engine.space;

import org.navql.engine.code.Code;
import org.navql.engine.error.Mark;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups the rows of a plural seed by the values of the kernel expressions,
 * producing one row per distinct kernel value for every base row.
 */
public final class QuotientSpace extends Space {

    private final Space seed;
    private final Space ground;
    private final List<Code> kernels;

    public QuotientSpace(Space base, Space seed, List<Code> kernels, Mark mark) {
        this(base, seed, List.copyOf(kernels), ground(base, seed), mark);
    }

    private QuotientSpace(Space base, Space seed, List<Code> kernels, Space ground, Mark mark) {
        super(base, new QuotientFamily(seed, ground, kernels), true,
                kernels.isEmpty(), base.isRoot() && kernels.isEmpty(), mark);
        this.seed = seed;
        this.ground = ground;
        this.kernels = kernels;
    }

    private static Space ground(Space base, Space seed) {
        if (!seed.spans(base) || base.spans(seed)) {
            throw new IllegalArgumentException("The seed of a quotient must be a plural descendant of its base");
        }
        Space ground = seed;
        while (!base.spans(ground.base())) {
            ground = ground.base();
        }
        return ground;
    }

    public Space seed() {
        return seed;
    }

    public Space ground() {
        return ground;
    }

    public List<Code> kernels() {
        return kernels;
    }

    @Override
    public QuotientFamily family() {
        return (QuotientFamily) super.family();
    }

    @Override
    public Space withBase(Space base) {
        return new QuotientSpace(base, seed, kernels, mark());
    }

    public QuotientSpace withSeed(Space seed, List<Code> kernels) {
        return new QuotientSpace(base(), seed, kernels, mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitQuotient(this);
    }

    @Override
    protected List<Object> computeBasis() {
        List<Object> basis = new ArrayList<>();
        basis.add(base());
        basis.add(seed);
        basis.add(kernels);
        return basis;
    }

    @Override
    public String toString() {
        return "(" + base() + " . (" + seed + " ^ " + kernels + "))";
    }
}
