package org.navql.engine.space;

import org.navql.engine.code.Code;
import org.navql.engine.error.Mark;

import java.util.ArrayList;
import java.util.List;

/**
 * The rows of the seed that share the values of the kernel expressions
 * with each base row. The seed and the base range over the same axes.
 */
public final class ForkedSpace extends CoveringSpace {

    private final Space seed;
    private final Space ground;
    private final List<Code> kernels;

    public ForkedSpace(Space base, Space seed, List<Code> kernels, List<Code> companions, Mark mark) {
        super(base, base.family(), axisOf(seed).isContracting(),
                kernels.isEmpty() && seed.dominates(base), companions, mark);
        if (!(base.spans(seed) && seed.spans(base))) {
            throw new IllegalArgumentException("The seed of a fork must be convergent with its base");
        }
        this.seed = seed;
        this.ground = axisOf(seed);
        this.kernels = List.copyOf(kernels);
    }

    private static Space axisOf(Space space) {
        while (!space.isAxis()) {
            space = space.base();
        }
        return space;
    }

    @Override
    public Space seed() {
        return seed;
    }

    @Override
    public Space ground() {
        return ground;
    }

    public List<Code> kernels() {
        return kernels;
    }

    @Override
    public Space withBase(Space base) {
        return new ForkedSpace(base, seed, kernels, companions(), mark());
    }

    public ForkedSpace withSeed(Space seed, List<Code> kernels) {
        return new ForkedSpace(base(), seed, kernels, companions(), mark());
    }

    @Override
    public CoveringSpace withCompanions(List<Code> companions) {
        return new ForkedSpace(base(), seed, kernels, companions, mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitForked(this);
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
        return "(" + base() + " . fork(" + kernels + "))";
    }
}
