package org.navql.engine.space;

import org.navql.engine.code.Code;
import org.navql.engine.error.Mark;

import java.util.List;

/**
 * The rows of the quotient seed that belong to each quotient row: the
 * {@code ^} of a group.
 */
public final class ComplementSpace extends CoveringSpace {

    public ComplementSpace(Space base, List<Code> companions, Mark mark) {
        super(base, seedFamily(base), false, true, companions, mark);
    }

    private static Family seedFamily(Space base) {
        if (!(base.family() instanceof QuotientFamily family)) {
            throw new IllegalArgumentException("A complement requires a quotient base: " + base);
        }
        return family.seed().family();
    }

    private QuotientFamily quotient() {
        return (QuotientFamily) base().family();
    }

    @Override
    public Space seed() {
        return quotient().seed();
    }

    @Override
    public Space ground() {
        return quotient().ground();
    }

    public List<Code> kernels() {
        return quotient().kernels();
    }

    @Override
    public Space withBase(Space base) {
        return new ComplementSpace(base, companions(), mark());
    }

    @Override
    public CoveringSpace withCompanions(List<Code> companions) {
        return new ComplementSpace(base(), companions, mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitComplement(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(base());
    }

    @Override
    public String toString() {
        return "(" + base() + " . ^)";
    }
}
