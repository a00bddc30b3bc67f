package org.navql.engine.space;

import org.navql.engine.code.Code;
import org.navql.engine.code.Joint;
import org.navql.engine.error.Mark;

import java.util.List;

/**
 * The rows of a plural seed whose images match the images of each base row:
 * {@code larm -> rarm}.
 *
 * <p>Each image pairs an expression over the base ({@code lop}) with an
 * expression over the seed ({@code rop}); rows are attached when every pair
 * compares equal.
 */
public final class AttachSpace extends CoveringSpace {

    private final Space seed;
    private final Space ground;
    private final List<Joint> images;

    public AttachSpace(Space base, Space seed, List<Joint> images, List<Code> companions, Mark mark) {
        super(base, seed.family(), false, false, companions, mark);
        if (!seed.spans(base) || base.spans(seed)) {
            throw new IllegalArgumentException("The seed of an attachment must be a plural descendant of its base");
        }
        Space ground = seed;
        while (!base.spans(ground.base())) {
            ground = ground.base();
        }
        this.seed = seed;
        this.ground = ground;
        this.images = List.copyOf(images);
    }

    @Override
    public Space seed() {
        return seed;
    }

    @Override
    public Space ground() {
        return ground;
    }

    public List<Joint> images() {
        return images;
    }

    @Override
    public Space withBase(Space base) {
        return new AttachSpace(base, seed, images, companions(), mark());
    }

    public AttachSpace withSeed(Space seed, List<Joint> images) {
        return new AttachSpace(base(), seed, images, companions(), mark());
    }

    @Override
    public CoveringSpace withCompanions(List<Code> companions) {
        return new AttachSpace(base(), seed, images, companions, mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitAttach(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(base(), seed, images);
    }

    @Override
    public String toString() {
        return "(" + base() + " . (" + images + " -> " + seed + "))";
    }
}
