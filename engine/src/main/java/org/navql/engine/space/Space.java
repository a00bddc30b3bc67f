package org.navql.engine.space;

import org.navql.engine.error.Mark;

import java.util.ArrayList;
import java.util.List;

/**
 * A multiset of rows, built as a chain of operations starting from the root.
 *
 * <p>Every space except {@link RootSpace} extends a {@code base} space by one
 * operation. Axis operations change the shape of the rows (attaching a table,
 * grouping, linking); the others keep the shape of their base and only
 * restrict or reorder its rows (filtering, ordering).
 *
 * <p>Two spaces are <em>convergent</em> when their rows can be matched
 * through the common prefix of their axes. The relations below are all
 * defined in terms of convergence:
 * <ul>
 *   <li>{@link #spans}: every row of this space converges to at most one row
 *       of the other;</li>
 *   <li>{@link #dominates}: in addition, every row of the other space has a
 *       convergent row here;</li>
 *   <li>{@link #conforms}: mutual domination;</li>
 *   <li>{@link #concludes}: the other space is a literal ancestor of this
 *       one. This is a structural property only and does not imply the
 *       other relations.</li>
 * </ul>
 */
public abstract sealed class Space extends Expression
        permits RootSpace, ScalarSpace, TableSpace, QuotientSpace, CoveringSpace, FilteredSpace, OrderedSpace {

    private final Space base;
    private final Family family;
    private final boolean isAxis;
    private final boolean isContracting;
    private final boolean isExpanding;
    private final boolean isInflated;

    protected Space(Space base, Family family, boolean isAxis, boolean isContracting, boolean isExpanding,
                    Mark mark) {
        super(mark);
        this.base = base;
        this.family = family;
        this.isAxis = isAxis;
        this.isContracting = isContracting;
        this.isExpanding = isExpanding;
        this.isInflated = base == null || (base.isInflated && isAxis);
    }

    /**
     * @return The parent space; null for the root
     */
    public Space base() {
        return base;
    }

    public Family family() {
        return family;
    }

    public boolean isAxis() {
        return isAxis;
    }

    public boolean isRoot() {
        return base == null;
    }

    /**
     * @return true if every row of the base produces at most one row here
     */
    public boolean isContracting() {
        return isContracting;
    }

    /**
     * @return true if every row of the base produces at least one row here
     */
    public boolean isExpanding() {
        return isExpanding;
    }

    /**
     * @return true if the operation can be moved relative to its neighbours
     *         without changing the result
     */
    public boolean isCommutative() {
        return true;
    }

    /**
     * @return true if this space and all its ancestors are axes
     */
    public boolean isInflated() {
        return isInflated;
    }

    /**
     * A copy of this operation applied to a different base.
     */
    public abstract Space withBase(Space base);

    public abstract <T> T accept(SpaceVisitor<T> visitor);

    /**
     * Same operation as the other space, ignoring the base.
     */
    public boolean resembles(Space other) {
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        List<Object> mine = basis();
        List<Object> theirs = other.basis();
        return mine.subList(1, mine.size()).equals(theirs.subList(1, theirs.size()));
    }

    /**
     * @return This space followed by its ancestors, the root last
     */
    public List<Space> unfold() {
        List<Space> ancestors = new ArrayList<>();
        for (Space ancestor = this; ancestor != null; ancestor = ancestor.base) {
            ancestors.add(ancestor);
        }
        return ancestors;
    }

    /**
     * The space built from the axes of this space only.
     */
    public Space inflate() {
        if (isInflated) {
            return this;
        }
        List<Space> ancestors = unfold();
        Space space = null;
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            Space ancestor = ancestors.get(i);
            if (ancestor.isAxis) {
                space = ancestor.withBase(space);
            }
        }
        return space;
    }

    /**
     * Removes the non-axis operations that are already applied by the given
     * space, producing the smallest space equivalent to this one in its
     * presence.
     */
    public Space prune(Space other) {
        if (isInflated) {
            return this;
        }
        List<Space> mine = unfold();
        List<Space> theirs = other.unfold();
        int i = mine.size() - 1;
        int j = theirs.size() - 1;
        Space space = null;
        while (i >= 0 && j >= 0) {
            Space my = mine.get(i);
            Space their = theirs.get(j);
            if (my.resembles(their)) {
                if (!(my.isCommutative() || my.equals(their))) {
                    return this;
                }
                if (my.isAxis) {
                    space = my.withBase(space);
                }
                i--;
                j--;
            } else if (!their.isAxis) {
                j--;
            } else if (!my.isAxis) {
                if (!my.isCommutative()) {
                    return this;
                }
                space = my.withBase(space);
                i--;
            } else {
                break;
            }
        }
        while (i >= 0) {
            Space my = mine.get(i--);
            if (!my.isCommutative()) {
                return this;
            }
            space = my.withBase(space);
        }
        return space;
    }

    /**
     * True if every row of this space converges to at most one row of the
     * other space.
     */
    public boolean spans(Space other) {
        if (equals(other)) {
            return true;
        }
        List<Space> mine = axes(this);
        List<Space> theirs = axes(other);
        int i = mine.size() - 1;
        int j = theirs.size() - 1;
        while (i >= 0 && j >= 0 && mine.get(i).resembles(theirs.get(j))) {
            i--;
            j--;
        }
        for (; j >= 0; j--) {
            if (!theirs.get(j).isContracting) {
                return false;
            }
        }
        return true;
    }

    /**
     * True if this space spans the other and every row of the other space
     * has a convergent row in this one.
     */
    public boolean dominates(Space other) {
        if (equals(other)) {
            return true;
        }
        List<Space> mine = unfold();
        List<Space> theirs = other.unfold();
        int i = mine.size() - 1;
        int j = theirs.size() - 1;
        while (i >= 0 && j >= 0) {
            Space my = mine.get(i);
            Space their = theirs.get(j);
            if (my.resembles(their)) {
                i--;
                j--;
            } else if (their.isContracting && !their.isAxis) {
                j--;
            } else {
                break;
            }
        }
        for (; i >= 0; i--) {
            if (!mine.get(i).isExpanding) {
                return false;
            }
        }
        for (; j >= 0; j--) {
            if (!theirs.get(j).isContracting) {
                return false;
            }
        }
        return true;
    }

    /**
     * Mutual domination: the rows of both spaces are in one-to-one
     * correspondence.
     */
    public boolean conforms(Space other) {
        return dominates(other) && other.dominates(this);
    }

    /**
     * True if the other space is this space or one of its ancestors.
     */
    public boolean concludes(Space other) {
        for (Space space = this; space != null; space = space.base) {
            if (space.equals(other)) {
                return true;
            }
        }
        return false;
    }

    private static List<Space> axes(Space space) {
        List<Space> axes = new ArrayList<>();
        for (Space ancestor : space.unfold()) {
            if (ancestor.isAxis) {
                axes.add(ancestor);
            }
        }
        return axes;
    }
}
