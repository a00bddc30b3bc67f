package org.navql.engine.term;

import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A relational algebra operation producing the rows of a space.
 *
 * <p>Every term carries:
 * <ul>
 *   <li>a {@code tag}, unique within a query;</li>
 *   <li>the {@code space} whose rows it produces;</li>
 *   <li>the {@code baseline}: the first inflated axis of the space the term
 *       actually produces. Axes below the baseline are expected to be
 *       supplied by whoever attaches the term;</li>
 *   <li>the {@code routes}: for every unit the term can evaluate, the tag of
 *       the descendant term responsible for it;</li>
 *   <li>the {@code offsprings}: for every descendant tag, the tag of the
 *       immediate kid containing it.</li>
 * </ul>
 * Terms are immutable.
 */
public abstract sealed class Term permits NullaryTerm, UnaryTerm, BinaryTerm {

    private final int tag;
    private final List<Term> kids;
    private final Space space;
    private final Space baseline;
    private final Map<Unit, Integer> routes;
    private final Map<Integer, Integer> offsprings;

    protected Term(int tag, List<Term> kids, Space space, Space baseline, Map<Unit, Integer> routes) {
        this.tag = tag;
        this.kids = List.copyOf(kids);
        this.space = Objects.requireNonNull(space, "Space cannot be null");
        this.baseline = Objects.requireNonNull(baseline, "Baseline cannot be null");
        if (!baseline.isInflated()) {
            throw new IllegalArgumentException("A baseline must be inflated: " + baseline);
        }
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        Map<Integer, Integer> offsprings = new LinkedHashMap<>();
        for (Term kid : this.kids) {
            offsprings.put(kid.tag, kid.tag);
            for (Integer offspring : kid.offsprings.keySet()) {
                offsprings.put(offspring, kid.tag);
            }
        }
        this.offsprings = Collections.unmodifiableMap(offsprings);
    }

    public int tag() {
        return tag;
    }

    public List<Term> kids() {
        return kids;
    }

    public Space space() {
        return space;
    }

    public Space baseline() {
        return baseline;
    }

    public Map<Unit, Integer> routes() {
        return routes;
    }

    public Map<Integer, Integer> offsprings() {
        return offsprings;
    }

    public boolean isNullary() {
        return false;
    }

    public abstract <T> T accept(TermVisitor<T> visitor);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + tag + "(" + space + ")";
    }
}
