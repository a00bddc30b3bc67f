package org.navql.engine.space;

import org.navql.engine.code.Code;
import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * The rows of the base satisfying a Boolean filter.
 */
public final class FilteredSpace extends Space {

    private final Code filter;

    public FilteredSpace(Space base, Code filter, Mark mark) {
        super(Objects.requireNonNull(base, "Base cannot be null"), base.family(), false, true, false, mark);
        Objects.requireNonNull(filter, "Filter cannot be null");
        if (!(filter.domain() instanceof BooleanDomain)) {
            throw new IllegalArgumentException("A filter must be Boolean: " + filter);
        }
        this.filter = filter;
    }

    public Code filter() {
        return filter;
    }

    @Override
    public Space withBase(Space base) {
        return new FilteredSpace(base, filter, mark());
    }

    public FilteredSpace withFilter(Code filter) {
        return new FilteredSpace(base(), filter, mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitFiltered(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(base(), filter);
    }

    @Override
    public String toString() {
        return "(" + base() + " ? " + filter + ")";
    }
}
