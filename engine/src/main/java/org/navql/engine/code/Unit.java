package org.navql.engine.code;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;
import org.navql.engine.space.Space;

import java.util.Objects;
import java.util.Set;

/**
 * An indivisible function evaluated once per row of its space.
 */
public abstract sealed class Unit extends Code permits ColumnUnit, CompoundUnit {

    private final Space space;

    protected Unit(Space space, Domain domain, Mark mark) {
        super(domain, mark);
        this.space = Objects.requireNonNull(space, "Space cannot be null");
    }

    public Space space() {
        return space;
    }

    /**
     * The same function evaluated over a different space.
     */
    public abstract Unit withSpace(Space space);

    /**
     * @return true if the unit has a single value for each row of the given space
     */
    public boolean isSingular(Space space) {
        return space.spans(this.space);
    }

    @Override
    protected void collectUnits(Set<Unit> units) {
        units.add(this);
    }
}
