package org.navql.engine.code;

import org.navql.engine.error.Mark;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Objects;

/**
 * A unit reducing the rows of a plural space to one value per row of its
 * own space.
 *
 * <p>The plural space must span the unit space while the unit space must
 * not span the plural one; otherwise there would be nothing to reduce.
 */
public abstract sealed class AggregateUnitBase extends CompoundUnit permits AggregateUnit, CorrelatedUnit {

    private final Space pluralSpace;

    protected AggregateUnitBase(Code code, Space pluralSpace, Space space, Mark mark) {
        super(code, space, mark);
        this.pluralSpace = Objects.requireNonNull(pluralSpace, "Plural space cannot be null");
        if (!pluralSpace.spans(space) || space.spans(pluralSpace)) {
            throw new IllegalArgumentException(pluralSpace + " is not plural relative to " + space);
        }
    }

    public Space pluralSpace() {
        return pluralSpace;
    }

    public abstract AggregateUnitBase withSpaces(Code code, Space pluralSpace, Space space);

    @Override
    protected List<Object> computeBasis() {
        return List.of(code(), pluralSpace, space());
    }
}
