package org.navql.engine.code;

import org.navql.engine.error.Mark;
import org.navql.engine.space.Space;

/**
 * A value of a plural space computed by a correlated subquery, as used by
 * {@code exists} and {@code every}.
 */
public final class CorrelatedUnit extends AggregateUnitBase {

    public CorrelatedUnit(Code code, Space pluralSpace, Space space, Mark mark) {
        super(code, pluralSpace, space, mark);
    }

    @Override
    public Unit withSpace(Space space) {
        return new CorrelatedUnit(code(), pluralSpace(), space, mark());
    }

    @Override
    public CompoundUnit withCode(Code code) {
        return new CorrelatedUnit(code, pluralSpace(), space(), mark());
    }

    @Override
    public AggregateUnitBase withSpaces(Code code, Space pluralSpace, Space space) {
        return new CorrelatedUnit(code, pluralSpace, space, mark());
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitCorrelated(this);
    }

    @Override
    public String toString() {
        return "correlated(" + code() + ")";
    }
}
