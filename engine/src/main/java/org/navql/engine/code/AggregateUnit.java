package org.navql.engine.code;

import org.navql.engine.error.Mark;
import org.navql.engine.space.Space;

/**
 * An aggregate function ({@code count}, {@code sum}, ...) over a plural space.
 */
public final class AggregateUnit extends AggregateUnitBase {

    public AggregateUnit(Code code, Space pluralSpace, Space space, Mark mark) {
        super(code, pluralSpace, space, mark);
    }

    @Override
    public Unit withSpace(Space space) {
        return new AggregateUnit(code(), pluralSpace(), space, mark());
    }

    @Override
    public CompoundUnit withCode(Code code) {
        return new AggregateUnit(code, pluralSpace(), space(), mark());
    }

    @Override
    public AggregateUnitBase withSpaces(Code code, Space pluralSpace, Space space) {
        return new AggregateUnit(code, pluralSpace, space, mark());
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }

    @Override
    public String toString() {
        return "aggregate(" + code() + ")";
    }
}
