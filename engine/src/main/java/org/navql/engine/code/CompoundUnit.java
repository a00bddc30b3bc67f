package org.navql.engine.code;

import org.navql.engine.error.Mark;
import org.navql.engine.space.Space;

import java.util.Objects;

/**
 * A unit wrapping an arbitrary code evaluated in the context of its space.
 */
public abstract sealed class CompoundUnit extends Unit
        permits ScalarUnit, AggregateUnitBase, KernelUnit, ComplementUnit {

    private final Code code;

    protected CompoundUnit(Code code, Space space, Mark mark) {
        super(space, Objects.requireNonNull(code, "Code cannot be null").domain(), mark);
        this.code = code;
    }

    public Code code() {
        return code;
    }

    public abstract CompoundUnit withCode(Code code);
}
