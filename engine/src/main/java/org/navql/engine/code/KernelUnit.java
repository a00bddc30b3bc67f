package org.navql.engine.code;

import org.navql.engine.error.Mark;
import org.navql.engine.space.Space;

import java.util.List;

/**
 * A value of the seed exported by a quotient space: one of its kernel
 * expressions or a column connecting the quotient to its base.
 */
public final class KernelUnit extends CompoundUnit {

    public KernelUnit(Code code, Space space, Mark mark) {
        super(code, space, mark);
        if (!space.family().isQuotient()) {
            throw new IllegalArgumentException("A kernel unit requires a quotient space: " + space);
        }
    }

    @Override
    public Unit withSpace(Space space) {
        return new KernelUnit(code(), space, mark());
    }

    @Override
    public CompoundUnit withCode(Code code) {
        return new KernelUnit(code, space(), mark());
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitKernel(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(code(), space());
    }

    @Override
    public String toString() {
        return "kernel(" + code() + ")";
    }
}
