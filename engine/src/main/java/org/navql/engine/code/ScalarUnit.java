package org.navql.engine.code;

import org.navql.engine.error.Mark;
import org.navql.engine.space.Space;

import java.util.List;

/**
 * A code evaluated once per row of its space. Used to pin an expression
 * over a nested scope, such as the result of an aggregate, to the scope
 * it is computed in.
 */
public final class ScalarUnit extends CompoundUnit {

    public ScalarUnit(Code code, Space space, Mark mark) {
        super(code, space, mark);
    }

    @Override
    public Unit withSpace(Space space) {
        return new ScalarUnit(code(), space, mark());
    }

    @Override
    public CompoundUnit withCode(Code code) {
        return new ScalarUnit(code, space(), mark());
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(code(), space());
    }

    @Override
    public String toString() {
        return "scalar(" + code() + ")";
    }
}
