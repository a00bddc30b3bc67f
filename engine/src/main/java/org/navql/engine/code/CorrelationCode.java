package org.navql.engine.code;

import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A reference from a correlated subquery to a value of the enclosing query.
 * It has no units of its own: the value is provided by the embedding frame.
 */
public final class CorrelationCode extends Code {

    private final Code code;

    public CorrelationCode(Code code, Mark mark) {
        super(code.domain(), mark);
        this.code = code;
    }

    public Code code() {
        return code;
    }

    @Override
    protected void collectUnits(Set<Unit> units) {
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitCorrelation(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(Objects.requireNonNull(code));
    }

    @Override
    public String toString() {
        return "^" + code;
    }
}
