package org.navql.engine.code;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A value supplied by the caller's environment. It is always sent to the
 * database as a placeholder, never inlined.
 */
public final class ParameterCode extends Code {

    private final String name;
    private final Object value;

    public ParameterCode(String name, Object value, Domain domain, Mark mark) {
        super(domain, mark);
        this.name = Objects.requireNonNull(name, "Parameter name cannot be null");
        this.value = value;
    }

    public String name() {
        return name;
    }

    public Object value() {
        return value;
    }

    @Override
    protected void collectUnits(Set<Unit> units) {
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitParameter(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return Arrays.asList(name, value, domain());
    }

    @Override
    public String toString() {
        return "$" + name;
    }
}
