package org.navql.engine.code;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.UntypedDomain;
import org.navql.engine.error.Mark;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * A constant; the value is null for {@code null}.
 */
public final class LiteralCode extends Code {

    private final Object value;

    public LiteralCode(Object value, Domain domain, Mark mark) {
        super(domain, mark);
        this.value = value;
    }

    public Object value() {
        return value;
    }

    public boolean isUntyped() {
        return domain() instanceof UntypedDomain;
    }

    @Override
    protected void collectUnits(Set<Unit> units) {
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return Arrays.asList(value, domain());
    }

    @Override
    public String toString() {
        return value == null ? "null" : value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
