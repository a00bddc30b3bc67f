package org.navql.engine.code;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Converts a value to another domain.
 */
public final class CastCode extends Code {

    private final Code base;

    public CastCode(Code base, Domain domain, Mark mark) {
        super(domain, mark);
        this.base = Objects.requireNonNull(base, "Base cannot be null");
    }

    public Code base() {
        return base;
    }

    public CastCode withBase(Code base) {
        return new CastCode(base, domain(), mark());
    }

    @Override
    protected void collectUnits(Set<Unit> units) {
        units.addAll(base.units());
    }

    @Override
    public <T> T accept(CodeVisitor<T> visitor) {
        return visitor.visitCast(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(base, domain());
    }

    @Override
    public String toString() {
        return domain().family() + "(" + base + ")";
    }
}
