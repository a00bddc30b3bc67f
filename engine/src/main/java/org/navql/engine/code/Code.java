package org.navql.engine.code;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;
import org.navql.engine.space.Expression;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A scalar or aggregate function over one or more spaces.
 *
 * <p>The spaces a code depends on are reached through its {@link Unit}s:
 * the indivisible functions it is built from.
 */
public abstract sealed class Code extends Expression
        permits LiteralCode, ParameterCode, CastCode, FormulaCode, CorrelationCode, Unit {

    private final Domain domain;
    private List<Unit> units;

    protected Code(Domain domain, Mark mark) {
        super(mark);
        this.domain = Objects.requireNonNull(domain, "Domain cannot be null");
    }

    public Domain domain() {
        return domain;
    }

    /**
     * The units this code is built from, each listed once, in order of
     * appearance.
     */
    public final List<Unit> units() {
        if (units == null) {
            Set<Unit> collected = new LinkedHashSet<>();
            collectUnits(collected);
            units = List.copyOf(collected);
        }
        return units;
    }

    protected abstract void collectUnits(Set<Unit> units);

    public abstract <T> T accept(CodeVisitor<T> visitor);
}
