package org.navql.engine.space;

import org.navql.engine.code.Code;

import java.util.List;
import java.util.Objects;

/**
 * Rows of a quotient: one per distinct kernel value of the seed.
 *
 * @param seed    The space being grouped
 * @param ground  The closest axis of the seed spanned by the quotient base
 * @param kernels The grouping expressions
 */
public record QuotientFamily(Space seed, Space ground, List<Code> kernels) implements Family {

    public QuotientFamily {
        Objects.requireNonNull(seed, "Seed cannot be null");
        Objects.requireNonNull(ground, "Ground cannot be null");
        kernels = List.copyOf(kernels);
    }

    @Override
    public boolean isQuotient() {
        return true;
    }
}
