package org.navql.engine.term;

import org.navql.engine.code.Code;
import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Map;

/**
 * The distinct values of the kernel expressions over the rows of the kid,
 * the {@code GROUP BY} of the query.
 */
public final class ProjectionTerm extends UnaryTerm {

    private final List<Code> kernels;

    public ProjectionTerm(int tag, Term kid, List<Code> kernels, Space space, Space baseline,
                          Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
        this.kernels = List.copyOf(kernels);
    }

    public List<Code> kernels() {
        return kernels;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitProjection(this);
    }
}
