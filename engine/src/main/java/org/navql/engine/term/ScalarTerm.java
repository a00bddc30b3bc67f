package org.navql.engine.term;

import org.navql.engine.space.Space;

import java.util.Map;

/**
 * A single row with no columns.
 */
public final class ScalarTerm extends NullaryTerm {

    public ScalarTerm(int tag, Space space, Space baseline) {
        super(tag, space, baseline, Map.of());
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
        return visitor.visitScalar(this);
    }
}
