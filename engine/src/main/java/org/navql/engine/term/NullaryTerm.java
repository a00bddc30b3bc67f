package org.navql.engine.term;

import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Map;

/**
 * A term with no kids: the source of rows.
 */
public abstract sealed class NullaryTerm extends Term permits ScalarTerm, TableTerm {

    protected NullaryTerm(int tag, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, List.of(), space, baseline, routes);
    }

    @Override
    public boolean isNullary() {
        return true;
    }
}
