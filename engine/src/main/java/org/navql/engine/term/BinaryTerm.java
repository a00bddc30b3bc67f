package org.navql.engine.term;

import org.navql.engine.code.Unit;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Map;

public abstract sealed class BinaryTerm extends Term permits JoinTerm, EmbeddingTerm {

    private final Term lkid;
    private final Term rkid;

    protected BinaryTerm(int tag, Term lkid, Term rkid, Space space, Space baseline, Map<Unit, Integer> routes) {
        super(tag, List.of(lkid, rkid), space, baseline, routes);
        this.lkid = lkid;
        this.rkid = rkid;
    }

    public Term lkid() {
        return lkid;
    }

    public Term rkid() {
        return rkid;
    }
}
