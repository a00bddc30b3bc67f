package org.navql.engine.frame;

import org.navql.engine.entity.TableEntity;
import org.navql.engine.term.Term;

import java.util.Objects;

public final class TableFrame extends Frame {

    private final TableEntity table;

    public TableFrame(TableEntity table, Term term) {
        super(term);
        this.table = Objects.requireNonNull(table, "Table cannot be null");
    }

    public TableEntity table() {
        return table;
    }

    @Override
    public <T> T accept(FrameVisitor<T> visitor) {
        return visitor.visitTable(this);
    }
}
