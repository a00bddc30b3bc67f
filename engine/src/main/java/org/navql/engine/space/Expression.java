package org.navql.engine.space;

import org.navql.engine.error.Mark;

import java.util.List;
import java.util.Objects;

/**
 * Base of the nodes of the intermediate representation: spaces and codes.
 *
 * <p>Expressions are compared by value. Each subclass lists the components
 * that determine its meaning in {@link #basis()}; two expressions of the same
 * class with equal bases are equal. The mark is kept for error reporting and
 * never takes part in the comparison. The basis and the hash are computed
 * once, so comparing long chains stays cheap.
 */
public abstract class Expression {

    private final Mark mark;
    private List<Object> basis;
    private int hash;

    protected Expression(Mark mark) {
        this.mark = mark != null ? mark : Mark.empty();
    }

    public Mark mark() {
        return mark;
    }

    /**
     * The components that define the value of this node. Entries may be null.
     */
    protected abstract List<Object> computeBasis();

    public final List<Object> basis() {
        if (basis == null) {
            basis = computeBasis();
        }
        return basis;
    }

    @Override
    public final boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        Expression expression = (Expression) other;
        return hashCode() == expression.hashCode() && basis().equals(expression.basis());
    }

    @Override
    public final int hashCode() {
        if (hash == 0) {
            int value = Objects.hash(getClass(), basis());
            hash = value != 0 ? value : 1;
        }
        return hash;
    }
}
