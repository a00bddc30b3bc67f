package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.VoidDomain;
import org.navql.engine.error.Mark;

/**
 * The root scope, where tables are looked up.
 */
public record RootBinding(Mark mark) implements Binding {

    @Override
    public Binding base() {
        return null;
    }

    @Override
    public Domain domain() {
        return new VoidDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitRoot(this);
    }
}
