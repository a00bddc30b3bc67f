package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.VoidDomain;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * A scope nested in {@code base} where tables are looked up again, as in
 * {@code @table}.
 */
public record HomeBinding(Binding base, Mark mark) implements Binding {

    public HomeBinding {
        Objects.requireNonNull(base, "Base cannot be null");
    }

    @Override
    public Domain domain() {
        return new VoidDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitHome(this);
    }
}
