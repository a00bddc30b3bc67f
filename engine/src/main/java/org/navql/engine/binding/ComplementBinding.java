package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * The seed rows belonging to each row of the quotient in scope: {@code ^}.
 */
public record ComplementBinding(Binding base, Mark mark) implements Binding {

    public ComplementBinding {
        Objects.requireNonNull(base, "Base cannot be null");
    }

    @Override
    public Domain domain() {
        return new EntityDomain();
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitComplement(this);
    }
}
