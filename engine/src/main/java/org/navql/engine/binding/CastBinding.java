package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * Converts the base to another domain.
 */
public record CastBinding(Binding base, Domain domain, Mark mark) implements Binding {

    public CastBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitCast(this);
    }
}
