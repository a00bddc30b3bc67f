package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * A value of the environment: {@code $name}.
 */
public record ParameterBinding(Binding base, String name, Object value, Domain domain, Mark mark)
        implements Binding {

    public ParameterBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitParameter(this);
    }
}
