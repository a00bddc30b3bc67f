package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.Mark;

import java.util.Objects;

/**
 * A constant. String literals are untyped until their context assigns a
 * domain to them.
 */
public record LiteralBinding(Binding base, Object value, Domain domain, Mark mark) implements Binding {

    public LiteralBinding {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
    }

    @Override
    public <T> T accept(BindingVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }
}
