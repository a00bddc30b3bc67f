package org.navql.engine.frame;

import org.navql.engine.domain.Domain;

import java.util.Objects;

/**
 * A value supplied by the caller. Always rendered as a placeholder, never
 * inlined.
 */
public record ParameterPhrase(String name, Object value, Domain domain) implements Phrase {

    public ParameterPhrase {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
    }

    @Override
    public boolean isNullable() {
        return value == null;
    }

    @Override
    public <T> T accept(PhraseVisitor<T> visitor) {
        return visitor.visitParameter(this);
    }
}
