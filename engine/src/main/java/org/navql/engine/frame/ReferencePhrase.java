package org.navql.engine.frame;

import org.navql.engine.domain.Domain;

import java.util.Objects;

/**
 * The value at position {@code index} of the select list of the subquery
 * with the given tag.
 */
public record ReferencePhrase(int tag, int index, Domain domain, boolean isNullable) implements ExportPhrase {

    public ReferencePhrase {
        Objects.requireNonNull(domain, "Domain cannot be null");
    }

    @Override
    public <T> T accept(PhraseVisitor<T> visitor) {
        return visitor.visitReference(this);
    }
}
