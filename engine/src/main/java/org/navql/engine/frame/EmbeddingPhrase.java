package org.navql.engine.frame;

import org.navql.engine.domain.Domain;

import java.util.Objects;

/**
 * The single value of the correlated subquery with the given tag; the
 * subquery itself is kept in the {@code embed} list of the enclosing frame.
 */
public record EmbeddingPhrase(int tag, Domain domain, boolean isNullable) implements ExportPhrase {

    public EmbeddingPhrase {
        Objects.requireNonNull(domain, "Domain cannot be null");
    }

    @Override
    public <T> T accept(PhraseVisitor<T> visitor) {
        return visitor.visitEmbedding(this);
    }
}
