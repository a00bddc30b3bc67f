package org.navql.engine.frame;

import org.navql.engine.domain.Domain;

import java.util.Objects;

public record CastPhrase(Phrase base, Domain domain, boolean isNullable) implements Phrase {

    public CastPhrase {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
    }

    public CastPhrase withBase(Phrase base) {
        return new CastPhrase(base, domain, isNullable);
    }

    @Override
    public <T> T accept(PhraseVisitor<T> visitor) {
        return visitor.visitCast(this);
    }
}
