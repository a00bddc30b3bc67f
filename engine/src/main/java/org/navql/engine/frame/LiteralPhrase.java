package org.navql.engine.frame;

import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.domain.Domain;

import java.util.Objects;

public record LiteralPhrase(Object value, Domain domain) implements Phrase {

    public LiteralPhrase {
        Objects.requireNonNull(domain, "Domain cannot be null");
    }

    public static LiteralPhrase of(boolean value) {
        return new LiteralPhrase(value, new BooleanDomain());
    }

    public static LiteralPhrase nullOf(Domain domain) {
        return new LiteralPhrase(null, domain);
    }

    @Override
    public boolean isNullable() {
        return value == null;
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(value) && domain instanceof BooleanDomain;
    }

    public boolean isFalse() {
        return Boolean.FALSE.equals(value) && domain instanceof BooleanDomain;
    }

    @Override
    public <T> T accept(PhraseVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }
}
