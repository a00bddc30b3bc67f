package org.navql.engine.plan;

import org.navql.engine.domain.Domain;

import java.util.Objects;

/**
 * A named output column; the name is null for an untitled expression.
 */
public record Field(String name, Domain domain) {

    public Field {
        Objects.requireNonNull(domain, "Domain cannot be null");
    }
}
