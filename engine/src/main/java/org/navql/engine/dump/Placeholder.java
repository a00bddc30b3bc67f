package org.navql.engine.dump;

import org.navql.engine.domain.Domain;

import java.util.Objects;

/**
 * A parameter marker of a statement, numbered from 1 in order of appearance.
 */
public record Placeholder(int position, String name, Object value, Domain domain) {

    public Placeholder {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
    }
}
