package org.navql.engine.signature;

import java.util.Objects;
import java.util.Set;

/**
 * An ordering comparison; {@code relation} is one of {@code <}, {@code <=},
 * {@code >}, {@code >=}.
 */
public record CompareSig(String relation) implements Signature {

    private static final Set<String> RELATIONS = Set.of("<", "<=", ">", ">=");

    public CompareSig {
        Objects.requireNonNull(relation, "Relation cannot be null");
        if (!RELATIONS.contains(relation)) {
            throw new IllegalArgumentException("Unknown comparison relation: " + relation);
        }
    }

    @Override
    public int arity() {
        return 2;
    }
}
