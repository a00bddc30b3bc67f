package org.navql.engine.plan;

import org.navql.engine.domain.Domain;

import java.util.List;

/**
 * The shape of the records a query produces.
 */
public record Profile(List<Field> fields) {

    public Profile {
        fields = List.copyOf(fields);
    }

    public List<String> names() {
        return fields.stream().map(Field::name).toList();
    }

    public List<Domain> domains() {
        return fields.stream().map(Field::domain).toList();
    }
}
