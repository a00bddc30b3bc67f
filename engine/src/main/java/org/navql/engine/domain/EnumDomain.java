package org.navql.engine.domain;

import java.util.List;
import java.util.Objects;

/**
 * An enumerated type with a fixed list of labels.
 *
 * @param labels Admissible values, in declaration order
 */
public record EnumDomain(List<String> labels) implements Domain {

    public EnumDomain {
        Objects.requireNonNull(labels, "Enum labels cannot be null");
        labels = List.copyOf(labels);
    }

    @Override
    public String family() {
        return "enum";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        if (!labels.contains(text)) {
            throw new DomainException("invalid enum literal: expected one of " + labels + "; got '" + text + "'");
        }
        return text;
    }

    @Override
    public String dump(Object value) {
        return value == null ? null : (String) value;
    }
}
