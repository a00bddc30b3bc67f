package org.navql.engine.domain;

/**
 * A value of a type the translator does not understand.
 * Dumping uses {@code toString()} and parsing returns the text, so the
 * round trip is lossy.
 */
public record OpaqueDomain() implements Domain {

    @Override
    public String family() {
        return "opaque";
    }

    @Override
    public Object parse(String text) {
        return text;
    }

    @Override
    public String dump(Object value) {
        return value == null ? null : value.toString();
    }
}
