package org.navql.engine.domain;

/**
 * The domain of a string literal whose type is not yet known.
 * It is coerced to a concrete domain by the context it appears in.
 */
public record UntypedDomain() implements Domain {

    @Override
    public String family() {
        return "untyped";
    }

    @Override
    public Object parse(String text) {
        return text;
    }

    @Override
    public String dump(Object value) {
        return value == null ? null : (String) value;
    }
}
