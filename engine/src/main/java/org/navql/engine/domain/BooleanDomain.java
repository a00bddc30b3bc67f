package org.navql.engine.domain;

/**
 * The Boolean type: {@code true} and {@code false}.
 */
public record BooleanDomain() implements Domain {

    @Override
    public String family() {
        return "boolean";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        return switch (text.toLowerCase()) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> throw new DomainException("invalid Boolean literal: expected 'true' or 'false'; got '" + text + "'");
        };
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        return ((Boolean) value) ? "true" : "false";
    }
}
