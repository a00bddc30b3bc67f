package org.navql.engine.domain;

/**
 * The integer type, represented by {@link Long}.
 */
public record IntegerDomain() implements Domain {

    @Override
    public String family() {
        return "integer";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new DomainException("invalid integer literal: '" + text + "'", e);
        }
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        return Long.toString(((Number) value).longValue());
    }

    @Override
    public Object fromDatabase(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new DomainException("Expected an integer value, got '" + text + "'", e);
            }
        }
        return value;
    }
}
