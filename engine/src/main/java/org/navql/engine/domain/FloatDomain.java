package org.navql.engine.domain;

/**
 * The IEEE 754 floating point type, represented by {@link Double}.
 */
public record FloatDomain() implements Domain {

    @Override
    public String family() {
        return "float";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        try {
            double value = Double.parseDouble(text.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new DomainException("invalid float literal: '" + text + "'");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new DomainException("invalid float literal: '" + text + "'", e);
        }
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        return Double.toString(((Number) value).doubleValue());
    }

    @Override
    public Object fromDatabase(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value;
    }
}
