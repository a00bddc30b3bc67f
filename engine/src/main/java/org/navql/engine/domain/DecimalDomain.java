package org.navql.engine.domain;

import java.math.BigDecimal;

/**
 * The exact numeric type, represented by {@link BigDecimal}.
 */
public record DecimalDomain() implements Domain {

    @Override
    public String family() {
        return "decimal";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new DomainException("invalid decimal literal: '" + text + "'", e);
        }
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        return ((BigDecimal) value).toString();
    }

    @Override
    public Object fromDatabase(Object value) {
        if (value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return value;
    }
}
