package org.navql.engine.domain;

import java.sql.Date;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * The calendar date type, represented by {@link LocalDate}.
 */
public record DateDomain() implements Domain {

    @Override
    public String family() {
        return "date";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new DomainException("invalid date literal: expected a valid date in a 'YYYY-MM-DD' format; got '"
                    + text + "'", e);
        }
    }

    @Override
    public String dump(Object value) {
        return value == null ? null : value.toString();
    }

    @Override
    public Object fromDatabase(Object value) {
        if (value instanceof Date date) {
            return date.toLocalDate();
        }
        return value;
    }
}
