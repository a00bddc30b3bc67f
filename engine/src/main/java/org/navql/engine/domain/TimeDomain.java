package org.navql.engine.domain;

import java.sql.Time;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/**
 * The time of day type, represented by {@link LocalTime}.
 */
public record TimeDomain() implements Domain {

    @Override
    public String family() {
        return "time";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        try {
            return LocalTime.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new DomainException("invalid time literal: expected a valid time in a 'HH:MM:SS' format; got '"
                    + text + "'", e);
        }
    }

    @Override
    public String dump(Object value) {
        return value == null ? null : value.toString();
    }

    @Override
    public Object fromDatabase(Object value) {
        if (value instanceof Time time) {
            return time.toLocalTime();
        }
        return value;
    }
}
