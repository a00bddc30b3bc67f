package org.navql.engine.domain;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * The timestamp type, represented by {@link LocalDateTime}.
 * Accepts both {@code 'T'} and a space between date and time.
 */
public record DateTimeDomain() implements Domain {

    @Override
    public String family() {
        return "datetime";
    }

    @Override
    public Object parse(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim().replace(' ', 'T');
        try {
            if (normalized.length() == 10) {
                return LocalDateTime.parse(normalized + "T00:00:00");
            }
            return LocalDateTime.parse(normalized);
        } catch (DateTimeParseException e) {
            throw new DomainException("invalid datetime literal: '" + text + "'", e);
        }
    }

    @Override
    public String dump(Object value) {
        return value == null ? null : value.toString().replace('T', ' ');
    }

    @Override
    public Object fromDatabase(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        return value;
    }
}
