package org.navql.engine.dump;

import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.domain.DateDomain;
import org.navql.engine.domain.DateTimeDomain;
import org.navql.engine.domain.DecimalDomain;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.FloatDomain;
import org.navql.engine.domain.IntegerDomain;
import org.navql.engine.domain.TextDomain;
import org.navql.engine.domain.TimeDomain;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between database engines.
 */
public interface SQLDialect {

    /**
     * @return The dialect name (e.g., "DuckDB", "PostgreSQL")
     */
    String name();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    default String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    default String quoteStringLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    default String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    default String formatNull() {
        return "NULL";
    }

    /**
     * @param date An ISO date, e.g. "2010-04-01"
     */
    default String formatDate(String date) {
        return "DATE " + quoteStringLiteral(date);
    }

    default String formatTime(String time) {
        return "TIME " + quoteStringLiteral(time);
    }

    /**
     * @param timestamp A date and time separated by a space
     */
    default String formatTimestamp(String timestamp) {
        return "TIMESTAMP " + quoteStringLiteral(timestamp);
    }

    /**
     * @return The marker a statement parameter is rendered as
     */
    default String parameterMarker() {
        return "?";
    }

    /**
     * The type name used in {@code CAST} expressions.
     *
     * @throws IllegalArgumentException for domains with no column type
     */
    default String typeName(Domain domain) {
        if (domain instanceof BooleanDomain) {
            return "BOOLEAN";
        }
        if (domain instanceof IntegerDomain) {
            return "INTEGER";
        }
        if (domain instanceof DecimalDomain) {
            return "DECIMAL";
        }
        if (domain instanceof FloatDomain) {
            return "DOUBLE PRECISION";
        }
        if (domain instanceof TextDomain) {
            return "TEXT";
        }
        if (domain instanceof DateDomain) {
            return "DATE";
        }
        if (domain instanceof TimeDomain) {
            return "TIME";
        }
        if (domain instanceof DateTimeDomain) {
            return "TIMESTAMP";
        }
        throw new IllegalArgumentException("No SQL type for domain " + domain.family());
    }

    /**
     * Null-safe equality; a negative polarity renders the inequality.
     */
    default String formatTotalEquality(String left, String right, int polarity) {
        return "(" + left + (polarity > 0 ? " IS NOT DISTINCT FROM " : " IS DISTINCT FROM ") + right + ")";
    }

    /**
     * Case-insensitive substring test.
     */
    default String formatContains(String text, String fragment, int polarity) {
        return "(POSITION(LOWER(" + fragment + ") IN LOWER(" + text + "))" + (polarity > 0 ? " > 0)" : " = 0)");
    }

    default String formatLength(String text) {
        return "LENGTH(" + text + ")";
    }

    /**
     * @return The trailing {@code LIMIT}/{@code OFFSET} clause; either bound may be null
     */
    default String formatSlice(Long limit, Long offset) {
        StringBuilder sql = new StringBuilder();
        if (limit != null) {
            sql.append("LIMIT ").append(limit);
        }
        if (offset != null) {
            if (sql.length() > 0) {
                sql.append(' ');
            }
            sql.append("OFFSET ").append(offset);
        }
        return sql.toString();
    }
}
