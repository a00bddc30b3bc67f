package org.navql.engine.dump;

import org.navql.engine.domain.DecimalDomain;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.FloatDomain;
import org.navql.engine.domain.VoidDomain;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SQL dialects")
class SQLDialectTest {

    private final SQLDialect duckdb = DuckDBDialect.INSTANCE;
    private final SQLDialect postgres = PostgresDialect.INSTANCE;

    @Test
    @DisplayName("Identifiers are double-quoted with embedded quotes doubled")
    void testQuoteIdentifier() {
        assertEquals("\"school\"", duckdb.quoteIdentifier("school"));
        assertEquals("\"a\"\"b\"", duckdb.quoteIdentifier("a\"b"));
    }

    @Test
    @DisplayName("String literals escape single quotes")
    void testQuoteStringLiteral() {
        assertEquals("'O''Neil'", duckdb.quoteStringLiteral("O'Neil"));
        assertEquals("''", postgres.quoteStringLiteral(""));
    }

    @Test
    @DisplayName("Slices render LIMIT and OFFSET only when set")
    void testFormatSlice() {
        assertEquals("LIMIT 2 OFFSET 1", duckdb.formatSlice(2L, 1L));
        assertEquals("LIMIT 2", duckdb.formatSlice(2L, null));
        assertEquals("OFFSET 3", duckdb.formatSlice(null, 3L));
        assertEquals("", duckdb.formatSlice(null, null));
    }

    @Test
    @DisplayName("Type names follow the target database")
    void testTypeNames() {
        assertEquals("VARCHAR", duckdb.typeName(Domain.text()));
        assertEquals("TEXT", postgres.typeName(Domain.text()));
        assertEquals("DECIMAL(38,10)", duckdb.typeName(new DecimalDomain()));
        assertEquals("DOUBLE", duckdb.typeName(new FloatDomain()));
        assertEquals("INTEGER", postgres.typeName(Domain.integer()));
        assertEquals("BOOLEAN", duckdb.typeName(Domain.bool()));
    }

    @Test
    @DisplayName("Domains without a column type have no type name")
    void testTypeNameUnsupported() {
        assertThrows(IllegalArgumentException.class, () -> duckdb.typeName(new VoidDomain()));
    }

    @Test
    @DisplayName("Null-safe equality and substring tests")
    void testOperators() {
        assertEquals("(a IS NOT DISTINCT FROM b)", duckdb.formatTotalEquality("a", "b", 1));
        assertEquals("(a IS DISTINCT FROM b)", duckdb.formatTotalEquality("a", "b", -1));
        assertEquals("(POSITION(LOWER(b) IN LOWER(a)) > 0)", duckdb.formatContains("a", "b", 1));
        assertEquals("LENGTH(a)", duckdb.formatLength("a"));
        assertEquals("CHARACTER_LENGTH(a)", postgres.formatLength("a"));
    }
}
