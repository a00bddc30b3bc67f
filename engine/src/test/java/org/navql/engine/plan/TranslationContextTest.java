package org.navql.engine.plan;

import org.navql.engine.SchoolFixture;
import org.navql.engine.dump.DuckDBDialect;
import org.navql.engine.dump.PostgresDialect;
import org.navql.engine.entity.Catalog;
import org.navql.engine.error.PermissionException;
import org.junit.jupiter.api.*;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationContext configuration")
class TranslationContextTest {

    private final Catalog catalog = SchoolFixture.catalog();

    @Test
    @DisplayName("Defaults: DuckDB, no limit, full permissions")
    void testDefaults() {
        TranslationContext context = TranslationContext.fromProperties(new Properties(), Map.of(), catalog);

        assertSame(DuckDBDialect.INSTANCE, context.dialect());
        assertNull(context.defaultLimit());
        assertEquals(Permissions.all(), context.permissions());
        assertTrue(context.environment().isEmpty());
    }

    @Test
    @DisplayName("Properties select the dialect, the limit and read-only mode")
    void testProperties() {
        Properties properties = new Properties();
        properties.setProperty(TranslationContext.DIALECT_KEY, "PostgreSQL");
        properties.setProperty(TranslationContext.LIMIT_KEY, " 100 ");
        properties.setProperty(TranslationContext.READ_ONLY_KEY, "true");

        TranslationContext context = TranslationContext.fromProperties(properties, Map.of(), catalog);

        assertSame(PostgresDialect.INSTANCE, context.dialect());
        assertEquals(100L, context.defaultLimit());
        assertTrue(context.permissions().mayRead());
        assertFalse(context.permissions().mayWrite());
    }

    @Test
    @DisplayName("Environment variables override properties")
    void testEnvironmentOverride() {
        Properties properties = new Properties();
        properties.setProperty(TranslationContext.DIALECT_KEY, "postgres");
        properties.setProperty(TranslationContext.LIMIT_KEY, "100");

        TranslationContext context = TranslationContext.fromProperties(properties,
                Map.of("NAVQL_DIALECT", "duckdb", "NAVQL_LIMIT", "5"), catalog);

        assertSame(DuckDBDialect.INSTANCE, context.dialect());
        assertEquals(5L, context.defaultLimit());
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void testInvalidSettings() {
        Properties properties = new Properties();
        properties.setProperty(TranslationContext.LIMIT_KEY, "many");

        assertThrows(IllegalArgumentException.class,
                () -> TranslationContext.fromProperties(properties, Map.of(), catalog));
        assertThrows(IllegalArgumentException.class, () -> TranslationContext.dialect("oracle"));
        assertThrows(IllegalArgumentException.class,
                () -> TranslationContext.of(catalog).withDefaultLimit(-1L));
    }

    @Test
    @DisplayName("Without read permission nothing may run")
    void testPermissions() {
        assertThrows(PermissionException.class, () -> Permissions.none().checkRead());
        assertDoesNotThrow(() -> Permissions.readOnly().checkRead());
    }

    @Test
    @DisplayName("The loaded context reads navql.properties from the classpath")
    void testLoad() {
        TranslationContext context = TranslationContext.load(catalog);

        assertSame(catalog, context.catalog());
        assertTrue(context.permissions().mayRead());
    }
}
