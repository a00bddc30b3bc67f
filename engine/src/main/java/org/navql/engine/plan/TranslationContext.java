package org.navql.engine.plan;

import org.navql.engine.dump.DuckDBDialect;
import org.navql.engine.dump.PostgresDialect;
import org.navql.engine.dump.SQLDialect;
import org.navql.engine.entity.Catalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Everything a translation depends on besides the query itself.
 *
 * <p>Configuration keys:
 * <ul>
 *   <li>{@code navql.dialect} - {@code duckdb} (default) or {@code postgres}</li>
 *   <li>{@code navql.limit} - default row limit applied to every query; unset for none</li>
 *   <li>{@code navql.read-only} - {@code true} to withhold write permission</li>
 * </ul>
 * The environment variables {@code NAVQL_DIALECT} and {@code NAVQL_LIMIT}
 * override the corresponding keys.
 *
 * @param catalog      The database schema
 * @param dialect      The target SQL dialect
 * @param environment  Values of {@code $name} references
 * @param permissions  Capabilities checked before execution
 * @param defaultLimit Row limit used when a translation asks for none; may be null
 */
public record TranslationContext(
        Catalog catalog,
        SQLDialect dialect,
        Map<String, Object> environment,
        Permissions permissions,
        Long defaultLimit
) {
    private static final Logger LOG = LoggerFactory.getLogger(TranslationContext.class);

    public static final String RESOURCE = "navql.properties";
    public static final String DIALECT_KEY = "navql.dialect";
    public static final String LIMIT_KEY = "navql.limit";
    public static final String READ_ONLY_KEY = "navql.read-only";

    public TranslationContext {
        Objects.requireNonNull(catalog, "Catalog cannot be null");
        Objects.requireNonNull(dialect, "Dialect cannot be null");
        Objects.requireNonNull(permissions, "Permissions cannot be null");
        environment = environment == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        if (defaultLimit != null && defaultLimit < 0) {
            throw new IllegalArgumentException("Default limit cannot be negative: " + defaultLimit);
        }
    }

    /**
     * A DuckDB context with full permissions, no environment and no default limit.
     */
    public static TranslationContext of(Catalog catalog) {
        return new TranslationContext(catalog, DuckDBDialect.INSTANCE, Map.of(), Permissions.all(), null);
    }

    public TranslationContext withEnvironment(Map<String, Object> environment) {
        return new TranslationContext(catalog, dialect, environment, permissions, defaultLimit);
    }

    public TranslationContext withPermissions(Permissions permissions) {
        return new TranslationContext(catalog, dialect, environment, permissions, defaultLimit);
    }

    public TranslationContext withDefaultLimit(Long defaultLimit) {
        return new TranslationContext(catalog, dialect, environment, permissions, defaultLimit);
    }

    /**
     * Builds a context from {@code navql.properties} on the classpath, if
     * present, and the process environment.
     */
    public static TranslationContext load(Catalog catalog) {
        Properties properties = new Properties();
        try (InputStream in = TranslationContext.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                LOG.debug("Loaded {}", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return fromProperties(properties, catalog);
    }

    public static TranslationContext fromProperties(Properties properties, Catalog catalog) {
        return fromProperties(properties, System.getenv(), catalog);
    }

    static TranslationContext fromProperties(Properties properties, Map<String, String> env, Catalog catalog) {
        String dialectName = env.getOrDefault("NAVQL_DIALECT", properties.getProperty(DIALECT_KEY, "duckdb"));
        String limit = env.getOrDefault("NAVQL_LIMIT", properties.getProperty(LIMIT_KEY));
        boolean readOnly = Boolean.parseBoolean(properties.getProperty(READ_ONLY_KEY, "false"));
        Long defaultLimit;
        try {
            defaultLimit = limit == null || limit.isBlank() ? null : Long.valueOf(limit.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + LIMIT_KEY + ": " + limit, e);
        }
        return new TranslationContext(catalog, dialect(dialectName), Map.of(),
                readOnly ? Permissions.readOnly() : Permissions.all(), defaultLimit);
    }

    /**
     * @throws IllegalArgumentException for an unknown dialect name
     */
    public static SQLDialect dialect(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "duckdb":
                return DuckDBDialect.INSTANCE;
            case "postgres":
            case "postgresql":
            case "pgsql":
                return PostgresDialect.INSTANCE;
            default:
                throw new IllegalArgumentException("Unknown SQL dialect: " + name);
        }
    }
}
