package org.navql.engine.dump;

import org.navql.engine.domain.DecimalDomain;
import org.navql.engine.domain.Domain;

/**
 * SQL dialect implementation for PostgreSQL.
 */
public final class PostgresDialect implements SQLDialect {

    public static final PostgresDialect INSTANCE = new PostgresDialect();

    private PostgresDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "PostgreSQL";
    }

    @Override
    public String typeName(Domain domain) {
        if (domain instanceof DecimalDomain) {
            return "NUMERIC";
        }
        return SQLDialect.super.typeName(domain);
    }

    @Override
    public String formatLength(String text) {
        return "CHARACTER_LENGTH(" + text + ")";
    }
}
