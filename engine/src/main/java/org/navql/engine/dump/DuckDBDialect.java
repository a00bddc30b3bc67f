package org.navql.engine.dump;

import org.navql.engine.domain.DecimalDomain;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.FloatDomain;
import org.navql.engine.domain.TextDomain;

/**
 * SQL dialect implementation for DuckDB.
 * DuckDB uses double quotes for identifiers and single quotes for strings.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    private DuckDBDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "DuckDB";
    }

    @Override
    public String typeName(Domain domain) {
        // A bare DECIMAL is DECIMAL(18,3) in DuckDB
        if (domain instanceof DecimalDomain) {
            return "DECIMAL(38,10)";
        }
        if (domain instanceof FloatDomain) {
            return "DOUBLE";
        }
        if (domain instanceof TextDomain) {
            return "VARCHAR";
        }
        return SQLDialect.super.typeName(domain);
    }
}
