package org.navql.engine.execution;

import org.navql.engine.domain.Domain;
import org.navql.engine.error.EngineException;

import java.util.List;

/**
 * The capability to run a translated statement.
 */
public interface QueryConnection {

    /**
     * Runs a statement and fetches all its rows.
     *
     * @param sql        The statement text
     * @param parameters Values bound to the parameter markers, in order
     * @param domains    The domains of the result columns, used to normalize driver values
     * @return The rows, each with one value per result column
     * @throws EngineException if the database rejects the statement or the connection fails
     */
    List<List<Object>> execute(String sql, List<Object> parameters, List<Domain> domains);
}
