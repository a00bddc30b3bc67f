package org.navql.engine.execution;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.DomainException;
import org.navql.engine.error.EngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Runs statements over a JDBC connection. The connection is borrowed: it is
 * neither committed nor closed here.
 */
public final class JdbcQueryConnection implements QueryConnection {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcQueryConnection.class);

    private final Connection connection;

    public JdbcQueryConnection(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
    }

    @Override
    public List<List<Object>> execute(String sql, List<Object> parameters, List<Domain> domains) {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < parameters.size(); i++) {
                statement.setObject(i + 1, toDatabase(parameters.get(i)));
            }
            List<List<Object>> rows = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                int width = rs.getMetaData().getColumnCount();
                if (width != domains.size()) {
                    throw new IllegalStateException(
                            "Expected " + domains.size() + " result columns, got " + width);
                }
                while (rs.next()) {
                    Object[] row = new Object[width];
                    for (int i = 0; i < width; i++) {
                        row[i] = domains.get(i).fromDatabase(rs.getObject(i + 1));
                    }
                    rows.add(Arrays.asList(row));
                }
            }
            LOG.debug("Fetched {} row(s)", rows.size());
            return rows;
        } catch (SQLException e) {
            LOG.warn("Query failed: {}", e.getMessage());
            throw new EngineException("Failed to execute query", e);
        } catch (DomainException e) {
            LOG.warn("Result conversion failed: {}", e.getMessage());
            throw new EngineException("Failed to convert query result", e);
        }
    }

    private static Object toDatabase(Object value) {
        if (value instanceof LocalDate date) {
            return java.sql.Date.valueOf(date);
        }
        if (value instanceof LocalTime time) {
            return java.sql.Time.valueOf(time);
        }
        if (value instanceof LocalDateTime dateTime) {
            return java.sql.Timestamp.valueOf(dateTime);
        }
        return value;
    }
}
