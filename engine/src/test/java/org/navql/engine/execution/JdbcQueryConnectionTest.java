package org.navql.engine.execution;

import org.navql.engine.domain.DomainException;
import org.navql.engine.domain.IntegerDomain;
import org.navql.engine.domain.TextDomain;
import org.navql.engine.error.EngineException;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdbcQueryConnection")
class JdbcQueryConnectionTest {

    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:duckdb:");
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (connection != null && !connection.isClosed()) {
            connection.close();
        }
    }

    @Test
    @DisplayName("Values are converted through the column domains")
    void testConversion() {
        // WHEN
        List<List<Object>> rows = new JdbcQueryConnection(connection).execute(
                "SELECT 7, '42', 'x'", List.of(), List.of(new IntegerDomain(), new IntegerDomain(), new TextDomain()));

        // THEN
        assertEquals(List.of(List.of(7L, 42L, "x")), rows);
    }

    @Test
    @DisplayName("A driver error is wrapped in EngineException")
    void testDriverError() {
        JdbcQueryConnection jdbc = new JdbcQueryConnection(connection);
        EngineException error = assertThrows(EngineException.class,
                () -> jdbc.execute("SELECT * FROM missing_table", List.of(), List.of(new IntegerDomain())));
        assertInstanceOf(SQLException.class, error.getCause());
    }

    @Test
    @DisplayName("A value the domain cannot convert is wrapped in EngineException")
    void testConversionError() {
        // GIVEN a text column read through an integer domain
        JdbcQueryConnection jdbc = new JdbcQueryConnection(connection);

        // WHEN / THEN
        EngineException error = assertThrows(EngineException.class,
                () -> jdbc.execute("SELECT 'abc'", List.of(), List.of(new IntegerDomain())));
        assertInstanceOf(DomainException.class, error.getCause());
        assertTrue(error.getMessage().contains("abc"), error.getMessage());
    }
}
