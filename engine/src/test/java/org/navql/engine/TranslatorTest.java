package org.navql.engine;

import org.navql.engine.error.BindException;
import org.navql.engine.error.EncodeException;
import org.navql.engine.error.EngineException;
import org.navql.engine.error.PermissionException;
import org.navql.engine.execution.JdbcQueryConnection;
import org.navql.engine.execution.Pipe;
import org.navql.engine.execution.QueryConnection;
import org.navql.engine.plan.Permissions;
import org.navql.engine.plan.Plan;
import org.navql.engine.plan.Product;
import org.navql.engine.plan.TranslationContext;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: queries are translated and run against an in-memory
 * DuckDB database.
 */
@DisplayName("Translator - DuckDB end to end")
class TranslatorTest {

    private Connection connection;
    private Translator translator;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:duckdb:");
        SchoolFixture.populate(connection);
        translator = new Translator(TranslationContext.of(SchoolFixture.catalog()));
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (connection != null && !connection.isClosed()) {
            connection.close();
        }
    }

    private Product run(String query) {
        return translator.translate(query).execute(new JdbcQueryConnection(connection));
    }

    private static List<Object> column(Product product, int index) {
        List<Object> values = new ArrayList<>();
        for (List<Object> row : product.rows()) {
            values.add(row.get(index));
        }
        return values;
    }

    private static int occurrences(String text, String fragment) {
        int count = 0;
        for (int at = text.indexOf(fragment); at >= 0; at = text.indexOf(fragment, at + 1)) {
            count++;
        }
        return count;
    }

    // ==================== Tables and filters ====================

    @Test
    @DisplayName("/school selects every column ordered by the primary key")
    void testWholeTable() {
        // GIVEN: A query for a whole table
        Pipe pipe = translator.translate("/school");
        String sql = pipe.plan().sql();

        // THEN: A flat SELECT ordered by the primary key
        assertEquals(1, occurrences(sql, "FROM"), sql);
        assertFalse(sql.contains("(SELECT"), sql);
        assertFalse(sql.contains("CROSS JOIN"), sql);
        assertTrue(sql.contains("FROM \"school\""), sql);
        assertTrue(sql.contains("ORDER BY \"school\".\"code\" ASC"), sql);
        assertFalse(sql.contains("WHERE"), sql);
        assertFalse(sql.contains("GROUP BY"), sql);
        assertFalse(sql.contains("HAVING"), sql);

        // WHEN: We execute it
        Product product = pipe.execute(new JdbcQueryConnection(connection));

        // THEN: All schools in key order, with the table columns as profile
        assertEquals(List.of("code", "name", "campus"), product.profile().names());
        assertEquals(List.of("art", "edu", "eng", "la", "ns"), column(product, 0));
        assertEquals(Arrays.asList("art", "School of Art and Design", "old"), product.rows().get(0));
        assertNull(product.rows().get(1).get(2));
    }

    @Test
    @DisplayName("/school?campus='old' filters without a nested SELECT")
    void testSieve() {
        Pipe pipe = translator.translate("/school?campus='old'");
        String sql = pipe.plan().sql();

        assertEquals(1, occurrences(sql, "FROM"), sql);
        assertFalse(sql.contains("(SELECT"), sql);
        assertFalse(sql.contains("CROSS JOIN"), sql);
        assertTrue(sql.contains("WHERE"), sql);

        Product product = pipe.execute(new JdbcQueryConnection(connection));
        assertEquals(List.of("art", "la", "ns"), column(product, 0));
    }

    @Test
    @DisplayName("/school.filter(campus='old'){name} returns the selected column only")
    void testFilterAndSelection() {
        Product product = run("/school.filter(campus='old'){name}");

        assertEquals(List.of("name"), product.profile().names());
        assertEquals(List.of("School of Art and Design", "School of Arts and Humanities",
                "School of Natural Sciences"), column(product, 0));
    }

    @Test
    @DisplayName("/school{code}?campus='old' filters the flow under the selection")
    void testSieveAfterSelection() {
        Product product = run("/school{code}?campus='old'");

        assertEquals(List.of("code"), product.profile().names());
        assertEquals(List.of("art", "la", "ns"), column(product, 0));
    }

    @Test
    @DisplayName("A table without a primary key is ordered by all its columns")
    void testTableWithoutKey() {
        Product product = run("/memo");

        assertEquals(List.of("first", "second"), column(product, 0));
    }

    // ==================== Links and aggregates ====================

    @Test
    @DisplayName("/department{name, school.name} follows a singular link with an outer join")
    void testSingularLink() {
        Pipe pipe = translator.translate("/department{name, school.name}");
        assertTrue(pipe.plan().sql().contains("LEFT OUTER JOIN"), pipe.plan().sql());

        Product product = pipe.execute(new JdbcQueryConnection(connection));
        assertEquals(8, product.rows().size());
        assertEquals(Arrays.asList("Astronomy", "School of Natural Sciences"), product.rows().get(0));
        assertEquals(Arrays.asList("Mathematics", null), product.rows().get(7));
    }

    @Test
    @DisplayName("/school{code, count(department)} groups the plural link and counts it")
    void testCountOfPluralLink() {
        Pipe pipe = translator.translate("/school{code, count(department)}");
        String sql = pipe.plan().sql();

        assertTrue(sql.contains("COUNT("), sql);
        assertTrue(sql.contains("GROUP BY"), sql);

        Product product = pipe.execute(new JdbcQueryConnection(connection));
        assertEquals(List.of(
                List.of("art", 0L),
                List.of("edu", 0L),
                List.of("eng", 4L),
                List.of("la", 1L),
                List.of("ns", 2L)), product.rows());
    }

    @Test
    @DisplayName("Aggregates reach through two plural links")
    void testCountThroughTwoLinks() {
        Product product = run("/school{code, count(department.course)}");

        assertEquals(List.of(0L, 0L, 2L, 1L, 3L), column(product, 1));
    }

    @Test
    @DisplayName("/school?exists(department) keeps schools with departments")
    void testExists() {
        Product product = run("/school?exists(department)");

        assertEquals(List.of("eng", "la", "ns"), column(product, 0));
    }

    @Test
    @DisplayName("/count(school) produces a single scalar row")
    void testScalarSegment() {
        Product product = run("/count(school)");

        assertEquals(List.of(List.of(5L)), product.rows());
        assertEquals("count(school)", product.profile().fields().get(0).name());
    }

    @Test
    @DisplayName("/{count(school), count(department)} selects several scalars over the root")
    void testRootSelection() {
        Pipe pipe = translator.translate("/{count(school), count(department)}");

        Product product = pipe.execute(new JdbcQueryConnection(connection));
        assertEquals(List.of(List.of(5L, 8L)), product.rows());
        assertEquals(List.of("count(school)", "count(department)"), product.profile().names());
    }

    @Test
    @DisplayName("Division of integers yields a decimal quotient")
    void testDivision() {
        Pipe pipe = translator.translate("/course.limit(1){no, credits/2}");
        assertTrue(pipe.plan().sql().contains(" / "), pipe.plan().sql());

        Product product = pipe.execute(new JdbcQueryConnection(connection));
        BigDecimal half = (BigDecimal) product.rows().get(0).get(1);
        assertEquals(0, half.compareTo(new BigDecimal("1.5")), half.toString());
    }

    @Test
    @DisplayName("/school^campus projects distinct non-null kernels")
    void testProjection() {
        Product product = run("/school^campus{campus, count(school)}");

        assertEquals(List.of(List.of("north", 1L), List.of("old", 3L)), product.rows());
    }

    // ==================== Ordering and slicing ====================

    @Test
    @DisplayName("/school.sort(name-) orders descending")
    void testSortDescending() {
        Product product = run("/school.sort(name-){name}");

        assertEquals("School of Natural Sciences", product.rows().get(0).get(0));
        assertEquals("College of Education", product.rows().get(4).get(0));
    }

    @Test
    @DisplayName("/school.limit(2, 1) skips one row and takes two")
    void testLimitWithOffset() {
        Product product = run("/school.limit(2, 1)");

        assertEquals(List.of("edu", "eng"), column(product, 0));
    }

    @Test
    @DisplayName("/school{code}.limit(2) slices the selected flow")
    void testLimitAfterSelection() {
        Product product = run("/school{code}.limit(2)");

        assertEquals(List.of("code"), product.profile().names());
        assertEquals(List.of("art", "edu"), column(product, 0));
    }

    @Test
    @DisplayName("A limit after a sorted selection applies to the sorted rows")
    void testLimitAfterSortedSelection() {
        Product product = run("/school{code-}.limit(2)");

        assertEquals(List.of("ns", "la"), column(product, 0));
    }

    @Test
    @DisplayName("/department.limit(2).course keeps the courses of the first two departments")
    void testLimitInNestedFlow() {
        // GIVEN: astro and be are the first departments by key; be has no courses
        Product product = run("/department.limit(2).course");

        // THEN
        assertEquals(List.of("astro", "astro"), column(product, 0));
        assertEquals(List.of(137L, 142L), column(product, 1));
    }

    @Test
    @DisplayName("An aggregate over a sliced plural link fails during translation")
    void testSlicedAggregate() {
        EncodeException error = assertThrows(EncodeException.class,
                () -> translator.translate("/school{code, count(department.limit(1))}"));

        assertEquals("a sliced plural operand is not supported", error.getMessage());
        assertFalse(error.getMark().isEmpty());
    }

    @Test
    @DisplayName("A translation limit caps the number of rows")
    void testTranslationLimit() {
        Pipe pipe = translator.translate("/school", Map.of(), 2L);

        assertTrue(pipe.plan().sql().contains("LIMIT 2"), pipe.plan().sql());
        Product product = pipe.execute(new JdbcQueryConnection(connection));
        assertEquals(List.of("art", "edu"), column(product, 0));
    }

    // ==================== Parameters ====================

    @Test
    @DisplayName("Environment references become placeholders, never inlined literals")
    void testParameterPlaceholder() {
        // GIVEN: A query referring to $campus
        Pipe pipe = translator.translate("/school?campus=$campus", Map.of("campus", "old"), null);
        Plan plan = pipe.plan();

        // THEN: The value is bound, not written into the SQL
        assertTrue(plan.sql().contains("?"), plan.sql());
        assertFalse(plan.sql().contains("'old'"), plan.sql());
        assertEquals(1, plan.placeholders().size());
        assertEquals(List.of("old"), plan.parameters());

        // WHEN/THEN: Executing uses the bound value
        Product product = pipe.execute(new JdbcQueryConnection(connection));
        assertEquals(List.of("art", "la", "ns"), column(product, 0));
    }

    @Test
    @DisplayName("A reference bound to null compares as NULL and matches nothing")
    void testNullParameter() {
        Map<String, Object> environment = new HashMap<>();
        environment.put("nothing", null);

        Pipe pipe = translator.translate("/school?campus=$nothing", environment, null);

        assertEquals(Arrays.asList((Object) null), pipe.plan().parameters());
        Product product = pipe.execute(new JdbcQueryConnection(connection));
        assertTrue(product.rows().isEmpty());
    }

    @Test
    @DisplayName("A null reference does not prevent binding other references")
    void testNullParameterBesideOthers() {
        Map<String, Object> environment = new HashMap<>();
        environment.put("nothing", null);
        environment.put("campus", "north");

        Product product = translator.translate("/school?campus=$campus", environment, null)
                .execute(new JdbcQueryConnection(connection));

        assertEquals(List.of("eng"), column(product, 0));
    }

    // ==================== Boundaries ====================

    @Test
    @DisplayName("/ has nothing to execute and produces no rows")
    void testEmptyQuery() {
        Pipe pipe = translator.translate("/");

        assertFalse(pipe.plan().hasStatement());
        Product product = pipe.execute((sql, parameters, domains) -> fail("Nothing should be executed"));
        assertFalse(product.hasData());
        assertNull(product.rows());
    }

    @Test
    @DisplayName("A denied read fails before anything reaches the connection")
    void testPermissionDenied() {
        Translator denied = new Translator(
                TranslationContext.of(SchoolFixture.catalog()).withPermissions(Permissions.none()));
        Pipe pipe = denied.translate("/school");
        QueryConnection untouchable = (sql, parameters, domains) -> fail("Query must not run");

        assertThrows(PermissionException.class, () -> pipe.execute(untouchable));
    }

    @Test
    @DisplayName("An invalid query fails during translation")
    void testTranslationError() {
        BindException error = assertThrows(BindException.class, () -> translator.translate("/nowhere"));

        assertEquals("unrecognized identifier", error.getMessage());
        assertEquals("nowhere", error.getMark().fragment());
    }

    @Test
    @DisplayName("Database failures are reported as EngineException")
    void testEngineError() {
        Pipe pipe = translator.translate("/ghost");

        EngineException error = assertThrows(EngineException.class,
                () -> pipe.execute(new JdbcQueryConnection(connection)));
        assertNotNull(error.getCause());
    }

    @Test
    @DisplayName("The PostgreSQL dialect renders the same query")
    void testPostgresDialect() {
        TranslationContext context = TranslationContext.of(SchoolFixture.catalog());
        Translator postgres = new Translator(new TranslationContext(context.catalog(),
                TranslationContext.dialect("postgresql"), Map.of(), Permissions.all(), null));

        String sql = postgres.translate("/school{code, length(name)}").plan().sql();

        assertTrue(sql.contains("CHARACTER_LENGTH("), sql);
    }
}
