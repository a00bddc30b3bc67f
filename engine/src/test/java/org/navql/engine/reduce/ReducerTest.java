package org.navql.engine.reduce;

import org.navql.engine.SchoolFixture;
import org.navql.engine.assemble.Assembler;
import org.navql.engine.binding.Binder;
import org.navql.engine.code.SegmentExpr;
import org.navql.engine.compile.Compiler;
import org.navql.engine.dump.DuckDBDialect;
import org.navql.engine.dump.SQLSerializer;
import org.navql.engine.dump.Placeholder;
import org.navql.engine.dump.SQLStatement;
import org.navql.engine.encode.Encoder;
import org.navql.engine.execution.JdbcQueryConnection;
import org.navql.engine.frame.Anchor;
import org.navql.engine.frame.FormulaPhrase;
import org.navql.engine.frame.NestedFrame;
import org.navql.engine.frame.Phrase;
import org.navql.engine.frame.SegmentFrame;
import org.navql.engine.frame.TableFrame;
import org.navql.engine.rewrite.Rewriter;
import org.navql.engine.signature.AndSig;
import org.navql.engine.syntax.QueryParser;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reducer")
class ReducerTest {

    private final Reducer reducer = new Reducer();
    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:duckdb:");
        SchoolFixture.populate(connection);
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (connection != null && !connection.isClosed()) {
            connection.close();
        }
    }

    private static SegmentFrame assemble(String query) {
        Binder binder = new Binder(SchoolFixture.catalog(), Map.of());
        SegmentExpr expression = new Rewriter().rewrite(new Encoder().encode(binder.bind(QueryParser.parse(query))));
        return new Assembler().assemble(new Compiler().compile(expression));
    }

    private static String sql(SegmentFrame frame) {
        return new SQLSerializer(DuckDBDialect.INSTANCE).serialize(frame).sql();
    }

    // ==================== Collapsing ====================

    @Test
    @DisplayName("A filtered selection collapses into a single table frame")
    void testFilterCollapses() {
        SegmentFrame frame = reducer.reduce(assemble("/school?campus='old'{name}"));

        assertEquals(1, frame.clauses().include().size());
        assertInstanceOf(TableFrame.class, frame.clauses().include().get(0).frame());
        assertNotNull(frame.clauses().where());
    }

    @Test
    @DisplayName("A singular link keeps one table frame per table")
    void testLinkCollapses() {
        SegmentFrame frame = reducer.reduce(assemble("/department{name, school.name}"));

        for (Anchor anchor : frame.clauses().include()) {
            assertInstanceOf(TableFrame.class, anchor.frame());
        }
    }

    @Test
    @DisplayName("A grouped subframe joined to its parent is kept")
    void testGroupedSubframeKept() {
        SegmentFrame frame = reducer.reduce(assemble("/school{code, count(department)}"));

        assertTrue(frame.clauses().include().stream().anyMatch(anchor -> anchor.frame() instanceof NestedFrame),
                sql(frame));
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
            "/school.filter(campus='old').select(name)",
            "/department{name, school.name}",
            "/school{code, count(department)}",
            "/school.sort(name-).limit(3, 1)",
            "/school^campus{campus, count(school)}",
            "/{count(school), count(department)}",
            "/school{code}?campus='old'",
            "/school{code-}.limit(2)"
    })
    @DisplayName("Reduction never changes the rows of a query")
    void testRowsPreserved(String query) {
        // GIVEN: The assembled frame and its reduced form
        SegmentFrame assembled = assemble(query);
        SegmentFrame reduced = reducer.reduce(assembled);

        // WHEN: Both are executed
        List<List<Object>> expected = execute(assembled);
        List<List<Object>> actual = execute(reduced);

        // THEN: Same rows in the same order
        assertEquals(expected, actual, sql(reduced));
    }

    private List<List<Object>> execute(SegmentFrame frame) {
        SQLStatement statement = new SQLSerializer(DuckDBDialect.INSTANCE).serialize(frame);
        List<Object> parameters = statement.placeholders().stream().map(Placeholder::value).toList();
        return new JdbcQueryConnection(connection).execute(statement.sql(), parameters,
                frame.clauses().select().stream().map(Phrase::domain).toList());
    }

    // ==================== Simplification ====================

    @Test
    @DisplayName("true() disappears from a conjunction")
    void testTrueDroppedFromConjunction() {
        SegmentFrame frame = reducer.reduce(assemble("/school?campus='old'&true()"));

        assertFalse(frame.clauses().where() instanceof FormulaPhrase formula
                && formula.signature() instanceof AndSig, sql(frame));
        assertFalse(sql(frame).contains("TRUE"), sql(frame));
    }

    @Test
    @DisplayName("A disjunction with true() leaves no WHERE clause")
    void testTrueDisjunction() {
        SegmentFrame frame = reducer.reduce(assemble("/school?campus='old'|true()"));

        assertNull(frame.clauses().where(), sql(frame));
    }

    @Test
    @DisplayName("Double negation cancels")
    void testDoubleNegation() {
        String negated = sql(reducer.reduce(assemble("/school?!!(campus='old')")));
        String plain = sql(reducer.reduce(assemble("/school?campus='old'")));

        assertEquals(plain, negated);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"/school?1=1", "/school?'a'='a'", "/school?2>1"})
    @DisplayName("Comparisons of non-Boolean literals are left to the database")
    void testLiteralComparisonKept(String query) {
        SegmentFrame frame = reducer.reduce(assemble(query));

        assertInstanceOf(FormulaPhrase.class, frame.clauses().where(), sql(frame));
        assertFalse(sql(frame).contains("TRUE"), sql(frame));
    }

    @Test
    @DisplayName("A sliced subflow is reduced without changing its rows")
    void testSlicedSubflow() {
        SegmentFrame assembled = assemble("/department.limit(2).course");
        SegmentFrame reduced = reducer.reduce(assembled);

        assertTrue(sql(reduced).contains("LIMIT 2"), sql(reduced));
        assertEquals(execute(assembled), execute(reduced), sql(reduced));
        assertEquals(2, execute(reduced).size());
    }

    @Test
    @DisplayName("Reducing twice gives the same SQL")
    void testIdempotence() {
        SegmentFrame once = reducer.reduce(assemble("/school{code, count(department.course)}"));
        SegmentFrame twice = reducer.reduce(once);

        assertEquals(sql(once), sql(twice));
    }
}
