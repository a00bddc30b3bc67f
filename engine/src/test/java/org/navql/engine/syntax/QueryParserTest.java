package org.navql.engine.syntax;

import org.navql.engine.error.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Query parser")
class QueryParserTest {

    @Test
    @DisplayName("/ alone has no arm")
    void testEmptyQuery() {
        QuerySyntax query = QueryParser.parse("/");

        assertNull(query.arm());
    }

    @Test
    @DisplayName("A table name parses to an identifier")
    void testIdentifier() {
        QuerySyntax query = QueryParser.parse("/school");

        IdentifierSyntax identifier = assertInstanceOf(IdentifierSyntax.class, query.arm());
        assertEquals("school", identifier.name());
        assertEquals("school", identifier.mark().fragment());
    }

    @Test
    @DisplayName("Sieves and selections chain left to right")
    void testSieveThenSelection() {
        QuerySyntax query = QueryParser.parse("/school?campus='old'{name}");

        SelectSyntax select = assertInstanceOf(SelectSyntax.class, query.arm());
        FilterSyntax filter = assertInstanceOf(FilterSyntax.class, select.larm());
        assertInstanceOf(IdentifierSyntax.class, filter.larm());
        assertInstanceOf(OperatorSyntax.class, filter.rarm());
        assertEquals(1, select.rarm().arms().size());
    }

    @Test
    @DisplayName("Method calls compose with the dot operator")
    void testComposition() {
        QuerySyntax query = QueryParser.parse("/school.limit(2)");

        ComposeSyntax compose = assertInstanceOf(ComposeSyntax.class, query.arm());
        ApplySyntax apply = assertInstanceOf(ApplySyntax.class, compose.rarm());
        assertEquals("limit", apply.name());
        assertEquals(1, apply.arguments().size());
    }

    @Test
    @DisplayName("Malformed queries raise ParseException with a location")
    void testSyntaxError() {
        ParseException error = assertThrows(ParseException.class, () -> QueryParser.parse("/school{name"));

        assertTrue(error.hasLocation());
    }

    @Test
    @DisplayName("A query must start with a slash")
    void testMissingSlash() {
        assertThrows(ParseException.class, () -> QueryParser.parse("school"));
    }

    @Test
    @DisplayName("A query may open with a selection")
    void testRootSelection() {
        QuerySyntax query = QueryParser.parse("/{count(school), count(department)}");

        RecordSyntax record = assertInstanceOf(RecordSyntax.class, query.arm());
        assertEquals(2, record.arms().size());
    }

    @Test
    @DisplayName("A function applies to a selection through a trailing dot")
    void testComposeAfterSelection() {
        QuerySyntax query = QueryParser.parse("/school{code}.limit(2)");

        ComposeSyntax compose = assertInstanceOf(ComposeSyntax.class, query.arm());
        assertInstanceOf(SelectSyntax.class, compose.larm());
        ApplySyntax apply = assertInstanceOf(ApplySyntax.class, compose.rarm());
        assertEquals("limit", apply.name());
    }

    @Test
    @DisplayName("Division binds tighter than addition and as tight as multiplication")
    void testDivision() {
        QuerySyntax query = QueryParser.parse("/1+6/3*2");

        OperatorSyntax sum = assertInstanceOf(OperatorSyntax.class, query.arm());
        assertEquals("+", sum.symbol());
        OperatorSyntax product = assertInstanceOf(OperatorSyntax.class, sum.rarm());
        assertEquals("*", product.symbol());
        OperatorSyntax quotient = assertInstanceOf(OperatorSyntax.class, product.larm());
        assertEquals("/", quotient.symbol());
        assertEquals("6/3", quotient.mark().fragment());
    }
}
