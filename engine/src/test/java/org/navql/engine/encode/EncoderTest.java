package org.navql.engine.encode;

import org.navql.engine.SchoolFixture;
import org.navql.engine.binding.Binder;
import org.navql.engine.code.SegmentExpr;
import org.navql.engine.error.EncodeException;
import org.navql.engine.space.FilteredSpace;
import org.navql.engine.space.Space;
import org.navql.engine.space.TableSpace;
import org.navql.engine.syntax.QueryParser;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Encoder")
class EncoderTest {

    private static SegmentExpr encode(String query) {
        Binder binder = new Binder(SchoolFixture.catalog(), Map.of());
        return new Encoder().encode(binder.bind(QueryParser.parse(query)));
    }

    @Test
    @DisplayName("A table segment encodes to its table space with one code per column")
    void testTable() {
        SegmentExpr segment = encode("/school");

        assertInstanceOf(TableSpace.class, segment.space());
        assertEquals("school", ((TableSpace) segment.space()).table().name());
        assertEquals(3, segment.codes().size());
    }

    @Test
    @DisplayName("A scalar segment lives in the root space, filtered on its value being present")
    void testScalar() {
        SegmentExpr segment = encode("/count(school)");

        assertInstanceOf(FilteredSpace.class, segment.space());
        assertEquals(segment.root(), segment.space().base());
        assertEquals(segment.root(), segment.space().inflate());
        assertEquals(1, segment.codes().size());
    }

    @Test
    @DisplayName("Selecting a plural link without an aggregate is rejected")
    void testPluralWithoutAggregate() {
        EncodeException error = assertThrows(EncodeException.class, () -> encode("/school{department.name}"));

        assertEquals("expected a singular expression", error.getMessage());
        assertFalse(error.getMark().isEmpty());
    }

    @Test
    @DisplayName("An aggregate of a singular operand is rejected")
    void testSingularAggregate() {
        EncodeException error = assertThrows(EncodeException.class, () -> encode("/school{count(name)}"));

        assertEquals("a plural operand is required", error.getMessage());
    }

    @ParameterizedTest
    @DisplayName("An aggregate over a sliced plural operand is rejected")
    @ValueSource(strings = {
            "/school{code, count(department.limit(1))}",
            "/school{code, max(department.sort(name).limit(2).code)}",
            "/school{code, exists(department.limit(1,1))}",
            "/school{code, count(department.limit(1).course)}"
    })
    void testSlicedPluralOperand(String query) {
        EncodeException error = assertThrows(EncodeException.class, () -> encode(query));

        assertEquals("a sliced plural operand is not supported", error.getMessage());
    }

    @Test
    @DisplayName("A slice of the segment flow itself is accepted")
    void testSlicedSegment() {
        SegmentExpr segment = encode("/department.limit(2){name, count(course)}");

        assertEquals(2, segment.codes().size());
    }

    @Test
    @DisplayName("Codes of a selection are spanned by the segment space")
    void testSelectionSpans() {
        SegmentExpr segment = encode("/department{name, school.name}");
        Space space = segment.space();

        segment.codes().forEach(code -> code.units().forEach(unit -> assertTrue(space.spans(unit.space()))));
    }
}
