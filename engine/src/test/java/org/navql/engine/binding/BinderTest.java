package org.navql.engine.binding;

import org.navql.engine.SchoolFixture;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.domain.RecordDomain;
import org.navql.engine.entity.Catalog;
import org.navql.engine.error.BindException;
import org.navql.engine.syntax.QueryParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Binder name resolution")
class BinderTest {

    private static SegmentBinding bind(Catalog catalog, String query) {
        return new Binder(catalog, Map.of()).bind(QueryParser.parse(query));
    }

    @Test
    @DisplayName("A table name binds to the rows of the table")
    void testTable() {
        SegmentBinding segment = bind(SchoolFixture.catalog(), "/school");

        TableBinding table = assertInstanceOf(TableBinding.class, segment.seed());
        assertEquals("school", table.table().name());
        assertInstanceOf(EntityDomain.class, table.domain());
    }

    @Test
    @DisplayName("A selection is titled after its elements")
    void testSelectionTitles() {
        SegmentBinding segment = bind(SchoolFixture.catalog(), "/school{code, campus}");

        SelectionBinding selection = assertInstanceOf(SelectionBinding.class, segment.seed());
        assertEquals(List.of("code", "campus"), selection.titles());
        assertInstanceOf(RecordDomain.class, selection.domain());
    }

    @Test
    @DisplayName("/ binds to an empty segment")
    void testEmptySegment() {
        assertNull(bind(SchoolFixture.catalog(), "/").seed());
    }

    @Test
    @DisplayName("An unknown name is reported as unrecognized")
    void testNotFound() {
        BindException error = assertThrows(BindException.class, () -> bind(SchoolFixture.catalog(), "/nowhere"));

        assertEquals("unrecognized identifier", error.getMessage());
    }

    @Test
    @DisplayName("A name matching tables in two schemas is reported as ambiguous")
    void testAmbiguousTable() {
        Catalog catalog = Catalog.builder()
                .schema("ad")
                .table("school", t -> t.column("code", Domain.text(), false).primaryKey("code"))
                .schema("ed")
                .table("school", t -> t.column("code", Domain.text(), false).primaryKey("code"))
                .build();

        BindException error = assertThrows(BindException.class, () -> bind(catalog, "/school"));

        assertEquals("ambiguous identifier", error.getMessage());
        assertTrue(error.getHint().contains("ad.school"), error.getHint());
        assertTrue(error.getHint().contains("ed.school"), error.getHint());
    }

    @Test
    @DisplayName("A column colliding with a link to another table is ambiguous")
    void testAmbiguousAttribute() {
        Catalog catalog = Catalog.builder()
                .table("school", t -> t.column("code", Domain.text(), false).primaryKey("code"))
                .table("department", t -> t
                        .column("code", Domain.text(), false)
                        .column("school", Domain.text(), true)
                        .column("home_code", Domain.text(), true)
                        .primaryKey("code")
                        .foreignKey(List.of("home_code"), "school", List.of("code")))
                .build();

        BindException error = assertThrows(BindException.class, () -> bind(catalog, "/department{school}"));

        assertEquals("ambiguous identifier", error.getMessage());
    }

    @Test
    @DisplayName("An undefined environment reference is rejected")
    void testUnknownReference() {
        BindException error = assertThrows(BindException.class,
                () -> bind(SchoolFixture.catalog(), "/school?code=$code"));

        assertEquals("unrecognized reference", error.getMessage());
    }

    @Test
    @DisplayName("An environment value may be null")
    void testNullReference() {
        Map<String, Object> environment = new HashMap<>();
        environment.put("nothing", null);

        SegmentBinding segment = new Binder(SchoolFixture.catalog(), environment)
                .bind(QueryParser.parse("/school?campus=$nothing"));

        assertInstanceOf(SieveBinding.class, segment.seed());
    }

    @Test
    @DisplayName("A sieve after a selection filters the selected flow")
    void testSieveAfterSelection() {
        SegmentBinding segment = bind(SchoolFixture.catalog(), "/school{code}?campus='old'");

        SelectionBinding selection = assertInstanceOf(SelectionBinding.class, segment.seed());
        assertInstanceOf(SieveBinding.class, selection.base());
        assertEquals(List.of("code"), selection.titles());
    }

    @Test
    @DisplayName("A limit after a selection slices the selected flow")
    void testLimitAfterSelection() {
        SegmentBinding segment = bind(SchoolFixture.catalog(), "/school{code}.limit(2)");

        SelectionBinding selection = assertInstanceOf(SelectionBinding.class, segment.seed());
        SortBinding sort = assertInstanceOf(SortBinding.class, selection.base());
        assertEquals(2L, sort.limit());
    }

    @Test
    @DisplayName("A selection may open the query and is taken over the root")
    void testRootSelection() {
        SegmentBinding segment = bind(SchoolFixture.catalog(), "/{count(school), count(department)}");

        SelectionBinding selection = assertInstanceOf(SelectionBinding.class, segment.seed());
        assertEquals(2, selection.elements().size());
    }

    @Test
    @DisplayName("Division of integers is decimal")
    void testDivision() {
        SegmentBinding segment = bind(SchoolFixture.catalog(), "/course{credits/2}");

        SelectionBinding selection = (SelectionBinding) segment.seed();
        assertEquals("decimal", selection.elements().get(0).domain().family());
    }

    @Test
    @DisplayName("Division of text is rejected")
    void testTextDivision() {
        BindException error = assertThrows(BindException.class,
                () -> bind(SchoolFixture.catalog(), "/school{name/name}"));

        assertEquals("expected numeric operands for /", error.getMessage());
    }
}
