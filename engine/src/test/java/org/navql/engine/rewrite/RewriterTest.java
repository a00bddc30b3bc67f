package org.navql.engine.rewrite;

import org.navql.engine.SchoolFixture;
import org.navql.engine.binding.Binder;
import org.navql.engine.code.SegmentExpr;
import org.navql.engine.encode.Encoder;
import org.navql.engine.space.FilteredSpace;
import org.navql.engine.syntax.QueryParser;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Rewriter")
class RewriterTest {

    private static SegmentExpr encode(String query) {
        Binder binder = new Binder(SchoolFixture.catalog(), Map.of());
        return new Encoder().encode(binder.bind(QueryParser.parse(query)));
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
            "/school",
            "/school?campus='old'{name}",
            "/school{code, count(department)}",
            "/department{name, school.name}",
            "/school^campus{campus, count(school)}",
            "/school.sort(name-).limit(2)",
            "/count(school)"
    })
    @DisplayName("Rewriting a rewritten segment changes nothing")
    void testIdempotence(String query) {
        Rewriter rewriter = new Rewriter();
        SegmentExpr once = rewriter.rewrite(encode(query));
        SegmentExpr twice = rewriter.rewrite(once);

        assertEquals(once, twice);
    }

    @Test
    @DisplayName("A filter by true() disappears")
    void testTrueFilterDropped() {
        SegmentExpr rewritten = new Rewriter().rewrite(encode("/school?true()"));

        assertFalse(rewritten.space() instanceof FilteredSpace, rewritten.toString());
        assertEquals(new Rewriter().rewrite(encode("/school")).space(), rewritten.space());
    }
}
