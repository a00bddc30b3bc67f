package org.navql.engine.assemble;

import org.navql.engine.SchoolFixture;
import org.navql.engine.binding.Binder;
import org.navql.engine.code.SegmentExpr;
import org.navql.engine.compile.Compiler;
import org.navql.engine.encode.Encoder;
import org.navql.engine.frame.Anchor;
import org.navql.engine.frame.BranchFrame;
import org.navql.engine.frame.Frame;
import org.navql.engine.frame.NestedFrame;
import org.navql.engine.frame.SegmentFrame;
import org.navql.engine.rewrite.Rewriter;
import org.navql.engine.syntax.QueryParser;
import org.navql.engine.term.SegmentTerm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Assembler")
class AssemblerTest {

    private static SegmentTerm compile(String query) {
        Binder binder = new Binder(SchoolFixture.catalog(), Map.of());
        SegmentExpr expression = new Rewriter().rewrite(new Encoder().encode(binder.bind(QueryParser.parse(query))));
        return new Compiler().compile(expression);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
            "/school",
            "/school{code, count(department)}",
            "/school{code, count(department.course)}",
            "/department{name, school.name}",
            "/school^campus{campus, count(school)}",
            "/school?exists(department)"
    })
    @DisplayName("Every claim is supplied by its broker")
    void testClaimsSupplied(String query) {
        AssemblingState state = new AssemblingState();
        new Assembler().assemble(compile(query), state);

        for (Claim claim : state.claims()) {
            assertTrue(state.supplied().containsKey(claim), "Unsupplied claim " + claim);
        }
    }

    @Test
    @DisplayName("The segment frame selects one phrase per output column")
    void testSegmentSelect() {
        SegmentFrame frame = new Assembler().assemble(compile("/school{code, name}"));

        assertEquals(2, frame.clauses().select().size());
        assertEquals(2, frame.outputs().size());
        assertFalse(frame.clauses().include().isEmpty());
    }

    @Test
    @DisplayName("A plural aggregate is assembled into a grouped subframe")
    void testAggregateGroups() {
        SegmentFrame frame = new Assembler().assemble(compile("/school{code, count(department)}"));

        // Before reduction the segment reads from a single nested frame
        assertEquals(1, frame.clauses().include().size());
        assertInstanceOf(NestedFrame.class, frame.clauses().include().get(0).frame());
        assertFalse(frame.clauses().hasGroup());
        assertTrue(hasGroupedFrame(frame.clauses().include().get(0).frame()));
    }

    private static boolean hasGroupedFrame(Frame frame) {
        if (!(frame instanceof BranchFrame branch)) {
            return false;
        }
        if (branch.clauses().hasGroup()) {
            return true;
        }
        for (Anchor anchor : branch.clauses().include()) {
            if (hasGroupedFrame(anchor.frame())) {
                return true;
            }
        }
        return branch.clauses().embed().stream().anyMatch(AssemblerTest::hasGroupedFrame);
    }
}
