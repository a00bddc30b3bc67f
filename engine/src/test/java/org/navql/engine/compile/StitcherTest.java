package org.navql.engine.compile;

import org.navql.engine.SchoolFixture;
import org.navql.engine.entity.Catalog;
import org.navql.engine.error.CompileException;
import org.navql.engine.error.Mark;
import org.navql.engine.space.DirectTableSpace;
import org.navql.engine.space.RootSpace;
import org.navql.engine.space.Space;
import org.navql.engine.code.Joint;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Stitcher")
class StitcherTest {

    private final Catalog catalog = SchoolFixture.catalog();
    private final Space root = new RootSpace(Mark.empty());

    private Space table(String name) {
        return new DirectTableSpace(root, catalog.getTable("", name), Mark.empty());
    }

    @Test
    @DisplayName("Rows of a table are matched by its primary key")
    void testSewByPrimaryKey() {
        List<Joint> joints = Stitcher.sew(table("course"));

        assertEquals(2, joints.size());
        assertEquals(joints.get(0).lop(), joints.get(0).rop());
    }

    @Test
    @DisplayName("A table without a primary key cannot be connected")
    void testSewWithoutKey() {
        CompileException error = assertThrows(CompileException.class, () -> Stitcher.sew(table("memo")));

        assertEquals("unable to connect a table lacking a primary key", error.getMessage());
    }

    @Test
    @DisplayName("A table without a key is still ordered by all of its columns")
    void testArrangeWithoutKey() {
        assertEquals(1, Stitcher.arrange(table("memo")).size());
        assertEquals(2, Stitcher.arrange(table("course")).size());
    }

    @Test
    @DisplayName("The root space has nothing to sew")
    void testSewRoot() {
        assertTrue(Stitcher.sew(root).isEmpty());
    }
}
