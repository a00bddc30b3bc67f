package org.navql.engine.space;

import org.navql.engine.SchoolFixture;
import org.navql.engine.code.ColumnUnit;
import org.navql.engine.code.FormulaCode;
import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.entity.Catalog;
import org.navql.engine.entity.Join;
import org.navql.engine.entity.TableEntity;
import org.navql.engine.error.Mark;
import org.navql.engine.signature.IsNullSig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Space relations")
class SpaceTest {

    private final Mark mark = Mark.empty();

    private Space root;
    private Space school;
    private Space department;
    private Space schoolDepartment;
    private Space departmentSchool;
    private Space campusSchool;
    private List<Space> spaces;

    @BeforeEach
    void setUp() {
        Catalog catalog = SchoolFixture.catalog();
        TableEntity schoolTable = catalog.getTable("", "school");
        TableEntity departmentTable = catalog.getTable("", "department");
        root = new RootSpace(mark);
        school = new DirectTableSpace(root, schoolTable, mark);
        department = new DirectTableSpace(root, departmentTable, mark);
        schoolDepartment = new FiberTableSpace(school, join(catalog, schoolTable, "department"), mark);
        departmentSchool = new FiberTableSpace(department, join(catalog, departmentTable, "school"), mark);
        campusSchool = new FilteredSpace(school, new FormulaCode(new IsNullSig(-1), new BooleanDomain(), mark,
                new ColumnUnit(schoolTable.getColumn("campus"), school, mark)), mark);
        spaces = List.of(root, school, department, schoolDepartment, departmentSchool, campusSchool);
    }

    private static Join join(Catalog catalog, TableEntity origin, String target) {
        return catalog.joins(origin).stream()
                .filter(join -> join.target().name().equals(target))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("Every space spans and dominates itself")
    void testReflexivity() {
        for (Space space : spaces) {
            assertTrue(space.spans(space), space.toString());
            assertTrue(space.dominates(space), space.toString());
            assertTrue(space.conforms(space), space.toString());
        }
    }

    @Test
    @DisplayName("Domination implies spanning")
    void testDominatesImpliesSpans() {
        for (Space a : spaces) {
            for (Space b : spaces) {
                if (a.dominates(b)) {
                    assertTrue(a.spans(b), a + " dominates but does not span " + b);
                }
            }
        }
    }

    @Test
    @DisplayName("Conformity is mutual domination")
    void testConformsIsMutualDomination() {
        for (Space a : spaces) {
            for (Space b : spaces) {
                assertEquals(a.dominates(b) && b.dominates(a), a.conforms(b), a + " vs " + b);
            }
        }
    }

    @Test
    @DisplayName("Inflation is idempotent and drops filters")
    void testInflate() {
        for (Space space : spaces) {
            Space inflated = space.inflate();
            assertEquals(inflated, inflated.inflate(), space.toString());
            assertTrue(inflated.isInflated(), space.toString());
        }
        assertEquals(school, campusSchool.inflate());
    }

    @Test
    @DisplayName("A plural link spans its base but is not spanned by it")
    void testPluralLink() {
        assertTrue(schoolDepartment.spans(school));
        assertFalse(school.spans(schoolDepartment));
        assertTrue(school.spans(root));
        assertFalse(root.spans(school));
    }

    @Test
    @DisplayName("A singular link is spanned by its base")
    void testSingularLink() {
        assertTrue(department.spans(departmentSchool));
        assertTrue(departmentSchool.spans(department));
    }

    @Test
    @DisplayName("A filter is spanned by its base but not dominated by it")
    void testFilter() {
        assertTrue(school.spans(campusSchool));
        assertTrue(campusSchool.spans(school));
        assertTrue(school.dominates(campusSchool));
        assertFalse(campusSchool.dominates(school));
    }

    @Test
    @DisplayName("A space concludes the spaces of its own chain only")
    void testConcludes() {
        assertTrue(schoolDepartment.concludes(school));
        assertTrue(schoolDepartment.concludes(root));
        assertFalse(school.concludes(schoolDepartment));
        assertFalse(department.concludes(school));
        // concluding is structural; spanning is about cardinality
        assertTrue(departmentSchool.spans(department));
        assertFalse(department.concludes(departmentSchool));
    }

    @Test
    @DisplayName("Equality ignores marks")
    void testEqualityIgnoresMarks() {
        Mark other = new Mark("/school", 1, 7);
        TableEntity schoolTable = SchoolFixture.catalog().getTable("", "school");
        Space marked = new DirectTableSpace(new RootSpace(other), schoolTable, other);

        assertEquals(school, marked);
        assertEquals(school.hashCode(), marked.hashCode());
    }
}
