package org.navql.engine;

import org.navql.engine.domain.Domain;
import org.navql.engine.entity.Catalog;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * A small university database shared by the tests.
 *
 * <p>Schools by code: art, edu, eng, la, ns. Departments per school: art 0,
 * edu 0, eng 4, la 1, ns 2; {@code mth} has no school. The {@code ghost}
 * table is described in the catalog but never created.
 */
public final class SchoolFixture {

    private SchoolFixture() {
    }

    public static Catalog catalog() {
        return Catalog.builder()
                .table("school", t -> t
                        .column("code", Domain.text(), false)
                        .column("name", Domain.text(), false)
                        .column("campus", Domain.text(), true)
                        .primaryKey("code"))
                .table("department", t -> t
                        .column("code", Domain.text(), false)
                        .column("name", Domain.text(), false)
                        .column("school_code", Domain.text(), true)
                        .primaryKey("code")
                        .foreignKey(List.of("school_code"), "school", List.of("code")))
                .table("program", t -> t
                        .column("school_code", Domain.text(), false)
                        .column("code", Domain.text(), false)
                        .column("title", Domain.text(), false)
                        .column("degree", Domain.text(), true)
                        .primaryKey("school_code", "code")
                        .foreignKey(List.of("school_code"), "school", List.of("code")))
                .table("course", t -> t
                        .column("department_code", Domain.text(), false)
                        .column("no", Domain.integer(), false)
                        .column("title", Domain.text(), false)
                        .column("credits", Domain.integer(), true)
                        .primaryKey("department_code", "no")
                        .foreignKey(List.of("department_code"), "department", List.of("code")))
                .table("memo", t -> t
                        .column("body", Domain.text(), true))
                .table("ghost", t -> t
                        .column("id", Domain.integer(), false)
                        .primaryKey("id"))
                .build();
    }

    public static void populate(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE school (code VARCHAR PRIMARY KEY, name VARCHAR NOT NULL, campus VARCHAR)");
            stmt.execute("CREATE TABLE department (code VARCHAR PRIMARY KEY, name VARCHAR NOT NULL, "
                    + "school_code VARCHAR REFERENCES school (code))");
            stmt.execute("CREATE TABLE program (school_code VARCHAR NOT NULL REFERENCES school (code), "
                    + "code VARCHAR NOT NULL, title VARCHAR NOT NULL, degree VARCHAR, "
                    + "PRIMARY KEY (school_code, code))");
            stmt.execute("CREATE TABLE course (department_code VARCHAR NOT NULL REFERENCES department (code), "
                    + "no INTEGER NOT NULL, title VARCHAR NOT NULL, credits INTEGER, "
                    + "PRIMARY KEY (department_code, no))");
            stmt.execute("CREATE TABLE memo (body VARCHAR)");

            stmt.execute("""
                    INSERT INTO school VALUES
                        ('art', 'School of Art and Design', 'old'),
                        ('edu', 'College of Education', NULL),
                        ('eng', 'School of Engineering', 'north'),
                        ('la', 'School of Arts and Humanities', 'old'),
                        ('ns', 'School of Natural Sciences', 'old')
                    """);
            stmt.execute("""
                    INSERT INTO department VALUES
                        ('astro', 'Astronomy', 'ns'),
                        ('chem', 'Chemistry', 'ns'),
                        ('be', 'Bioengineering', 'eng'),
                        ('comp', 'Computer Science', 'eng'),
                        ('ee', 'Electrical Engineering', 'eng'),
                        ('me', 'Mechanical Engineering', 'eng'),
                        ('hist', 'History', 'la'),
                        ('mth', 'Mathematics', NULL)
                    """);
            stmt.execute("""
                    INSERT INTO program VALUES
                        ('eng', 'gbe', 'Graduate of Bioengineering', 'ms'),
                        ('eng', 'uce', 'Computer Engineering', 'bs'),
                        ('ns', 'uastro', 'Astronomy', 'bs'),
                        ('la', 'uhist', 'History', NULL)
                    """);
            stmt.execute("""
                    INSERT INTO course VALUES
                        ('astro', 137, 'The Solar System', 3),
                        ('astro', 142, 'Solar System Lab', 2),
                        ('chem', 100, 'Principles of Chemistry', 3),
                        ('comp', 102, 'Introduction to Programming', 4),
                        ('comp', 300, 'Algorithms', NULL),
                        ('hist', 210, 'Ancient History', 3)
                    """);
            stmt.execute("INSERT INTO memo VALUES ('first'), ('second')");
        }
    }
}
