package org.navql.engine.entity;

import java.util.List;

/**
 * A connection between two tables derived from a foreign key.
 *
 * <p>A join is <em>expanding</em> when every origin row has at least one
 * matching target row and <em>contracting</em> when it has at most one.
 */
public sealed interface Join permits DirectJoin, ReverseJoin {

    ForeignKey foreignKey();

    TableEntity origin();

    TableEntity target();

    List<ColumnEntity> originColumns();

    List<ColumnEntity> targetColumns();

    boolean isExpanding();

    boolean isContracting();

    Join reverse();
}
