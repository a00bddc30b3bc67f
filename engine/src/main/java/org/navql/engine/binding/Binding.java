package org.navql.engine.binding;

import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.error.Mark;

/**
 * A node of the attributed tree produced by the {@link Binder}.
 *
 * <p>Every navigational step of the query is resolved to a table, a
 * column, a join or a function. {@code base} is the scope the node was
 * bound in (for a cast, the operand); it is null only for the root.
 */
public sealed interface Binding permits RootBinding, HomeBinding, TableBinding, ChainBinding, ColumnBinding,
        QuotientBinding, KernelBinding, ComplementBinding, CoverBinding, ForkBinding, LinkBinding, SieveBinding,
        SortBinding, SelectionBinding, LiteralBinding, ParameterBinding, CastBinding, FormulaBinding,
        SegmentBinding {

    Binding base();

    Domain domain();

    Mark mark();

    <T> T accept(BindingVisitor<T> visitor);

    /**
     * @return true if the binding denotes rows rather than a value
     */
    default boolean isEntity() {
        return domain() instanceof EntityDomain;
    }
}
