package org.navql.engine.frame;

import java.util.List;

/**
 * The clauses of a {@code SELECT} statement.
 *
 * <p>{@code include} is the {@code FROM} list, {@code embed} the correlated
 * subqueries referenced by embedding phrases, {@code order} a list of
 * sort direction formulas. {@code where} and {@code having} may be null.
 */
public record Clauses(
        List<Anchor> include,
        List<NestedFrame> embed,
        List<Phrase> select,
        Phrase where,
        List<Phrase> group,
        Phrase having,
        List<Phrase> order,
        Long limit,
        Long offset
) {
    public Clauses {
        include = List.copyOf(include);
        embed = List.copyOf(embed);
        select = List.copyOf(select);
        group = List.copyOf(group);
        order = List.copyOf(order);
        if (select.isEmpty()) {
            throw new IllegalArgumentException("A select list cannot be empty");
        }
    }

    public Clauses withInclude(List<Anchor> include) {
        return new Clauses(include, embed, select, where, group, having, order, limit, offset);
    }

    public Clauses withEmbed(List<NestedFrame> embed) {
        return new Clauses(include, embed, select, where, group, having, order, limit, offset);
    }

    public Clauses withSelect(List<Phrase> select) {
        return new Clauses(include, embed, select, where, group, having, order, limit, offset);
    }

    public Clauses withWhere(Phrase where) {
        return new Clauses(include, embed, select, where, group, having, order, limit, offset);
    }

    public Clauses withGroup(List<Phrase> group, Phrase having) {
        return new Clauses(include, embed, select, where, group, having, order, limit, offset);
    }

    public Clauses withOrder(List<Phrase> order, Long limit, Long offset) {
        return new Clauses(include, embed, select, where, group, having, order, limit, offset);
    }

    public boolean hasGroup() {
        return !group.isEmpty();
    }

    /**
     * @return true if the {@code GROUP BY} list consists of constants only
     */
    public boolean hasTrivialGroup() {
        return group.stream().allMatch(phrase -> phrase instanceof LiteralPhrase);
    }

    public boolean hasSlice() {
        return limit != null || offset != null;
    }
}
