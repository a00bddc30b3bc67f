package org.navql.engine.reduce;

import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.frame.Anchor;
import org.navql.engine.frame.BranchFrame;
import org.navql.engine.frame.Clauses;
import org.navql.engine.frame.FormulaPhrase;
import org.navql.engine.frame.Frame;
import org.navql.engine.frame.LiteralPhrase;
import org.navql.engine.frame.NestedFrame;
import org.navql.engine.frame.Phrase;
import org.navql.engine.frame.ScalarFrame;
import org.navql.engine.signature.AndSig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges subqueries into the statements that include them.
 *
 * <p>A frame absorbs the head of its {@code FROM} list when the head is a
 * non-permanent subquery and merging preserves the rows: the head's
 * sources replace it in the {@code FROM} list, its conditions join the
 * frame's own, and references to its select list are recorded as
 * substitutes to be resolved by the reducer. Frames are collapsed bottom-up.
 */
final class Collapser {

    private static final Logger LOG = LoggerFactory.getLogger(Collapser.class);

    private final Map<Slot, Phrase> substitutes;

    Collapser(Map<Slot, Phrase> substitutes) {
        this.substitutes = substitutes;
    }

    BranchFrame collapse(BranchFrame frame) {
        Clauses clauses = frame.clauses();
        List<Anchor> include = new ArrayList<>();
        for (Anchor anchor : clauses.include()) {
            include.add(anchor.with(collapseSource(anchor.frame()), anchor.condition()));
        }
        List<NestedFrame> embed = new ArrayList<>();
        for (NestedFrame embedded : clauses.embed()) {
            embed.add((NestedFrame) collapse(embedded));
        }
        clauses = clauses.withInclude(include).withEmbed(embed);
        Clauses absorbed = absorb(frame, clauses);
        while (absorbed != null) {
            clauses = absorbed;
            absorbed = absorb(frame, clauses);
        }
        return frame.withClauses(clauses);
    }

    private Frame collapseSource(Frame frame) {
        if (frame instanceof ScalarFrame) {
            return new NestedFrame(frame.term(), new Clauses(List.of(), List.of(), List.of(LiteralPhrase.of(true)),
                    null, List.of(), null, List.of(), null, null));
        }
        if (frame instanceof NestedFrame nested) {
            return collapse(nested);
        }
        return frame;
    }

    /**
     * @return The clauses with the head subquery merged in, or null if it must be kept
     */
    private Clauses absorb(BranchFrame frame, Clauses clauses) {
        if (clauses.include().isEmpty()) {
            return null;
        }
        if (!(clauses.include().get(0).frame() instanceof NestedFrame head) || head.isPermanent()) {
            return null;
        }
        if (clauses.include().stream().anyMatch(Anchor::isRight)) {
            return null;
        }
        Clauses inner = head.clauses();
        boolean isSingle = clauses.include().size() == 1;
        if (inner.include().isEmpty() && !isSingle) {
            return dropConstant(frame, head, clauses);
        }

        Phrase where;
        List<Phrase> group = clauses.group();
        Phrase having = clauses.having();
        List<Phrase> order = clauses.order();
        Long limit = clauses.limit();
        Long offset = clauses.offset();
        if (inner.hasGroup()) {
            if (inner.hasSlice() || inner.having() != null || clauses.hasGroup() || clauses.having() != null
                    || !isSingle || !clauses.embed().isEmpty()) {
                return null;
            }
            if (clauses.where() != null) {
                if (inner.hasTrivialGroup()) {
                    return null;
                }
                having = clauses.where();
            }
            where = inner.where();
            group = inner.group();
        } else if (inner.hasSlice()) {
            if (!isSingle || clauses.where() != null || clauses.hasGroup() || clauses.having() != null
                    || clauses.hasSlice()) {
                return null;
            }
            if (!head.term().space().conforms(frame.term().space())
                    || !head.term().baseline().equals(frame.term().baseline())) {
                return null;
            }
            if (!clauses.order().isEmpty() && !substitute(head, clauses.order()).equals(inner.order())) {
                return null;
            }
            where = inner.where();
            order = inner.order();
            limit = inner.limit();
            offset = inner.offset();
        } else {
            where = conjoin(inner.where(), clauses.where());
            if (order.isEmpty() && isSingle && !clauses.hasGroup()) {
                order = inner.order();
            }
        }

        for (int index = 0; index < inner.select().size(); index++) {
            substitutes.put(new Slot(head.tag(), index), inner.select().get(index));
        }
        List<Anchor> include = new ArrayList<>(inner.include());
        include.addAll(clauses.include().subList(1, clauses.include().size()));
        List<NestedFrame> embed = new ArrayList<>(inner.embed());
        embed.addAll(clauses.embed());
        LOG.debug("Frame #{} absorbs subquery #{}", frame.tag(), head.tag());
        return new Clauses(include, embed, clauses.select(), where, group, having, order, limit, offset);
    }

    /**
     * A head without sources yields exactly one row, so when the next anchor
     * is an inner or cross join the head can be dropped and that anchor
     * promoted in its place. The promoted join condition moves to {@code WHERE}.
     *
     * @return The clauses without the head, or null if it must be kept
     */
    private Clauses dropConstant(BranchFrame frame, NestedFrame head, Clauses clauses) {
        Clauses inner = head.clauses();
        if (inner.where() != null || inner.hasGroup() || inner.having() != null || inner.hasSlice()
                || !inner.embed().isEmpty()) {
            return null;
        }
        Anchor next = clauses.include().get(1);
        if (next.isLeft() || next.isRight()) {
            return null;
        }
        for (int index = 0; index < inner.select().size(); index++) {
            substitutes.put(new Slot(head.tag(), index), inner.select().get(index));
        }
        List<Anchor> include = new ArrayList<>();
        include.add(Anchor.leading(next.frame()));
        include.addAll(clauses.include().subList(2, clauses.include().size()));
        LOG.debug("Frame #{} drops constant subquery #{}", frame.tag(), head.tag());
        return clauses.withInclude(include).withWhere(conjoin(next.condition(), clauses.where()));
    }

    private static List<Phrase> substitute(NestedFrame head, List<Phrase> phrases) {
        Map<Slot, Phrase> exports = new HashMap<>();
        List<Phrase> select = head.clauses().select();
        for (int index = 0; index < select.size(); index++) {
            exports.put(new Slot(head.tag(), index), select.get(index));
        }
        return new Substitution(exports).apply(phrases);
    }

    private static Phrase conjoin(Phrase left, Phrase right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return new FormulaPhrase(new AndSig(), new BooleanDomain(), left.isNullable() || right.isNullable(),
                left, right);
    }
}
