package org.navql.engine.assemble;

import org.navql.engine.code.Code;
import org.navql.engine.code.ColumnUnit;
import org.navql.engine.code.CompoundUnit;
import org.navql.engine.code.Joint;
import org.navql.engine.code.LiteralCode;
import org.navql.engine.code.Ordering;
import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.domain.UntypedDomain;
import org.navql.engine.frame.Anchor;
import org.navql.engine.frame.BranchFrame;
import org.navql.engine.frame.Clauses;
import org.navql.engine.frame.ColumnPhrase;
import org.navql.engine.frame.EmbeddingPhrase;
import org.navql.engine.frame.FormulaPhrase;
import org.navql.engine.frame.Frame;
import org.navql.engine.frame.LiteralPhrase;
import org.navql.engine.frame.NestedFrame;
import org.navql.engine.frame.Phrase;
import org.navql.engine.frame.ReferencePhrase;
import org.navql.engine.frame.ScalarFrame;
import org.navql.engine.frame.SegmentFrame;
import org.navql.engine.frame.SegmentOutput;
import org.navql.engine.frame.TableFrame;
import org.navql.engine.signature.AndSig;
import org.navql.engine.signature.IsEqualSig;
import org.navql.engine.signature.SortDirectionSig;
import org.navql.engine.term.CorrelationTerm;
import org.navql.engine.term.EmbeddingTerm;
import org.navql.engine.term.FilterTerm;
import org.navql.engine.term.JoinTerm;
import org.navql.engine.term.OrderTerm;
import org.navql.engine.term.PermanentTerm;
import org.navql.engine.term.ProjectionTerm;
import org.navql.engine.term.ScalarTerm;
import org.navql.engine.term.SegmentTerm;
import org.navql.engine.term.TableTerm;
import org.navql.engine.term.Term;
import org.navql.engine.term.TermVisitor;
import org.navql.engine.term.UnaryTerm;
import org.navql.engine.term.WrapperTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a term tree into a tree of frames.
 *
 * <p>Each term becomes a frame. A unit needed by a term is claimed from the
 * kid containing the term that computes it; the kid exports the unit in its
 * select list and supplies the claim with a phrase referring to that
 * export. Claims travel down the tree while terms are visited top-down and
 * are supplied on the way back up.
 */
public final class Assembler {

    private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);

    public SegmentFrame assemble(SegmentTerm term) {
        return assemble(term, new AssemblingState());
    }

    /**
     * Assembles a segment recording its claims in the given state.
     *
     * @throws IllegalStateException if a claim is left unresolved
     */
    public SegmentFrame assemble(SegmentTerm term, AssemblingState state) {
        state.setTree(term);
        SegmentFrame frame = (SegmentFrame) term.accept(new AssembleTerm(state));
        state.verify();
        LOG.debug("Assembled segment with {} claims", state.claims().size());
        return frame;
    }

    private static final class AssembleTerm implements TermVisitor<Frame> {

        private final AssemblingState state;

        AssembleTerm(AssemblingState state) {
            this.state = state;
        }

        @Override
        public Frame visitScalar(ScalarTerm term) {
            if (!state.claimsOf(term).isEmpty()) {
                throw new IllegalStateException("A scalar term cannot export values: " + term);
            }
            return new ScalarFrame(term);
        }

        @Override
        public Frame visitTable(TableTerm term) {
            for (Claim claim : state.claimsOf(term)) {
                if (claim.target() != term.tag() || !(claim.unit() instanceof ColumnUnit unit)) {
                    throw new IllegalStateException("Unexpected claim for a table term: " + claim);
                }
                boolean isNullable = unit.column().isNullable() || state.isNullable();
                state.supply(claim, new ColumnPhrase(term.tag(), unit.column(), isNullable));
            }
            return new TableFrame(term.table(), term);
        }

        @Override
        public Frame visitFilter(FilterTerm term) {
            return new FilterBranch(term).assemble();
        }

        @Override
        public Frame visitOrder(OrderTerm term) {
            return new OrderBranch(term).assemble();
        }

        @Override
        public Frame visitProjection(ProjectionTerm term) {
            return new ProjectionBranch(term).assemble();
        }

        @Override
        public Frame visitWrapper(WrapperTerm term) {
            return new UnaryBranch<>(term).assemble();
        }

        @Override
        public Frame visitPermanent(PermanentTerm term) {
            return new UnaryBranch<>(term).assemble();
        }

        @Override
        public Frame visitCorrelation(CorrelationTerm term) {
            return new CorrelationBranch(term).assemble();
        }

        @Override
        public Frame visitSegment(SegmentTerm term) {
            return new SegmentBranch(term).assemble();
        }

        @Override
        public Frame visitJoin(JoinTerm term) {
            return new JoinBranch(term).assemble();
        }

        @Override
        public Frame visitEmbedding(EmbeddingTerm term) {
            return new EmbeddingBranch(term).assemble();
        }

        /**
         * Assembles a term with kids into a {@code SELECT} statement, one
         * clause at a time.
         */
        private abstract class Branch<T extends Term> {

            final T term;
            final List<Claim> claims;

            Branch(T term) {
                this.term = term;
                this.claims = state.claimsOf(term);
            }

            /**
             * Passes claims targeted at descendants to the kid containing
             * them and claims the units needed to compute the rest.
             */
            void delegate() {
                for (Claim claim : claims) {
                    if (claim.target() != term.tag()) {
                        state.demand(state.forward(claim));
                    } else {
                        state.schedule(compound(claim).code());
                    }
                }
            }

            List<Anchor> include() {
                return List.of();
            }

            List<NestedFrame> embed() {
                return List.of();
            }

            List<Phrase> select() {
                List<Phrase> select = new ArrayList<>();
                Map<Phrase, Integer> indexByPhrase = new HashMap<>();
                for (Claim claim : claims) {
                    Phrase phrase;
                    if (claim.target() != term.tag()) {
                        phrase = state.supplied(state.forward(claim));
                    } else {
                        phrase = state.evaluate(compound(claim).code());
                    }
                    Integer index = indexByPhrase.get(phrase);
                    if (index == null) {
                        index = select.size();
                        select.add(phrase);
                        indexByPhrase.put(phrase, index);
                    }
                    boolean isNullable = phrase.isNullable() || state.isNullable();
                    state.supply(claim, new ReferencePhrase(term.tag(), index, phrase.domain(), isNullable));
                }
                if (select.isEmpty()) {
                    select.add(LiteralPhrase.of(true));
                }
                return select;
            }

            Phrase where() {
                return null;
            }

            List<Phrase> group() {
                return List.of();
            }

            List<Phrase> order() {
                return List.of();
            }

            Long limit() {
                return null;
            }

            Long offset() {
                return null;
            }

            BranchFrame frame(Clauses clauses) {
                return new NestedFrame(term, clauses);
            }

            final BranchFrame assemble() {
                delegate();
                List<Anchor> include = include();
                List<NestedFrame> embed = embed();
                List<Phrase> select = select();
                Phrase where = where();
                List<Phrase> group = group();
                List<Phrase> order = order();
                return frame(new Clauses(include, embed, select, where, group, null, order, limit(), offset()));
            }
        }

        private static CompoundUnit compound(Claim claim) {
            if (!(claim.unit() instanceof CompoundUnit unit)) {
                throw new IllegalStateException("A term can only compute compound units: " + claim);
            }
            return unit;
        }

        private class UnaryBranch<T extends UnaryTerm> extends Branch<T> {

            UnaryBranch(T term) {
                super(term);
            }

            @Override
            List<Anchor> include() {
                state.pushGate(false, term.kid(), null);
                try {
                    return List.of(Anchor.leading(term.kid().accept(AssembleTerm.this)));
                } finally {
                    state.popGate();
                }
            }
        }

        private final class FilterBranch extends UnaryBranch<FilterTerm> {

            FilterBranch(FilterTerm term) {
                super(term);
            }

            @Override
            void delegate() {
                super.delegate();
                state.schedule(term.filter(), null, term.kid());
            }

            @Override
            Phrase where() {
                return state.evaluate(term.filter(), null, term.kid());
            }
        }

        private final class OrderBranch extends UnaryBranch<OrderTerm> {

            OrderBranch(OrderTerm term) {
                super(term);
            }

            @Override
            void delegate() {
                super.delegate();
                for (Ordering ordering : term.order()) {
                    state.schedule(ordering.code(), null, term.kid());
                }
            }

            @Override
            List<Phrase> order() {
                List<Phrase> order = new ArrayList<>();
                for (Ordering ordering : term.order()) {
                    if (ordering.code().units().isEmpty()) {
                        continue;
                    }
                    Phrase phrase = state.evaluate(ordering.code(), null, term.kid());
                    order.add(new FormulaPhrase(new SortDirectionSig(ordering.direction()), phrase.domain(),
                            phrase.isNullable(), phrase));
                }
                return order;
            }

            @Override
            Long limit() {
                return term.limit();
            }

            @Override
            Long offset() {
                return term.offset();
            }
        }

        private final class ProjectionBranch extends UnaryBranch<ProjectionTerm> {

            ProjectionBranch(ProjectionTerm term) {
                super(term);
            }

            @Override
            void delegate() {
                state.pushGate(null, null, term.kid());
                try {
                    super.delegate();
                    for (Code kernel : term.kernels()) {
                        state.schedule(kernel);
                    }
                } finally {
                    state.popGate();
                }
            }

            @Override
            List<Phrase> select() {
                state.pushGate(null, null, term.kid());
                try {
                    return super.select();
                } finally {
                    state.popGate();
                }
            }

            @Override
            List<Phrase> group() {
                List<Phrase> group = new ArrayList<>();
                for (Code kernel : term.kernels()) {
                    if (!kernel.units().isEmpty()) {
                        group.add(state.evaluate(kernel, null, term.kid()));
                    }
                }
                if (group.isEmpty()) {
                    group.add(LiteralPhrase.of(true));
                }
                return group;
            }
        }

        private final class CorrelationBranch extends UnaryBranch<CorrelationTerm> {

            CorrelationBranch(CorrelationTerm term) {
                super(term);
            }

            private Claim claim() {
                if (claims.size() != 1 || claims.get(0).target() != term.tag()) {
                    throw new IllegalStateException("A correlated term exports exactly one value: " + claims);
                }
                return claims.get(0);
            }

            @Override
            void delegate() {
                state.schedule(compound(claim()).code());
            }

            @Override
            List<Phrase> select() {
                Claim claim = claim();
                Phrase phrase = state.evaluate(compound(claim).code());
                state.supply(claim, new EmbeddingPhrase(term.tag(), phrase.domain(), true));
                return List.of(phrase);
            }
        }

        private final class JoinBranch extends Branch<JoinTerm> {

            JoinBranch(JoinTerm term) {
                super(term);
            }

            @Override
            void delegate() {
                super.delegate();
                for (Joint joint : term.joints()) {
                    state.schedule(joint.lop(), null, term.lkid());
                    state.schedule(joint.rop(), null, term.rkid());
                }
            }

            @Override
            List<Anchor> include() {
                Frame lframe = assembleKid(term.lkid(), term.isRight());
                Frame rframe = assembleKid(term.rkid(), term.isLeft());
                BooleanDomain bool = new BooleanDomain();
                List<Phrase> equalities = new ArrayList<>();
                for (Joint joint : term.joints()) {
                    Phrase lop = state.evaluate(joint.lop(), null, term.lkid());
                    Phrase rop = state.evaluate(joint.rop(), null, term.rkid());
                    equalities.add(new FormulaPhrase(new IsEqualSig(1), bool,
                            lop.isNullable() || rop.isNullable(), lop, rop));
                }
                Phrase condition = null;
                if (!equalities.isEmpty()) {
                    boolean isNullable = equalities.stream().anyMatch(Phrase::isNullable);
                    condition = new FormulaPhrase(new AndSig(), bool, isNullable, equalities);
                } else if (term.isLeft() || term.isRight()) {
                    condition = LiteralPhrase.of(true);
                }
                return List.of(Anchor.leading(lframe),
                        new Anchor(rframe, condition, term.isLeft(), term.isRight()));
            }

            private Frame assembleKid(Term kid, boolean isNullable) {
                state.pushGate(isNullable, kid, null);
                try {
                    return kid.accept(AssembleTerm.this);
                } finally {
                    state.popGate();
                }
            }
        }

        private final class EmbeddingBranch extends Branch<EmbeddingTerm> {

            EmbeddingBranch(EmbeddingTerm term) {
                super(term);
            }

            @Override
            void delegate() {
                super.delegate();
                for (Code correlation : term.correlations()) {
                    state.schedule(correlation, null, term.lkid());
                }
            }

            @Override
            List<Anchor> include() {
                state.pushGate(false, term.lkid(), null);
                try {
                    return List.of(Anchor.leading(term.lkid().accept(AssembleTerm.this)));
                } finally {
                    state.popGate();
                }
            }

            @Override
            List<NestedFrame> embed() {
                Map<Code, Phrase> correlations = new LinkedHashMap<>();
                for (Code correlation : term.correlations()) {
                    correlations.put(correlation, state.evaluate(correlation, null, term.lkid()));
                }
                state.pushCorrelations(correlations);
                state.pushGate(true, term.rkid(), null);
                try {
                    return List.of((NestedFrame) term.rkid().accept(AssembleTerm.this));
                } finally {
                    state.popGate();
                    state.popCorrelations();
                }
            }
        }

        private final class SegmentBranch extends UnaryBranch<SegmentTerm> {

            private final Map<Code, Integer> indexByCode = new HashMap<>();

            SegmentBranch(SegmentTerm term) {
                super(term);
            }

            @Override
            void delegate() {
                if (!claims.isEmpty()) {
                    throw new IllegalStateException("A segment term cannot export values: " + claims);
                }
                for (Code code : term.codes()) {
                    state.schedule(code);
                }
            }

            @Override
            List<Phrase> select() {
                List<Phrase> select = new ArrayList<>();
                Map<Phrase, Integer> indexByPhrase = new HashMap<>();
                for (Code code : term.codes()) {
                    if (isConstant(code)) {
                        continue;
                    }
                    Phrase phrase = state.evaluate(code);
                    Integer index = indexByPhrase.get(phrase);
                    if (index == null) {
                        index = select.size();
                        select.add(phrase);
                        indexByPhrase.put(phrase, index);
                    }
                    indexByCode.put(code, index);
                }
                if (select.isEmpty()) {
                    select.add(LiteralPhrase.of(true));
                }
                return select;
            }

            @Override
            BranchFrame frame(Clauses clauses) {
                List<SegmentOutput> outputs = new ArrayList<>();
                for (Code code : term.codes()) {
                    if (isConstant(code)) {
                        outputs.add(SegmentOutput.constant(((LiteralCode) code).value()));
                    } else {
                        outputs.add(SegmentOutput.extract(indexByCode.get(code)));
                    }
                }
                return new SegmentFrame(term, clauses, outputs);
            }

            private boolean isConstant(Code code) {
                return code instanceof LiteralCode
                        && (code.domain() instanceof UntypedDomain || code.domain() instanceof BooleanDomain);
            }
        }
    }
}
