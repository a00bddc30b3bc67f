package org.navql.engine.reduce;

import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.frame.Anchor;
import org.navql.engine.frame.BranchFrame;
import org.navql.engine.frame.CastPhrase;
import org.navql.engine.frame.Clauses;
import org.navql.engine.frame.ColumnPhrase;
import org.navql.engine.frame.EmbeddingPhrase;
import org.navql.engine.frame.FormulaPhrase;
import org.navql.engine.frame.Frame;
import org.navql.engine.frame.LiteralPhrase;
import org.navql.engine.frame.NestedFrame;
import org.navql.engine.frame.ParameterPhrase;
import org.navql.engine.frame.Phrase;
import org.navql.engine.frame.PhraseVisitor;
import org.navql.engine.frame.ReferencePhrase;
import org.navql.engine.frame.SegmentFrame;
import org.navql.engine.signature.AggregateSig;
import org.navql.engine.signature.AndSig;
import org.navql.engine.signature.IsEqualSig;
import org.navql.engine.signature.IsNullSig;
import org.navql.engine.signature.IsTotallyEqualSig;
import org.navql.engine.signature.NotSig;
import org.navql.engine.signature.NullIfSig;
import org.navql.engine.signature.OrSig;
import org.navql.engine.signature.Signature;
import org.navql.engine.signature.SortDirectionSig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Simplifies a frame tree before it is serialized.
 *
 * <p>Subqueries are first merged into their parents where possible; then
 * every phrase is rewritten: references to merged subqueries are replaced
 * by the phrases they exported, constant conditions are folded, and
 * conjunctions and disjunctions are flattened. Reduction never changes the
 * rows the statement produces.
 */
public final class Reducer {

    private static final Logger LOG = LoggerFactory.getLogger(Reducer.class);

    public SegmentFrame reduce(SegmentFrame frame) {
        Map<Slot, Phrase> substitutes = new HashMap<>();
        SegmentFrame collapsed = (SegmentFrame) new Collapser(substitutes).collapse(frame);
        SegmentFrame reduced = (SegmentFrame) new ReduceFrame(substitutes).reduce(collapsed);
        LOG.debug("Reduced segment #{} with {} substitutes", reduced.tag(), substitutes.size());
        return reduced;
    }

    private static final class ReduceFrame implements PhraseVisitor<Phrase> {

        private final Map<Slot, Phrase> substitutes;

        ReduceFrame(Map<Slot, Phrase> substitutes) {
            this.substitutes = substitutes;
        }

        BranchFrame reduce(BranchFrame frame) {
            Clauses clauses = frame.clauses();
            List<Anchor> include = new ArrayList<>();
            for (Anchor anchor : clauses.include()) {
                Frame source = anchor.frame() instanceof NestedFrame nested ? reduce(nested) : anchor.frame();
                Phrase condition = anchor.condition() != null ? anchor.condition().accept(this) : null;
                include.add(anchor.with(source, condition));
            }
            List<NestedFrame> embed = new ArrayList<>();
            for (NestedFrame embedded : clauses.embed()) {
                embed.add((NestedFrame) reduce(embedded));
            }
            Phrase where = condition(clauses.where());
            Phrase having = condition(clauses.having());
            return frame.withClauses(new Clauses(include, embed, reduce(clauses.select()), where,
                    reduce(clauses.group()), having, reduce(clauses.order()), clauses.limit(), clauses.offset()));
        }

        private Phrase condition(Phrase phrase) {
            if (phrase == null) {
                return null;
            }
            Phrase reduced = phrase.accept(this);
            return reduced instanceof LiteralPhrase literal && literal.isTrue() ? null : reduced;
        }

        private List<Phrase> reduce(List<Phrase> phrases) {
            List<Phrase> reduced = new ArrayList<>(phrases.size());
            for (Phrase phrase : phrases) {
                reduced.add(phrase.accept(this));
            }
            return reduced;
        }

        @Override
        public Phrase visitLiteral(LiteralPhrase phrase) {
            return phrase;
        }

        @Override
        public Phrase visitParameter(ParameterPhrase phrase) {
            return phrase;
        }

        @Override
        public Phrase visitCast(CastPhrase phrase) {
            Phrase base = phrase.base().accept(this);
            if (isNull(base)) {
                return LiteralPhrase.nullOf(phrase.domain());
            }
            return phrase.withBase(base);
        }

        @Override
        public Phrase visitColumn(ColumnPhrase phrase) {
            return phrase;
        }

        @Override
        public Phrase visitReference(ReferencePhrase phrase) {
            Phrase substitute = substitutes.get(new Slot(phrase.tag(), phrase.index()));
            return substitute != null ? substitute.accept(this) : phrase;
        }

        @Override
        public Phrase visitEmbedding(EmbeddingPhrase phrase) {
            return phrase;
        }

        @Override
        public Phrase visitFormula(FormulaPhrase phrase) {
            List<Phrase> arguments = reduce(phrase.arguments());
            Signature signature = phrase.signature();
            if (signature instanceof AndSig || signature instanceof OrSig) {
                return connective(phrase, arguments);
            }
            if (signature instanceof NotSig) {
                return negate(phrase, arguments.get(0));
            }
            if (signature instanceof IsEqualSig isEqual && isBooleanConstant(arguments.get(0))
                    && isBooleanConstant(arguments.get(1))) {
                boolean equal = Objects.equals(value(arguments.get(0)), value(arguments.get(1)));
                return LiteralPhrase.of(equal == (isEqual.polarity() > 0));
            }
            if (signature instanceof IsTotallyEqualSig isTotallyEqual) {
                return totallyEqual(isTotallyEqual.polarity(), arguments.get(0), arguments.get(1), phrase);
            }
            if (signature instanceof IsNullSig isNull && arguments.get(0) instanceof LiteralPhrase literal) {
                return LiteralPhrase.of((literal.value() == null) == (isNull.polarity() > 0));
            }
            if (isNullRegular(signature) && arguments.stream().anyMatch(Reducer::isNull)) {
                return LiteralPhrase.nullOf(phrase.domain());
            }
            return phrase.withArguments(arguments);
        }

        private Phrase connective(FormulaPhrase phrase, List<Phrase> arguments) {
            boolean isAnd = phrase.signature() instanceof AndSig;
            Set<Phrase> operands = new LinkedHashSet<>();
            for (Phrase argument : arguments) {
                if (argument instanceof FormulaPhrase formula
                        && formula.signature().getClass() == phrase.signature().getClass()) {
                    operands.addAll(formula.arguments());
                } else {
                    operands.add(argument);
                }
            }
            List<Phrase> kept = new ArrayList<>();
            for (Phrase operand : operands) {
                if (operand instanceof LiteralPhrase literal) {
                    if (isAnd ? literal.isFalse() : literal.isTrue()) {
                        return literal;
                    }
                    if (isAnd ? literal.isTrue() : literal.isFalse()) {
                        continue;
                    }
                }
                kept.add(operand);
            }
            if (kept.isEmpty()) {
                return LiteralPhrase.of(isAnd);
            }
            if (kept.size() == 1) {
                return kept.get(0);
            }
            boolean isNullable = kept.stream().anyMatch(Phrase::isNullable);
            return new FormulaPhrase(phrase.signature(), phrase.domain(), isNullable, kept);
        }

        private Phrase negate(FormulaPhrase phrase, Phrase argument) {
            if (argument instanceof LiteralPhrase literal) {
                if (literal.value() == null) {
                    return LiteralPhrase.nullOf(new BooleanDomain());
                }
                if (literal.domain() instanceof BooleanDomain) {
                    return LiteralPhrase.of(!literal.isTrue());
                }
            }
            if (argument instanceof FormulaPhrase formula && formula.signature() instanceof NotSig) {
                return formula.argument(0);
            }
            return phrase.withArguments(List.of(argument));
        }

        private Phrase totallyEqual(int polarity, Phrase left, Phrase right, FormulaPhrase phrase) {
            if (isNull(left) && isNull(right)) {
                return LiteralPhrase.of(polarity > 0);
            }
            if (isNull(left) || isNull(right)) {
                Phrase operand = isNull(left) ? right : left;
                return new FormulaPhrase(new IsNullSig(polarity), new BooleanDomain(), false, operand);
            }
            if (isBooleanConstant(left) && isBooleanConstant(right)) {
                return LiteralPhrase.of(Objects.equals(value(left), value(right)) == (polarity > 0));
            }
            return phrase.withArguments(List.of(left, right));
        }

        private static boolean isNullRegular(Signature signature) {
            return signature.isNullRegular() && !(signature instanceof AggregateSig)
                    && !(signature instanceof SortDirectionSig) && !(signature instanceof NullIfSig);
        }

        private static boolean isBooleanConstant(Phrase phrase) {
            return phrase instanceof LiteralPhrase literal && (literal.isTrue() || literal.isFalse());
        }

        private static Object value(Phrase phrase) {
            return ((LiteralPhrase) phrase).value();
        }
    }

    private static boolean isNull(Phrase phrase) {
        return phrase instanceof LiteralPhrase literal && literal.value() == null;
    }
}
