package org.navql.engine.dump;

import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.domain.DateDomain;
import org.navql.engine.domain.DateTimeDomain;
import org.navql.engine.domain.DecimalDomain;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EnumDomain;
import org.navql.engine.domain.FloatDomain;
import org.navql.engine.domain.IntegerDomain;
import org.navql.engine.domain.TextDomain;
import org.navql.engine.domain.TimeDomain;
import org.navql.engine.domain.UntypedDomain;
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
import org.navql.engine.frame.TableFrame;
import org.navql.engine.signature.AddSig;
import org.navql.engine.signature.AggregateSig;
import org.navql.engine.signature.AndSig;
import org.navql.engine.signature.CompareSig;
import org.navql.engine.signature.ConcatSig;
import org.navql.engine.signature.ContainsSig;
import org.navql.engine.signature.DivideSig;
import org.navql.engine.signature.ExistsSig;
import org.navql.engine.signature.IfNullSig;
import org.navql.engine.signature.IfSig;
import org.navql.engine.signature.IsEqualSig;
import org.navql.engine.signature.IsNullSig;
import org.navql.engine.signature.IsTotallyEqualSig;
import org.navql.engine.signature.LengthSig;
import org.navql.engine.signature.LowerSig;
import org.navql.engine.signature.MultiplySig;
import org.navql.engine.signature.NegateSig;
import org.navql.engine.signature.NotSig;
import org.navql.engine.signature.NullIfSig;
import org.navql.engine.signature.OrSig;
import org.navql.engine.signature.Signature;
import org.navql.engine.signature.SortDirectionSig;
import org.navql.engine.signature.SubtractSig;
import org.navql.engine.signature.UpperSig;
import org.navql.engine.space.QuotientFamily;
import org.navql.engine.space.Space;
import org.navql.engine.space.TableFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a reduced frame tree as a single SQL statement.
 *
 * <p>Identifiers are always quoted. Every source in a {@code FROM} list
 * gets an alias derived from the name of its table; clashing names are
 * numbered ({@code school}, {@code school_2}, ...). Subquery columns are
 * named after the columns or aggregates they export. Parameters become
 * markers of the dialect and are reported in order of appearance.
 */
public final class SQLSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(SQLSerializer.class);

    private final SQLDialect dialect;

    public SQLSerializer(SQLDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    public SQLDialect dialect() {
        return dialect;
    }

    /**
     * Serializes the segment frame.
     *
     * @param frame A reduced segment frame
     * @return The statement text with its placeholders
     */
    public SQLStatement serialize(SegmentFrame frame) {
        Serialization serialization = new Serialization();
        serialization.prepare(frame, true);
        String sql = serialization.statement(frame, true);
        LOG.debug("Serialized segment #{} with {} placeholder(s)", frame.tag(),
                serialization.placeholders.size());
        return new SQLStatement(sql, serialization.placeholders);
    }

    /**
     * The naming and rendering state of one statement.
     */
    private final class Serialization implements PhraseVisitor<String> {

        private final Map<Integer, String> aliases = new HashMap<>();
        private final Set<String> takenAliases = new HashSet<>();
        private final Map<Integer, List<String>> columnNames = new HashMap<>();
        private final Map<Integer, NestedFrame> embedded = new HashMap<>();
        private final List<Placeholder> placeholders = new ArrayList<>();

        /**
         * Assigns aliases top-down and column names bottom-up.
         */
        void prepare(BranchFrame frame, boolean isTop) {
            for (Anchor anchor : frame.clauses().include()) {
                Frame source = anchor.frame();
                aliases.put(source.tag(), alias(source));
            }
            for (Anchor anchor : frame.clauses().include()) {
                if (anchor.frame() instanceof NestedFrame nested) {
                    prepare(nested, false);
                }
            }
            for (NestedFrame nested : frame.clauses().embed()) {
                embedded.put(nested.tag(), nested);
                prepare(nested, false);
            }
            if (!isTop) {
                columnNames.put(frame.tag(), columnNames(frame.clauses().select()));
            }
        }

        private String alias(Frame frame) {
            String name = frame instanceof TableFrame table ? table.table().name() : nameOf(frame.term().space());
            String alias = name;
            int number = 1;
            while (!takenAliases.add(alias)) {
                number++;
                alias = name + "_" + number;
            }
            return alias;
        }

        private String nameOf(Space space) {
            if (space.family() instanceof TableFamily family) {
                return family.table().name();
            }
            if (space.family() instanceof QuotientFamily family) {
                return nameOf(family.seed());
            }
            return "root";
        }

        private List<String> columnNames(List<Phrase> select) {
            List<String> names = new ArrayList<>();
            Set<String> taken = new HashSet<>();
            for (Phrase phrase : select) {
                String name = columnName(phrase);
                String unique = name;
                int number = 1;
                while (!taken.add(unique)) {
                    number++;
                    unique = name + "_" + number;
                }
                names.add(unique);
            }
            return names;
        }

        private String columnName(Phrase phrase) {
            if (phrase instanceof ColumnPhrase column) {
                return column.column().name();
            }
            if (phrase instanceof ReferencePhrase reference) {
                return columnNames.get(reference.tag()).get(reference.index());
            }
            if (phrase instanceof CastPhrase cast) {
                return columnName(cast.base());
            }
            if (phrase instanceof FormulaPhrase formula) {
                if (formula.signature() instanceof AggregateSig aggregate) {
                    return aggregate.function().toLowerCase();
                }
                if (!formula.arguments().isEmpty()) {
                    return columnName(formula.argument(0));
                }
            }
            return "value";
        }

        String statement(BranchFrame frame, boolean isTop) {
            String separator = isTop ? "\n" : " ";
            Clauses clauses = frame.clauses();
            StringBuilder sql = new StringBuilder("SELECT ");
            List<String> names = isTop ? null : columnNames.get(frame.tag());
            for (int index = 0; index < clauses.select().size(); index++) {
                if (index > 0) {
                    sql.append(", ");
                }
                Phrase phrase = clauses.select().get(index);
                sql.append(phrase.accept(this));
                if (names != null && !(phrase instanceof ColumnPhrase column
                        && column.column().name().equals(names.get(index)))) {
                    sql.append(" AS ").append(dialect.quoteIdentifier(names.get(index)));
                }
            }
            if (!clauses.include().isEmpty()) {
                sql.append(separator).append("FROM ");
                for (int index = 0; index < clauses.include().size(); index++) {
                    sql.append(anchor(clauses.include().get(index), index == 0, separator));
                }
            }
            if (clauses.where() != null) {
                sql.append(separator).append("WHERE ").append(clauses.where().accept(this));
            }
            if (clauses.hasGroup() && !clauses.hasTrivialGroup()) {
                sql.append(separator).append("GROUP BY ").append(list(clauses.group()));
            }
            if (clauses.having() != null) {
                sql.append(separator).append("HAVING ").append(clauses.having().accept(this));
            }
            if (!clauses.order().isEmpty()) {
                sql.append(separator).append("ORDER BY ").append(list(clauses.order()));
            }
            if (clauses.hasSlice()) {
                sql.append(separator).append(dialect.formatSlice(clauses.limit(), clauses.offset()));
            }
            return sql.toString();
        }

        private String anchor(Anchor anchor, boolean isLeading, String separator) {
            String source = source(anchor.frame());
            if (isLeading) {
                return source;
            }
            String join;
            if (anchor.isLeft() && anchor.isRight()) {
                join = "FULL OUTER JOIN ";
            } else if (anchor.isLeft()) {
                join = "LEFT OUTER JOIN ";
            } else if (anchor.isRight()) {
                join = "RIGHT OUTER JOIN ";
            } else if (anchor.condition() == null) {
                return separator + "CROSS JOIN " + source;
            } else {
                join = "JOIN ";
            }
            Phrase condition = anchor.condition() != null ? anchor.condition() : LiteralPhrase.of(true);
            return separator + join + source + " ON " + condition.accept(this);
        }

        private String source(Frame frame) {
            String alias = aliases.get(frame.tag());
            if (frame instanceof TableFrame table) {
                String name = dialect.quoteIdentifier(table.table().name());
                if (!table.table().schemaName().isEmpty()) {
                    name = dialect.quoteIdentifier(table.table().schemaName()) + "." + name;
                }
                return alias.equals(table.table().name()) ? name : name + " AS " + dialect.quoteIdentifier(alias);
            }
            String subquery = frame instanceof NestedFrame nested
                    ? statement(nested, false)
                    : "SELECT " + dialect.formatBoolean(true);
            return "(" + subquery + ") AS " + dialect.quoteIdentifier(alias);
        }

        private String list(List<Phrase> phrases) {
            return phrases.stream().map(phrase -> phrase.accept(this)).collect(Collectors.joining(", "));
        }

        @Override
        public String visitLiteral(LiteralPhrase phrase) {
            Object value = phrase.value();
            Domain domain = phrase.domain();
            if (value == null) {
                return dialect.formatNull();
            }
            if (domain instanceof BooleanDomain) {
                return dialect.formatBoolean((Boolean) value);
            }
            if (domain instanceof IntegerDomain || domain instanceof FloatDomain) {
                return value.toString();
            }
            if (domain instanceof DecimalDomain) {
                return ((BigDecimal) value).toPlainString();
            }
            if (domain instanceof TextDomain || domain instanceof EnumDomain || domain instanceof UntypedDomain) {
                return dialect.quoteStringLiteral(domain.dump(value));
            }
            if (domain instanceof DateDomain) {
                return dialect.formatDate(domain.dump(value));
            }
            if (domain instanceof TimeDomain) {
                return dialect.formatTime(domain.dump(value));
            }
            if (domain instanceof DateTimeDomain) {
                return dialect.formatTimestamp(domain.dump(value));
            }
            throw new IllegalStateException("Cannot serialize a literal of domain " + domain.family());
        }

        @Override
        public String visitParameter(ParameterPhrase phrase) {
            placeholders.add(new Placeholder(placeholders.size() + 1, phrase.name(), phrase.value(),
                    phrase.domain()));
            return dialect.parameterMarker();
        }

        @Override
        public String visitCast(CastPhrase phrase) {
            return "CAST(" + phrase.base().accept(this) + " AS " + dialect.typeName(phrase.domain()) + ")";
        }

        @Override
        public String visitColumn(ColumnPhrase phrase) {
            return dialect.quoteIdentifier(aliases.get(phrase.tag())) + "."
                    + dialect.quoteIdentifier(phrase.column().name());
        }

        @Override
        public String visitReference(ReferencePhrase phrase) {
            return dialect.quoteIdentifier(aliases.get(phrase.tag())) + "."
                    + dialect.quoteIdentifier(columnNames.get(phrase.tag()).get(phrase.index()));
        }

        @Override
        public String visitEmbedding(EmbeddingPhrase phrase) {
            NestedFrame frame = embedded.get(phrase.tag());
            if (frame == null) {
                throw new IllegalStateException("No embedded frame #" + phrase.tag());
            }
            return "(" + statement(frame, false) + ")";
        }

        @Override
        public String visitFormula(FormulaPhrase phrase) {
            Signature signature = phrase.signature();
            List<String> arguments = new ArrayList<>();
            for (Phrase argument : phrase.arguments()) {
                arguments.add(argument.accept(this));
            }
            if (signature instanceof IsEqualSig isEqual) {
                return binary(arguments, isEqual.polarity() > 0 ? "=" : "<>");
            }
            if (signature instanceof IsTotallyEqualSig isTotallyEqual) {
                return dialect.formatTotalEquality(arguments.get(0), arguments.get(1), isTotallyEqual.polarity());
            }
            if (signature instanceof CompareSig compare) {
                return binary(arguments, compare.relation());
            }
            if (signature instanceof AndSig) {
                return "(" + String.join(" AND ", arguments) + ")";
            }
            if (signature instanceof OrSig) {
                return "(" + String.join(" OR ", arguments) + ")";
            }
            if (signature instanceof NotSig) {
                return "(NOT " + arguments.get(0) + ")";
            }
            if (signature instanceof IsNullSig isNull) {
                return "(" + arguments.get(0) + (isNull.polarity() > 0 ? " IS NULL)" : " IS NOT NULL)");
            }
            if (signature instanceof NullIfSig) {
                return "NULLIF(" + String.join(", ", arguments) + ")";
            }
            if (signature instanceof IfNullSig) {
                return "COALESCE(" + String.join(", ", arguments) + ")";
            }
            if (signature instanceof IfSig) {
                return conditional(arguments);
            }
            if (signature instanceof ContainsSig contains) {
                return dialect.formatContains(arguments.get(0), arguments.get(1), contains.polarity());
            }
            if (signature instanceof AddSig) {
                return binary(arguments, "+");
            }
            if (signature instanceof SubtractSig) {
                return binary(arguments, "-");
            }
            if (signature instanceof MultiplySig) {
                return binary(arguments, "*");
            }
            if (signature instanceof DivideSig) {
                return binary(arguments, "/");
            }
            if (signature instanceof NegateSig) {
                return "(- " + arguments.get(0) + ")";
            }
            if (signature instanceof ConcatSig) {
                return binary(arguments, "||");
            }
            if (signature instanceof UpperSig) {
                return "UPPER(" + arguments.get(0) + ")";
            }
            if (signature instanceof LowerSig) {
                return "LOWER(" + arguments.get(0) + ")";
            }
            if (signature instanceof LengthSig) {
                return dialect.formatLength(arguments.get(0));
            }
            if (signature instanceof AggregateSig aggregate) {
                return aggregate.function() + "(" + arguments.get(0) + ")";
            }
            if (signature instanceof ExistsSig) {
                return "EXISTS " + arguments.get(0);
            }
            if (signature instanceof SortDirectionSig direction) {
                return arguments.get(0) + (direction.direction() > 0 ? " ASC" : " DESC");
            }
            throw new IllegalStateException("Cannot serialize formula " + signature);
        }

        private String binary(List<String> arguments, String operator) {
            return "(" + arguments.get(0) + " " + operator + " " + arguments.get(1) + ")";
        }

        private String conditional(List<String> arguments) {
            StringBuilder sql = new StringBuilder("(CASE");
            int index = 0;
            for (; index + 1 < arguments.size(); index += 2) {
                sql.append(" WHEN ").append(arguments.get(index)).append(" THEN ").append(arguments.get(index + 1));
            }
            if (index < arguments.size()) {
                sql.append(" ELSE ").append(arguments.get(index));
            }
            return sql.append(" END)").toString();
        }
    }
}
