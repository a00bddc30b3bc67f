package org.navql.engine;

import org.navql.engine.assemble.Assembler;
import org.navql.engine.binding.Binder;
import org.navql.engine.binding.Binding;
import org.navql.engine.binding.SegmentBinding;
import org.navql.engine.binding.SelectionBinding;
import org.navql.engine.code.Code;
import org.navql.engine.code.ColumnUnit;
import org.navql.engine.code.KernelUnit;
import org.navql.engine.code.SegmentExpr;
import org.navql.engine.compile.Compiler;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.dump.Placeholder;
import org.navql.engine.dump.SQLSerializer;
import org.navql.engine.dump.SQLStatement;
import org.navql.engine.encode.Encoder;
import org.navql.engine.execution.Pipe;
import org.navql.engine.frame.Clauses;
import org.navql.engine.frame.Phrase;
import org.navql.engine.frame.SegmentFrame;
import org.navql.engine.plan.Field;
import org.navql.engine.plan.Plan;
import org.navql.engine.plan.Profile;
import org.navql.engine.plan.TranslationContext;
import org.navql.engine.reduce.Reducer;
import org.navql.engine.rewrite.Rewriter;
import org.navql.engine.syntax.QueryParser;
import org.navql.engine.syntax.QuerySyntax;
import org.navql.engine.term.SegmentTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Translates query text into an executable {@link Pipe}.
 *
 * <p>A translator is stateless apart from its context and may be shared;
 * every translation builds its own stages. The pipeline runs the parser,
 * the binder, the encoder, the rewriter, the compiler, the assembler, the
 * reducer and the serializer in turn. Any stage failure propagates
 * unchanged and no SQL is produced.
 */
public final class Translator {

    private static final Logger LOG = LoggerFactory.getLogger(Translator.class);

    private final TranslationContext context;

    public Translator(TranslationContext context) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
    }

    public TranslationContext context() {
        return context;
    }

    /**
     * Translates a query with the environment and limit of the context.
     */
    public Pipe translate(String query) {
        return translate(query, context.environment(), context.defaultLimit());
    }

    /**
     * Translates a query.
     *
     * @param query       The query text
     * @param environment Values of {@code $name} references
     * @param limit       The maximum number of rows to produce; null for no limit
     * @throws org.navql.engine.error.TranslateException if the query is invalid
     */
    public Pipe translate(String query, Map<String, Object> environment, Long limit) {
        Objects.requireNonNull(query, "Query cannot be null");
        QuerySyntax syntax = QueryParser.parse(query);
        SegmentBinding segment = new Binder(context.catalog(), environment).bind(syntax);
        if (segment.seed() == null) {
            LOG.info("Query {} has no segment", query);
            return new Pipe(Plan.empty(), context.permissions());
        }
        SegmentExpr expression = new Rewriter().rewrite(new Encoder().encode(segment));
        SegmentTerm term = new Compiler().compile(expression);
        SegmentFrame frame = new Reducer().reduce(new Assembler().assemble(term));
        if (limit != null) {
            frame = restrict(frame, limit);
        }
        SQLStatement statement = new SQLSerializer(context.dialect()).serialize(frame);
        LOG.info("Translated {} into SQL:\n{}", query, statement.sql());

        List<Domain> domains = frame.clauses().select().stream().map(Phrase::domain).toList();
        Map<Integer, Domain> placeholders = new LinkedHashMap<>();
        List<Object> parameters = new ArrayList<>();
        for (Placeholder placeholder : statement.placeholders()) {
            placeholders.put(placeholder.position(), placeholder.domain());
            parameters.add(placeholder.value());
        }
        Plan plan = new Plan(statement.sql(), domains, placeholders, parameters, frame.outputs(),
                profile(segment, expression));
        return new Pipe(plan, context.permissions());
    }

    /**
     * Caps the number of rows of the segment; an existing limit is kept if smaller.
     */
    private static SegmentFrame restrict(SegmentFrame frame, long limit) {
        Clauses clauses = frame.clauses();
        Long bound = clauses.limit() != null ? Math.min(clauses.limit(), limit) : limit;
        return frame.withClauses(clauses.withOrder(clauses.order(), bound, clauses.offset()));
    }

    private static Profile profile(SegmentBinding segment, SegmentExpr expression) {
        List<Code> codes = expression.codes();
        List<Field> fields = new ArrayList<>();
        Binding seed = segment.seed();
        for (int i = 0; i < codes.size(); i++) {
            String name;
            if (seed instanceof SelectionBinding selection) {
                name = selection.titles().get(i);
            } else if (seed.domain() instanceof EntityDomain) {
                name = columnName(codes.get(i));
            } else {
                name = seed.mark().fragment();
            }
            fields.add(new Field(name, codes.get(i).domain()));
        }
        return new Profile(fields);
    }

    private static String columnName(Code code) {
        if (code instanceof KernelUnit kernel) {
            return columnName(kernel.code());
        }
        return code instanceof ColumnUnit column ? column.column().name() : null;
    }
}
