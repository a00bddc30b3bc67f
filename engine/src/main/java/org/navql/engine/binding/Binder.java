package org.navql.engine.binding;

import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.domain.DateDomain;
import org.navql.engine.domain.DecimalDomain;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.DomainException;
import org.navql.engine.domain.FloatDomain;
import org.navql.engine.domain.IntegerDomain;
import org.navql.engine.domain.TextDomain;
import org.navql.engine.domain.UntypedDomain;
import org.navql.engine.entity.Catalog;
import org.navql.engine.error.BindException;
import org.navql.engine.error.Mark;
import org.navql.engine.signature.AndSig;
import org.navql.engine.signature.AvgSig;
import org.navql.engine.signature.CompareSig;
import org.navql.engine.signature.ConcatSig;
import org.navql.engine.signature.ContainsSig;
import org.navql.engine.signature.CountSig;
import org.navql.engine.signature.IfNullSig;
import org.navql.engine.signature.IfSig;
import org.navql.engine.signature.IsEqualSig;
import org.navql.engine.signature.IsNullSig;
import org.navql.engine.signature.IsTotallyEqualSig;
import org.navql.engine.signature.LengthSig;
import org.navql.engine.signature.LowerSig;
import org.navql.engine.signature.MaxSig;
import org.navql.engine.signature.MinSig;
import org.navql.engine.signature.DivideSig;
import org.navql.engine.signature.MultiplySig;
import org.navql.engine.signature.NegateSig;
import org.navql.engine.signature.NotSig;
import org.navql.engine.signature.NullIfSig;
import org.navql.engine.signature.OrSig;
import org.navql.engine.signature.QuantifySig;
import org.navql.engine.signature.Signature;
import org.navql.engine.signature.SubtractSig;
import org.navql.engine.signature.SumSig;
import org.navql.engine.signature.UpperSig;
import org.navql.engine.signature.AddSig;
import org.navql.engine.syntax.ApplySyntax;
import org.navql.engine.syntax.ComplementSyntax;
import org.navql.engine.syntax.ComposeSyntax;
import org.navql.engine.syntax.DetachSyntax;
import org.navql.engine.syntax.DirectSyntax;
import org.navql.engine.syntax.FilterSyntax;
import org.navql.engine.syntax.GroupSyntax;
import org.navql.engine.syntax.IdentifierSyntax;
import org.navql.engine.syntax.LinkSyntax;
import org.navql.engine.syntax.NumberSyntax;
import org.navql.engine.syntax.OperatorSyntax;
import org.navql.engine.syntax.PrefixSyntax;
import org.navql.engine.syntax.ProjectSyntax;
import org.navql.engine.syntax.QuerySyntax;
import org.navql.engine.syntax.RecordSyntax;
import org.navql.engine.syntax.ReferenceSyntax;
import org.navql.engine.syntax.SelectSyntax;
import org.navql.engine.syntax.StringSyntax;
import org.navql.engine.syntax.Syntax;
import org.navql.engine.syntax.SyntaxVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the names of a syntax tree against a catalog.
 *
 * <p>The binder walks the tree keeping track of the current scope. Each
 * identifier is looked up in the scope it appears in; operators and
 * function calls get their signature and result domain here, with implicit
 * conversions made explicit as {@link CastBinding}s.
 *
 * <p>A binder is used for one query only.
 */
public final class Binder {

    private static final Logger LOG = LoggerFactory.getLogger(Binder.class);

    private static final Set<String> NULLARY_FUNCTIONS = Set.of("true", "false", "null", "root", "this");

    /** Functions that applied to a selection act on the selected flow. */
    private static final Set<String> RESHAPING = Set.of("filter", "sort", "limit", "head");

    private final Lookup lookup;
    private final Map<String, Object> environment;

    public Binder(Catalog catalog, Map<String, Object> environment) {
        this.lookup = new Lookup(catalog);
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
    }

    /**
     * Binds a whole query.
     *
     * @throws BindException if a name cannot be resolved or an operand has
     *                       the wrong type
     */
    public SegmentBinding bind(QuerySyntax syntax) {
        RootBinding root = new RootBinding(syntax.mark());
        Binding seed = syntax.arm() != null ? bind(syntax.arm(), root) : null;
        SegmentBinding segment = new SegmentBinding(root, seed, syntax.mark());
        LOG.debug("Bound query {}", syntax);
        return segment;
    }

    Binding bind(Syntax syntax, Binding scope) {
        return syntax.accept(new Scoped(scope));
    }

    /**
     * Binds the nodes of one scope; nested scopes get their own instance.
     */
    private final class Scoped implements SyntaxVisitor<Binding> {

        private final Binding scope;

        Scoped(Binding scope) {
            this.scope = scope;
        }

        @Override
        public Binding visitQuery(QuerySyntax syntax) {
            throw new BindException("unexpected query", syntax.mark());
        }

        @Override
        public Binding visitFilter(FilterSyntax syntax) {
            if (syntax.larm() instanceof SelectSyntax select) {
                FilterSyntax sieve = new FilterSyntax(select.larm(), syntax.rarm(), syntax.mark());
                return bind(new SelectSyntax(sieve, select.rarm(), syntax.mark()), scope);
            }
            if (syntax.larm() instanceof RecordSyntax record) {
                Binding filter = toBoolean(bind(syntax.rarm(), scope));
                return select(new SieveBinding(scope, filter, syntax.mark()), record.arms(), syntax.mark());
            }
            Binding base = bind(syntax.larm(), scope);
            Binding filter = toBoolean(bind(syntax.rarm(), base));
            return new SieveBinding(base, filter, syntax.mark());
        }

        @Override
        public Binding visitProject(ProjectSyntax syntax) {
            Binding seed = bind(syntax.larm(), scope);
            if (!seed.isEntity()) {
                throw new BindException("expected a plural expression", syntax.larm().mark());
            }
            List<Syntax> arms = syntax.rarm() instanceof RecordSyntax record
                    ? record.arms()
                    : List.of(syntax.rarm());
            List<Binding> kernels = new ArrayList<>();
            List<String> titles = new ArrayList<>();
            for (Syntax arm : arms) {
                Binding kernel = bind(arm, seed);
                if (!kernel.domain().isScalar() && !(kernel.domain() instanceof UntypedDomain)) {
                    throw new BindException("a kernel expression must be scalar", arm.mark());
                }
                kernels.add(settle(kernel));
                titles.add(title(arm));
            }
            return new QuotientBinding(scope, seed, kernels, titles, syntax.mark());
        }

        @Override
        public Binding visitSelect(SelectSyntax syntax) {
            Binding base = bind(syntax.larm(), scope);
            return select(base, syntax.rarm().arms(), syntax.mark());
        }

        @Override
        public Binding visitRecord(RecordSyntax syntax) {
            return select(scope, syntax.arms(), syntax.mark());
        }

        @Override
        public Binding visitDirect(DirectSyntax syntax) {
            throw new BindException("a sort direction is only allowed in a selection or a sort", syntax.mark());
        }

        @Override
        public Binding visitOperator(OperatorSyntax syntax) {
            Binding left = bind(syntax.larm(), scope);
            Binding right = bind(syntax.rarm(), scope);
            Mark mark = syntax.mark();
            switch (syntax.symbol()) {
                case "&":
                    return formula(new AndSig(), new BooleanDomain(), mark, toBoolean(left), toBoolean(right));
                case "|":
                    return formula(new OrSig(), new BooleanDomain(), mark, toBoolean(left), toBoolean(right));
                case "=":
                case "!=":
                    return compare(new IsEqualSig(syntax.symbol().equals("=") ? 1 : -1), left, right, mark);
                case "==":
                case "!==":
                    return compare(new IsTotallyEqualSig(syntax.symbol().equals("==") ? 1 : -1), left, right, mark);
                case "<":
                case "<=":
                case ">":
                case ">=":
                    return compare(new CompareSig(syntax.symbol()), left, right, mark);
                case "~":
                case "!~":
                    return formula(new ContainsSig(syntax.symbol().equals("~") ? 1 : -1), new BooleanDomain(),
                            mark, cast(left, new TextDomain()), cast(right, new TextDomain()));
                case "+":
                    return arithmetic("+", left, right, mark);
                case "-":
                    return arithmetic("-", left, right, mark);
                case "*":
                    return arithmetic("*", left, right, mark);
                case "/":
                    return arithmetic("/", left, right, mark);
                default:
                    throw new BindException("unknown operator " + syntax.symbol(), mark);
            }
        }

        @Override
        public Binding visitPrefix(PrefixSyntax syntax) {
            Binding arm = bind(syntax.arm(), scope);
            if (syntax.symbol().equals("!")) {
                return formula(new NotSig(), new BooleanDomain(), syntax.mark(), toBoolean(arm));
            }
            Domain domain = arm.domain() instanceof UntypedDomain ? new IntegerDomain() : arm.domain();
            if (!Coercion.isNumeric(domain)) {
                throw new BindException("expected a numeric operand", syntax.arm().mark(),
                        "got a value of type " + domain.family());
            }
            arm = cast(arm, domain);
            if (syntax.symbol().equals("+")) {
                return arm;
            }
            return formula(new NegateSig(), domain, syntax.mark(), arm);
        }

        @Override
        public Binding visitLink(LinkSyntax syntax) {
            HomeBinding home = new HomeBinding(scope, syntax.mark());
            Binding seed = bind(syntax.rarm(), home);
            if (!seed.isEntity()) {
                throw new BindException("expected a plural expression", syntax.rarm().mark());
            }
            Binding lop = bind(syntax.larm(), scope);
            Binding rop = bind(syntax.larm(), seed);
            Domain domain = Coercion.unify(lop.domain(), rop.domain());
            if (domain == null || !domain.isScalar()) {
                throw new BindException("incompatible link images", syntax.larm().mark(),
                        lop.domain().family() + " and " + rop.domain().family());
            }
            List<LinkBinding.Image> images = List.of(new LinkBinding.Image(cast(lop, domain), cast(rop, domain)));
            return new LinkBinding(scope, seed, images, syntax.mark());
        }

        @Override
        public Binding visitCompose(ComposeSyntax syntax) {
            Binding base = bind(syntax.larm(), scope);
            if (base instanceof SelectionBinding selection && syntax.rarm() instanceof ApplySyntax apply
                    && RESHAPING.contains(apply.name())) {
                Binding reshaped = bind(syntax.rarm(), selection.base());
                return new SelectionBinding(reshaped, selection.elements(), selection.titles(), syntax.mark());
            }
            return bind(syntax.rarm(), base);
        }

        @Override
        public Binding visitDetach(DetachSyntax syntax) {
            return bind(syntax.arm(), new HomeBinding(scope, syntax.mark()));
        }

        @Override
        public Binding visitComplement(ComplementSyntax syntax) {
            if (!(Lookup.target(scope) instanceof QuotientBinding)) {
                throw new BindException("a complement is only allowed in a quotient scope", syntax.mark());
            }
            return new ComplementBinding(scope, syntax.mark());
        }

        @Override
        public Binding visitGroup(GroupSyntax syntax) {
            return bind(syntax.arm(), scope);
        }

        @Override
        public Binding visitApply(ApplySyntax syntax) {
            return call(syntax.name(), syntax.arguments(), syntax.mark());
        }

        @Override
        public Binding visitIdentifier(IdentifierSyntax syntax) {
            Optional<Recipe> recipe = lookup.lookup(scope, syntax.name());
            if (recipe.isPresent()) {
                return use(recipe.get(), syntax.mark());
            }
            if (NULLARY_FUNCTIONS.contains(syntax.name())) {
                return call(syntax.name(), List.of(), syntax.mark());
            }
            throw new BindException("unrecognized identifier", syntax.mark(), syntax.name());
        }

        @Override
        public Binding visitReference(ReferenceSyntax syntax) {
            if (!environment.containsKey(syntax.name())) {
                throw new BindException("unrecognized reference", syntax.mark(), "$" + syntax.name());
            }
            Object value = environment.get(syntax.name());
            Domain domain = domainOf(value, syntax);
            return new ParameterBinding(scope, syntax.name(), normalize(value), domain, syntax.mark());
        }

        @Override
        public Binding visitString(StringSyntax syntax) {
            return new LiteralBinding(scope, syntax.text(), new UntypedDomain(), syntax.mark());
        }

        @Override
        public Binding visitNumber(NumberSyntax syntax) {
            Domain domain;
            switch (syntax.kind()) {
                case INTEGER:
                    domain = new IntegerDomain();
                    break;
                case DECIMAL:
                    domain = new DecimalDomain();
                    break;
                default:
                    domain = new FloatDomain();
                    break;
            }
            try {
                return new LiteralBinding(scope, domain.parse(syntax.text()), domain, syntax.mark());
            } catch (DomainException e) {
                throw new BindException("invalid " + domain.family() + " literal", syntax.mark(), e.getMessage());
            }
        }

        private Binding use(Recipe recipe, Mark mark) {
            if (recipe instanceof Recipe.TableRecipe table) {
                return new TableBinding(scope, table.table(), mark);
            }
            if (recipe instanceof Recipe.ColumnRecipe column) {
                ChainBinding link = column.link() != null ? new ChainBinding(scope, column.link(), mark) : null;
                return new ColumnBinding(scope, column.column(), link, mark);
            }
            if (recipe instanceof Recipe.ChainRecipe chain) {
                return new ChainBinding(scope, chain.joins(), mark);
            }
            if (recipe instanceof Recipe.KernelRecipe kernel) {
                Domain domain = kernel.quotient().kernels().get(kernel.index()).domain();
                return new KernelBinding(scope, kernel.index(), domain, mark);
            }
            if (recipe instanceof Recipe.ComplementRecipe) {
                return new ComplementBinding(scope, mark);
            }
            Recipe.AmbiguousRecipe ambiguous = (Recipe.AmbiguousRecipe) recipe;
            throw new BindException("ambiguous identifier", mark,
                    ambiguous.name() + " may refer to " + String.join(", ", ambiguous.alternatives()));
        }

        private Binding call(String name, List<Syntax> arguments, Mark mark) {
            switch (name) {
                case "true":
                case "false":
                    expectArity(name, arguments, 0, mark);
                    return new LiteralBinding(scope, name.equals("true"), new BooleanDomain(), mark);
                case "null":
                    expectArity(name, arguments, 0, mark);
                    return new LiteralBinding(scope, null, new UntypedDomain(), mark);
                case "root":
                    expectArity(name, arguments, 0, mark);
                    return new RootBinding(mark);
                case "this":
                    expectArity(name, arguments, 0, mark);
                    return scope;
                case "filter": {
                    expectArity(name, arguments, 1, mark);
                    Binding filter = toBoolean(bind(arguments.get(0), scope));
                    return new SieveBinding(scope, filter, mark);
                }
                case "select":
                    return select(scope, arguments, mark);
                case "sort":
                    return sort(arguments, mark);
                case "limit":
                    if (arguments.size() < 1 || arguments.size() > 2) {
                        throw new BindException("function 'limit' expects 1 or 2 arguments", mark);
                    }
                    return new SortBinding(scope, List.of(), count(arguments.get(0)),
                            arguments.size() > 1 ? count(arguments.get(1)) : null, mark);
                case "head":
                    if (arguments.size() > 1) {
                        throw new BindException("function 'head' expects at most 1 argument", mark);
                    }
                    return new SortBinding(scope, List.of(), arguments.isEmpty() ? 1L : count(arguments.get(0)),
                            null, mark);
                case "moniker": {
                    expectArity(name, arguments, 1, mark);
                    Binding seed = bind(arguments.get(0), scope);
                    if (!seed.isEntity()) {
                        throw new BindException("expected a plural expression", arguments.get(0).mark());
                    }
                    return new CoverBinding(scope, seed, mark);
                }
                case "fork": {
                    List<Binding> kernels = new ArrayList<>();
                    for (Syntax argument : arguments) {
                        kernels.add(settle(bind(argument, scope)));
                    }
                    return new ForkBinding(scope, kernels, mark);
                }
                case "count":
                    expectArity(name, arguments, 1, mark);
                    return formula(new CountSig(), new IntegerDomain(), mark,
                            toBoolean(bind(arguments.get(0), scope)));
                case "exists":
                case "every":
                    expectArity(name, arguments, 1, mark);
                    return formula(new QuantifySig(name.equals("exists") ? 1 : -1), new BooleanDomain(), mark,
                            toBoolean(bind(arguments.get(0), scope)));
                case "sum":
                case "avg": {
                    expectArity(name, arguments, 1, mark);
                    Binding op = bind(arguments.get(0), scope);
                    if (!Coercion.isNumeric(op.domain())) {
                        throw new BindException("expected a numeric argument", arguments.get(0).mark(),
                                "got a value of type " + op.domain().family());
                    }
                    if (name.equals("sum")) {
                        return formula(new SumSig(), op.domain(), mark, op);
                    }
                    Domain domain = op.domain() instanceof FloatDomain ? new FloatDomain() : new DecimalDomain();
                    return formula(new AvgSig(), domain, mark, op);
                }
                case "min":
                case "max": {
                    expectArity(name, arguments, 1, mark);
                    Binding op = settle(bind(arguments.get(0), scope));
                    if (!op.domain().isScalar()) {
                        throw new BindException("expected a scalar argument", arguments.get(0).mark());
                    }
                    Signature signature = name.equals("min") ? new MinSig() : new MaxSig();
                    return formula(signature, op.domain(), mark, op);
                }
                case "is_null":
                    expectArity(name, arguments, 1, mark);
                    return formula(new IsNullSig(1), new BooleanDomain(), mark,
                            settle(bind(arguments.get(0), scope)));
                case "null_if":
                case "if_null": {
                    expectArity(name, arguments, 2, mark);
                    Binding left = bind(arguments.get(0), scope);
                    Binding right = bind(arguments.get(1), scope);
                    Domain domain = unify(left, right, mark);
                    Signature signature = name.equals("null_if") ? new NullIfSig() : new IfNullSig();
                    return formula(signature, domain, mark, cast(left, domain), cast(right, domain));
                }
                case "if": {
                    if (arguments.size() < 2 || arguments.size() > 3) {
                        throw new BindException("function 'if' expects 2 or 3 arguments", mark);
                    }
                    Binding condition = toBoolean(bind(arguments.get(0), scope));
                    Binding consequent = bind(arguments.get(1), scope);
                    Binding alternative = arguments.size() > 2
                            ? bind(arguments.get(2), scope)
                            : new LiteralBinding(scope, null, new UntypedDomain(), mark);
                    Domain domain = unify(consequent, alternative, mark);
                    return formula(new IfSig(), domain, mark, condition, cast(consequent, domain),
                            cast(alternative, domain));
                }
                case "upper":
                case "lower":
                case "length": {
                    expectArity(name, arguments, 1, mark);
                    Binding op = cast(bind(arguments.get(0), scope), new TextDomain());
                    if (name.equals("length")) {
                        return formula(new LengthSig(), new IntegerDomain(), mark, op);
                    }
                    Signature signature = name.equals("upper") ? new UpperSig() : new LowerSig();
                    return formula(signature, new TextDomain(), mark, op);
                }
                case "boolean":
                    return convert(name, arguments, new BooleanDomain(), mark);
                case "integer":
                    return convert(name, arguments, new IntegerDomain(), mark);
                case "decimal":
                    return convert(name, arguments, new DecimalDomain(), mark);
                case "float":
                    return convert(name, arguments, new FloatDomain(), mark);
                case "text":
                    return convert(name, arguments, new TextDomain(), mark);
                case "date":
                    return convert(name, arguments, new DateDomain(), mark);
                default:
                    throw new BindException("unrecognized function", mark, name);
            }
        }

        private Binding select(Binding base, List<Syntax> arms, Mark mark) {
            List<Binding> elements = new ArrayList<>();
            List<String> titles = new ArrayList<>();
            List<SortKey> order = new ArrayList<>();
            for (Syntax arm : arms) {
                Syntax element = arm;
                int direction = 0;
                if (arm instanceof DirectSyntax direct) {
                    element = direct.arm();
                    direction = direct.symbol().equals("-") ? -1 : 1;
                }
                Binding binding = settle(bind(element, base));
                if (!binding.domain().isScalar()) {
                    throw new BindException("expected a scalar expression", element.mark(),
                            "nested segments are not supported");
                }
                elements.add(binding);
                titles.add(title(element));
                if (direction != 0) {
                    order.add(new SortKey(binding, direction));
                }
            }
            Binding scope = base;
            if (!order.isEmpty()) {
                scope = new SortBinding(base, order, null, null, mark);
            }
            return new SelectionBinding(scope, elements, titles, mark);
        }

        private Binding sort(List<Syntax> arguments, Mark mark) {
            List<SortKey> order = new ArrayList<>();
            for (Syntax argument : arguments) {
                Syntax key = argument;
                int direction = 1;
                if (argument instanceof DirectSyntax direct) {
                    key = direct.arm();
                    direction = direct.symbol().equals("-") ? -1 : 1;
                }
                Binding binding = settle(bind(key, scope));
                if (!binding.domain().isScalar()) {
                    throw new BindException("expected a scalar sort key", key.mark());
                }
                order.add(new SortKey(binding, direction));
            }
            return new SortBinding(scope, order, null, null, mark);
        }

        private Binding compare(Signature signature, Binding left, Binding right, Mark mark) {
            Domain domain = unify(left, right, mark);
            return formula(signature, new BooleanDomain(), mark, cast(left, domain), cast(right, domain));
        }

        private Binding arithmetic(String symbol, Binding left, Binding right, Mark mark) {
            Domain domain = unify(left, right, mark);
            if (symbol.equals("+") && domain instanceof TextDomain) {
                return formula(new ConcatSig(), domain, mark, cast(left, domain), cast(right, domain));
            }
            if (!Coercion.isNumeric(domain)) {
                throw new BindException("expected numeric operands for " + symbol, mark,
                        "got " + left.domain().family() + " and " + right.domain().family());
            }
            if (symbol.equals("/")) {
                if (domain instanceof IntegerDomain) {
                    domain = new DecimalDomain();
                }
                return formula(new DivideSig(), domain, mark, cast(left, domain), cast(right, domain));
            }
            Signature signature = symbol.equals("+") ? new AddSig()
                    : symbol.equals("-") ? new SubtractSig() : new MultiplySig();
            return formula(signature, domain, mark, cast(left, domain), cast(right, domain));
        }

        private Binding convert(String name, List<Syntax> arguments, Domain domain, Mark mark) {
            expectArity(name, arguments, 1, mark);
            return new CastBinding(bind(arguments.get(0), scope), domain, mark);
        }

        private long count(Syntax syntax) {
            if (syntax instanceof NumberSyntax number && number.kind() == NumberSyntax.Kind.INTEGER) {
                try {
                    long value = Long.parseLong(number.text());
                    if (value >= 0) {
                        return value;
                    }
                } catch (NumberFormatException e) {
                    throw new BindException("expected a non-negative integer", syntax.mark(), e.getMessage());
                }
            }
            throw new BindException("expected a non-negative integer", syntax.mark());
        }

        private FormulaBinding formula(Signature signature, Domain domain, Mark mark, Binding... arguments) {
            return new FormulaBinding(scope, signature, domain, List.of(arguments), mark);
        }
    }

    private static Domain unify(Binding left, Binding right, Mark mark) {
        Domain domain = Coercion.unify(left.domain(), right.domain());
        if (domain == null || !domain.isScalar()) {
            throw new BindException("incompatible operand types", mark,
                    left.domain().family() + " and " + right.domain().family());
        }
        return domain;
    }

    private static Binding toBoolean(Binding binding) {
        return cast(binding, new BooleanDomain());
    }

    private static Binding settle(Binding binding) {
        return cast(binding, Coercion.settle(binding.domain()));
    }

    private static Binding cast(Binding binding, Domain domain) {
        if (binding.domain().equals(domain)) {
            return binding;
        }
        return new CastBinding(binding, domain, binding.mark());
    }

    private static void expectArity(String name, List<Syntax> arguments, int arity, Mark mark) {
        if (arguments.size() != arity) {
            throw new BindException("function '" + name + "' expects " + arity
                    + (arity == 1 ? " argument" : " arguments"), mark, "got " + arguments.size());
        }
    }

    private static String title(Syntax syntax) {
        if (syntax instanceof IdentifierSyntax identifier) {
            return identifier.name();
        }
        if (syntax instanceof ComposeSyntax compose && compose.rarm() instanceof IdentifierSyntax) {
            return compose.toString();
        }
        return syntax.toString();
    }

    private static Domain domainOf(Object value, ReferenceSyntax syntax) {
        if (value == null || value instanceof String) {
            return new UntypedDomain();
        }
        if (value instanceof Boolean) {
            return new BooleanDomain();
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof BigInteger) {
            return new IntegerDomain();
        }
        if (value instanceof BigDecimal) {
            return new DecimalDomain();
        }
        if (value instanceof Double || value instanceof Float) {
            return new FloatDomain();
        }
        if (value instanceof LocalDate) {
            return new DateDomain();
        }
        throw new BindException("unsupported parameter value", syntax.mark(), value.getClass().getSimpleName());
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }
}
