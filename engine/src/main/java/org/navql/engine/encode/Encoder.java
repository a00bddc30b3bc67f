package org.navql.engine.encode;

import org.navql.engine.binding.Binding;
import org.navql.engine.binding.BindingVisitor;
import org.navql.engine.binding.CastBinding;
import org.navql.engine.binding.ChainBinding;
import org.navql.engine.binding.ColumnBinding;
import org.navql.engine.binding.ComplementBinding;
import org.navql.engine.binding.CoverBinding;
import org.navql.engine.binding.ForkBinding;
import org.navql.engine.binding.FormulaBinding;
import org.navql.engine.binding.HomeBinding;
import org.navql.engine.binding.KernelBinding;
import org.navql.engine.binding.LinkBinding;
import org.navql.engine.binding.LiteralBinding;
import org.navql.engine.binding.ParameterBinding;
import org.navql.engine.binding.QuotientBinding;
import org.navql.engine.binding.RootBinding;
import org.navql.engine.binding.SegmentBinding;
import org.navql.engine.binding.SelectionBinding;
import org.navql.engine.binding.SieveBinding;
import org.navql.engine.binding.SortBinding;
import org.navql.engine.binding.SortKey;
import org.navql.engine.binding.TableBinding;
import org.navql.engine.code.AggregateUnit;
import org.navql.engine.code.Code;
import org.navql.engine.code.ColumnUnit;
import org.navql.engine.code.CorrelatedUnit;
import org.navql.engine.code.FormulaCode;
import org.navql.engine.code.Joint;
import org.navql.engine.code.KernelUnit;
import org.navql.engine.code.LiteralCode;
import org.navql.engine.code.Ordering;
import org.navql.engine.code.ParameterCode;
import org.navql.engine.code.ScalarUnit;
import org.navql.engine.code.SegmentExpr;
import org.navql.engine.code.Unit;
import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.domain.RecordDomain;
import org.navql.engine.entity.ColumnEntity;
import org.navql.engine.entity.Join;
import org.navql.engine.error.EncodeException;
import org.navql.engine.error.Mark;
import org.navql.engine.signature.AggregateSig;
import org.navql.engine.signature.CountSig;
import org.navql.engine.signature.ExistsSig;
import org.navql.engine.signature.IfNullSig;
import org.navql.engine.signature.IsNullSig;
import org.navql.engine.signature.LengthSig;
import org.navql.engine.signature.NotSig;
import org.navql.engine.signature.NullIfSig;
import org.navql.engine.signature.QuantifySig;
import org.navql.engine.signature.SumSig;
import org.navql.engine.space.FiberTableSpace;
import org.navql.engine.space.AttachSpace;
import org.navql.engine.space.ComplementSpace;
import org.navql.engine.space.DirectTableSpace;
import org.navql.engine.space.FilteredSpace;
import org.navql.engine.space.ForkedSpace;
import org.navql.engine.space.MonikerSpace;
import org.navql.engine.space.OrderedSpace;
import org.navql.engine.space.QuotientFamily;
import org.navql.engine.space.QuotientSpace;
import org.navql.engine.space.RootSpace;
import org.navql.engine.space.ScalarSpace;
import org.navql.engine.space.Space;
import org.navql.engine.space.TableFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a binding tree into spaces and codes.
 *
 * <p>{@link #relate} gives the space a binding ranges over, {@link #encode}
 * the code it computes. The two are mutually recursive: a filtered space
 * needs the code of its condition, a column code needs the space of its
 * table. Results are memoized per binding node, so a shared subtree is
 * encoded once.
 *
 * <p>An encoder holds per-query state; use a fresh instance for each query.
 */
public final class Encoder {

    private static final Logger LOG = LoggerFactory.getLogger(Encoder.class);

    private final Map<Binding, Space> spaces = new IdentityHashMap<>();
    private final Map<Binding, Code> codes = new IdentityHashMap<>();
    private final Relate relator = new Relate();
    private final Encode encoder = new Encode();

    /**
     * Encodes the top of a query. The segment must have a seed.
     *
     * @throws EncodeException if the seed does not describe an unambiguous
     *                         row set
     */
    public SegmentExpr encode(SegmentBinding segment) {
        if (segment.seed() == null) {
            throw new IllegalStateException("An empty segment has nothing to encode");
        }
        Space root = relate(segment.base());
        Binding seed = segment.seed();
        Space space;
        List<Code> output = new ArrayList<>();
        if (seed instanceof SelectionBinding selection) {
            space = relate(selection);
            for (Binding element : selection.elements()) {
                output.add(encode(element));
            }
        } else if (seed.domain() instanceof EntityDomain) {
            space = relate(seed);
            output.addAll(expand(space, seed.mark()));
        } else if (seed.domain() instanceof RecordDomain || !seed.domain().isScalar()) {
            throw new EncodeException("expected a table, a selection or a scalar expression", seed.mark());
        } else {
            Code code = encode(seed);
            space = deduce(code, seed.mark());
            if (code instanceof LiteralCode literal && literal.isUntyped()) {
                if (literal.value() == null) {
                    space = new FilteredSpace(space, new LiteralCode(false, new BooleanDomain(), seed.mark()),
                            seed.mark());
                }
            } else {
                Code filter = new FormulaCode(new IsNullSig(-1), new BooleanDomain(), seed.mark(), code);
                space = new FilteredSpace(space, filter, seed.mark());
            }
            output.add(code);
        }
        if (!space.spans(root)) {
            throw new EncodeException("expected a descendant segment flow", seed.mark());
        }
        for (Code code : output) {
            for (Unit unit : code.units()) {
                if (!space.spans(unit.space())) {
                    throw new EncodeException("expected a singular expression", code.mark());
                }
            }
        }
        SegmentExpr result = new SegmentExpr(root, space, output, segment.mark());
        LOG.debug("Encoded segment {}", result);
        return result;
    }

    /**
     * The space of rows a binding ranges over.
     */
    public Space relate(Binding binding) {
        Space space = spaces.get(binding);
        if (space == null) {
            space = binding.accept(relator);
            spaces.put(binding, space);
        }
        return space;
    }

    /**
     * The code computed by a scalar binding.
     */
    public Code encode(Binding binding) {
        Code code = codes.get(binding);
        if (code == null) {
            code = binding.accept(encoder);
            codes.put(binding, code);
        }
        return code;
    }

    private List<Code> expand(Space space, Mark mark) {
        List<Code> output = new ArrayList<>();
        if (space.family() instanceof TableFamily family) {
            for (ColumnEntity column : family.table().columns()) {
                output.add(new ColumnUnit(column, space, mark));
            }
        } else if (space.family() instanceof QuotientFamily family) {
            for (Code kernel : family.kernels()) {
                output.add(new KernelUnit(kernel, space, mark));
            }
        } else {
            throw new EncodeException("expected a table, a selection or a scalar expression", mark);
        }
        return output;
    }

    /**
     * The space of a scalar segment: the unique largest space among the
     * units of the code.
     */
    private static Space deduce(Code code, Mark mark) {
        List<Space> candidates = maximal(code.units());
        if (candidates.isEmpty()) {
            return new RootSpace(mark);
        }
        if (candidates.size() > 1) {
            throw new EncodeException("cannot deduce an unambiguous segment flow", mark);
        }
        return candidates.get(0);
    }

    private static List<Space> maximal(List<Unit> units) {
        List<Space> candidates = new ArrayList<>();
        for (Unit unit : units) {
            Space space = unit.space();
            if (candidates.stream().anyMatch(candidate -> candidate.dominates(space))) {
                continue;
            }
            candidates.removeIf(space::dominates);
            candidates.add(space);
        }
        return candidates;
    }

    /**
     * The plural space an aggregate of {@code op} in {@code space} reduces
     * over.
     */
    private static Space plural(Code op, Space space, Mark mark) {
        List<Unit> units = new ArrayList<>();
        for (Unit unit : op.units()) {
            if (!space.spans(unit.space())) {
                units.add(unit);
            }
        }
        if (units.isEmpty()) {
            throw new EncodeException("a plural operand is required", mark);
        }
        List<Space> candidates = maximal(units);
        if (candidates.size() > 1) {
            throw new EncodeException("invalid plural operand", mark,
                    "the operand ranges over unrelated spaces " + candidates);
        }
        Space plural = candidates.get(0);
        if (space.spans(plural)) {
            throw new EncodeException("a plural operand is required", mark);
        }
        if (!plural.spans(space)) {
            throw new EncodeException("a descendant operand is expected", mark);
        }
        for (Space axis = plural; axis != null && !space.spans(axis); axis = axis.base()) {
            if (axis instanceof OrderedSpace ordered && (ordered.limit() != null || ordered.offset() != null)) {
                throw new EncodeException("a sliced plural operand is not supported", mark,
                        "apply limit() to the segment flow instead");
            }
        }
        return plural;
    }

    private final class Relate implements BindingVisitor<Space> {

        @Override
        public Space visitRoot(RootBinding binding) {
            return new RootSpace(binding.mark());
        }

        @Override
        public Space visitHome(HomeBinding binding) {
            return new ScalarSpace(relate(binding.base()), binding.mark());
        }

        @Override
        public Space visitTable(TableBinding binding) {
            return new DirectTableSpace(relate(binding.base()), binding.table(), binding.mark());
        }

        @Override
        public Space visitChain(ChainBinding binding) {
            Space space = relate(binding.base());
            for (Join join : binding.joins()) {
                space = new FiberTableSpace(space, join, binding.mark());
            }
            return space;
        }

        @Override
        public Space visitColumn(ColumnBinding binding) {
            if (binding.link() != null) {
                return relate(binding.link());
            }
            return relate(binding.base());
        }

        @Override
        public Space visitQuotient(QuotientBinding binding) {
            Space base = relate(binding.base());
            Space seed = relate(binding.seed());
            if (base.spans(seed)) {
                throw new EncodeException("expected a plural expression", binding.seed().mark());
            }
            if (!seed.spans(base)) {
                throw new EncodeException("expected a descendant expression", binding.seed().mark());
            }
            List<Code> kernels = new ArrayList<>();
            for (Binding kernel : binding.kernels()) {
                kernels.add(encode(kernel));
            }
            return new QuotientSpace(base, seed, kernels, binding.mark());
        }

        @Override
        public Space visitKernel(KernelBinding binding) {
            return relate(binding.base());
        }

        @Override
        public Space visitComplement(ComplementBinding binding) {
            return new ComplementSpace(relate(binding.base()), List.of(), binding.mark());
        }

        @Override
        public Space visitCover(CoverBinding binding) {
            Space base = relate(binding.base());
            Space seed = relate(binding.seed());
            if (!seed.spans(base)) {
                throw new EncodeException("expected a descendant expression", binding.seed().mark());
            }
            return new MonikerSpace(base, seed, List.of(), binding.mark());
        }

        @Override
        public Space visitFork(ForkBinding binding) {
            Space base = relate(binding.base());
            List<Code> kernels = new ArrayList<>();
            for (Binding kernel : binding.kernels()) {
                kernels.add(encode(kernel));
            }
            return new ForkedSpace(base, base, kernels, List.of(), binding.mark());
        }

        @Override
        public Space visitLink(LinkBinding binding) {
            Space base = relate(binding.base());
            Space seed = relate(binding.seed());
            List<Joint> images = new ArrayList<>();
            for (LinkBinding.Image image : binding.images()) {
                images.add(new Joint(encode(image.lop()), encode(image.rop())));
            }
            return new AttachSpace(base, seed, images, List.of(), binding.mark());
        }

        @Override
        public Space visitSieve(SieveBinding binding) {
            return new FilteredSpace(relate(binding.base()), encode(binding.filter()), binding.mark());
        }

        @Override
        public Space visitSort(SortBinding binding) {
            Space base = relate(binding.base());
            List<Ordering> order = new ArrayList<>();
            for (SortKey key : binding.order()) {
                order.add(new Ordering(encode(key.binding()), key.direction()));
            }
            return new OrderedSpace(base, order, binding.limit(), binding.offset(), binding.mark());
        }

        @Override
        public Space visitSelection(SelectionBinding binding) {
            return relate(binding.base());
        }

        @Override
        public Space visitLiteral(LiteralBinding binding) {
            return relate(binding.base());
        }

        @Override
        public Space visitParameter(ParameterBinding binding) {
            return relate(binding.base());
        }

        @Override
        public Space visitCast(CastBinding binding) {
            return relate(binding.base());
        }

        @Override
        public Space visitFormula(FormulaBinding binding) {
            return relate(binding.base());
        }

        @Override
        public Space visitSegment(SegmentBinding binding) {
            return relate(binding.base());
        }
    }

    private final class Encode implements BindingVisitor<Code> {

        @Override
        public Code visitRoot(RootBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitHome(HomeBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitTable(TableBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitChain(ChainBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitColumn(ColumnBinding binding) {
            return new ColumnUnit(binding.column(), relate(binding.base()), binding.mark());
        }

        @Override
        public Code visitQuotient(QuotientBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitKernel(KernelBinding binding) {
            Space space = relate(binding.base());
            if (!(space.family() instanceof QuotientFamily family)) {
                throw new IllegalStateException("A kernel reference outside of a quotient: " + space);
            }
            return new KernelUnit(family.kernels().get(binding.index()), space, binding.mark());
        }

        @Override
        public Code visitComplement(ComplementBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitCover(CoverBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitFork(ForkBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitLink(LinkBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitSieve(SieveBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitSort(SortBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitSelection(SelectionBinding binding) {
            return expectCode(binding);
        }

        @Override
        public Code visitLiteral(LiteralBinding binding) {
            return new LiteralCode(binding.value(), binding.domain(), binding.mark());
        }

        @Override
        public Code visitParameter(ParameterBinding binding) {
            return new ParameterCode(binding.name(), binding.value(), binding.domain(), binding.mark());
        }

        @Override
        public Code visitCast(CastBinding binding) {
            return new Conversion(Encoder.this, binding).convert();
        }

        @Override
        public Code visitFormula(FormulaBinding binding) {
            Mark mark = binding.mark();
            if (binding.signature() instanceof QuantifySig quantify) {
                return quantify(binding, quantify);
            }
            if (binding.signature() instanceof AggregateSig aggregate) {
                return aggregate(binding, aggregate);
            }
            List<Code> arguments = new ArrayList<>();
            for (Binding argument : binding.arguments()) {
                arguments.add(encode(argument));
            }
            Code code = new FormulaCode(binding.signature(), binding.domain(), arguments, mark);
            if (binding.signature() instanceof LengthSig) {
                code = new FormulaCode(new IfNullSig(), binding.domain(), mark, code,
                        new LiteralCode(0L, binding.domain(), mark));
            }
            return code;
        }

        @Override
        public Code visitSegment(SegmentBinding binding) {
            throw new EncodeException("nested segments are not supported", binding.mark());
        }

        private Code aggregate(FormulaBinding binding, AggregateSig signature) {
            Mark mark = binding.mark();
            Code op = encode(binding.arguments().get(0));
            Space space = relate(binding.base());
            Space plural = plural(op, space, binding.arguments().get(0).mark());
            if (signature instanceof CountSig) {
                op = new FormulaCode(new NullIfSig(), op.domain(), mark, op,
                        new LiteralCode(false, op.domain(), mark));
            }
            Code aggregate = new AggregateUnit(new FormulaCode(signature, binding.domain(), mark, op),
                    plural, space, mark);
            if (signature instanceof CountSig || signature instanceof SumSig) {
                Code zero = new LiteralCode(binding.domain().parse("0"), binding.domain(), mark);
                aggregate = new FormulaCode(new IfNullSig(), binding.domain(), mark, aggregate, zero);
            }
            return new ScalarUnit(aggregate, space, mark);
        }

        private Code quantify(FormulaBinding binding, QuantifySig signature) {
            Mark mark = binding.mark();
            Code op = encode(binding.arguments().get(0));
            Space space = relate(binding.base());
            Space plural = plural(op, space, binding.arguments().get(0).mark());
            if (signature.polarity() < 0) {
                op = new FormulaCode(new NotSig(), op.domain(), mark, op);
            }
            plural = new FilteredSpace(plural, op, mark);
            Code unit = new CorrelatedUnit(new LiteralCode(true, new BooleanDomain(), mark), plural, space, mark);
            Code wrapper = new FormulaCode(new ExistsSig(), new BooleanDomain(), mark, unit);
            if (signature.polarity() < 0) {
                wrapper = new FormulaCode(new NotSig(), new BooleanDomain(), mark, wrapper);
            }
            return new ScalarUnit(wrapper, space, mark);
        }

        private Code expectCode(Binding binding) {
            Domain domain = binding.domain();
            throw new EncodeException("expected a scalar expression", binding.mark(),
                    "got a value of type " + domain.family());
        }
    }
}
