package org.navql.engine.rewrite;

import org.navql.engine.code.AggregateUnit;
import org.navql.engine.code.AggregateUnitBase;
import org.navql.engine.code.CastCode;
import org.navql.engine.code.Code;
import org.navql.engine.code.CodeVisitor;
import org.navql.engine.code.ColumnUnit;
import org.navql.engine.code.ComplementUnit;
import org.navql.engine.code.CorrelatedUnit;
import org.navql.engine.code.CorrelationCode;
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
import org.navql.engine.entity.ColumnEntity;
import org.navql.engine.entity.DirectJoin;
import org.navql.engine.error.Mark;
import org.navql.engine.error.RewriteException;
import org.navql.engine.signature.AndSig;
import org.navql.engine.signature.NotSig;
import org.navql.engine.signature.OrSig;
import org.navql.engine.space.AttachSpace;
import org.navql.engine.space.ComplementSpace;
import org.navql.engine.space.DirectTableSpace;
import org.navql.engine.space.FiberTableSpace;
import org.navql.engine.space.FilteredSpace;
import org.navql.engine.space.ForkedSpace;
import org.navql.engine.space.MonikerSpace;
import org.navql.engine.space.OrderedSpace;
import org.navql.engine.space.QuotientFamily;
import org.navql.engine.space.QuotientSpace;
import org.navql.engine.space.RootSpace;
import org.navql.engine.space.ScalarSpace;
import org.navql.engine.space.Space;
import org.navql.engine.space.SpaceVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Simplifies an encoded segment before compilation.
 *
 * <p>The rewriter runs two passes:
 * <ol>
 *   <li><b>simplify</b> folds filters and Boolean connectives over literals;</li>
 *   <li><b>unmask</b> walks the tree keeping a <em>mask</em>: a space whose
 *       operations are known to be applied already. Filters and orderings
 *       the mask makes redundant are dropped, and units are moved to the
 *       shortest space that still produces the same values.</li>
 * </ol>
 * Rewriting a rewritten segment again changes nothing.
 */
public final class Rewriter {

    private static final Logger LOG = LoggerFactory.getLogger(Rewriter.class);

    /**
     * Rewrites a segment.
     *
     * @throws RewriteException if a quotient has no kernel depending on its seed
     */
    public SegmentExpr rewrite(SegmentExpr segment) {
        Simplify simplify = new Simplify();
        SegmentExpr simplified = segment.with(simplify.space(segment.root()), simplify.space(segment.space()),
                simplify.codes(segment.codes()));
        Unmask unmask = new Unmask(simplified.root());
        unmask.push(simplified.space());
        List<Code> codes = unmask.codes(simplified.codes());
        unmask.pop();
        Space space = unmask.space(simplified.space());
        Space root = unmask.space(simplified.root());
        SegmentExpr result = simplified.with(root, space, codes);
        LOG.debug("Rewrote segment {}", result);
        return result;
    }

    private static boolean isLiteral(Code code, boolean value) {
        return code instanceof LiteralCode literal && literal.domain() instanceof BooleanDomain
                && Boolean.valueOf(value).equals(literal.value());
    }

    private static final class Simplify implements SpaceVisitor<Space>, CodeVisitor<Code> {

        private final Map<Object, Object> cache = new HashMap<>();

        Space space(Space space) {
            Object result = cache.get(space);
            if (result == null) {
                result = space.accept(this);
                cache.put(space, result);
            }
            return (Space) result;
        }

        Code code(Code code) {
            Object result = cache.get(code);
            if (result == null) {
                result = code.accept(this);
                cache.put(code, result);
            }
            return (Code) result;
        }

        List<Code> codes(List<Code> codes) {
            List<Code> result = new ArrayList<>(codes.size());
            for (Code code : codes) {
                result.add(code(code));
            }
            return result;
        }

        @Override
        public Space visitRoot(RootSpace space) {
            return space;
        }

        @Override
        public Space visitScalar(ScalarSpace space) {
            return space.withBase(space(space.base()));
        }

        @Override
        public Space visitDirectTable(DirectTableSpace space) {
            return space.withBase(space(space.base()));
        }

        @Override
        public Space visitFiberTable(FiberTableSpace space) {
            return space.withBase(space(space.base()));
        }

        @Override
        public Space visitQuotient(QuotientSpace space) {
            return new QuotientSpace(space(space.base()), space(space.seed()), codes(space.kernels()), space.mark());
        }

        @Override
        public Space visitComplement(ComplementSpace space) {
            return new ComplementSpace(space(space.base()), space.companions(), space.mark());
        }

        @Override
        public Space visitMoniker(MonikerSpace space) {
            return new MonikerSpace(space(space.base()), space(space.seed()), space.companions(), space.mark());
        }

        @Override
        public Space visitForked(ForkedSpace space) {
            return new ForkedSpace(space(space.base()), space(space.seed()), codes(space.kernels()),
                    space.companions(), space.mark());
        }

        @Override
        public Space visitAttach(AttachSpace space) {
            List<Joint> images = new ArrayList<>();
            for (Joint joint : space.images()) {
                images.add(new Joint(code(joint.lop()), code(joint.rop())));
            }
            return new AttachSpace(space(space.base()), space(space.seed()), images, space.companions(),
                    space.mark());
        }

        @Override
        public Space visitFiltered(FilteredSpace space) {
            Space base = space(space.base());
            Code filter = code(space.filter());
            if (isLiteral(filter, true)) {
                return base;
            }
            return new FilteredSpace(base, filter, space.mark());
        }

        @Override
        public Space visitOrdered(OrderedSpace space) {
            List<Ordering> order = new ArrayList<>();
            for (Ordering ordering : space.order()) {
                order.add(ordering.withCode(code(ordering.code())));
            }
            return new OrderedSpace(space(space.base()), order, space.limit(), space.offset(), space.mark());
        }

        @Override
        public Code visitLiteral(LiteralCode code) {
            return code;
        }

        @Override
        public Code visitParameter(ParameterCode code) {
            return code;
        }

        @Override
        public Code visitCast(CastCode code) {
            return code.withBase(code(code.base()));
        }

        @Override
        public Code visitFormula(FormulaCode code) {
            List<Code> arguments = codes(code.arguments());
            Mark mark = code.mark();
            if (code.signature() instanceof AndSig || code.signature() instanceof OrSig) {
                boolean unit = code.signature() instanceof AndSig;
                List<Code> kept = new ArrayList<>();
                for (Code argument : arguments) {
                    if (isLiteral(argument, !unit)) {
                        return new LiteralCode(!unit, code.domain(), mark);
                    }
                    if (!isLiteral(argument, unit) && !kept.contains(argument)) {
                        kept.add(argument);
                    }
                }
                if (kept.isEmpty()) {
                    return new LiteralCode(unit, code.domain(), mark);
                }
                if (kept.size() == 1) {
                    return kept.get(0);
                }
                return code.withArguments(kept);
            }
            if (code.signature() instanceof NotSig) {
                Code argument = arguments.get(0);
                if (isLiteral(argument, true) || isLiteral(argument, false)) {
                    return new LiteralCode(!((Boolean) ((LiteralCode) argument).value()), code.domain(), mark);
                }
            }
            return code.withArguments(arguments);
        }

        @Override
        public Code visitCorrelation(CorrelationCode code) {
            return new CorrelationCode(code(code.code()), code.mark());
        }

        @Override
        public Code visitColumn(ColumnUnit unit) {
            return unit.withSpace(space(unit.space()));
        }

        @Override
        public Code visitScalar(ScalarUnit unit) {
            return new ScalarUnit(code(unit.code()), space(unit.space()), unit.mark());
        }

        @Override
        public Code visitAggregate(AggregateUnit unit) {
            return aggregate(unit);
        }

        @Override
        public Code visitCorrelated(CorrelatedUnit unit) {
            return aggregate(unit);
        }

        private Code aggregate(AggregateUnitBase unit) {
            return unit.withSpaces(code(unit.code()), space(unit.pluralSpace()), space(unit.space()));
        }

        @Override
        public Code visitKernel(KernelUnit unit) {
            int index = kernelIndex(unit);
            Space space = space(unit.space());
            return new KernelUnit(((QuotientFamily) space.family()).kernels().get(index), space, unit.mark());
        }

        @Override
        public Code visitComplement(ComplementUnit unit) {
            return new ComplementUnit(code(unit.code()), space(unit.space()), unit.mark());
        }
    }

    private static int kernelIndex(KernelUnit unit) {
        int index = ((QuotientFamily) unit.space().family()).kernels().indexOf(unit.code());
        if (index < 0) {
            throw new IllegalStateException("A kernel unit must refer to a kernel of its space: " + unit);
        }
        return index;
    }

    private static final class Unmask implements SpaceVisitor<Space>, CodeVisitor<Code> {

        private final Space root;
        private final Deque<Space> masks = new ArrayDeque<>();
        private final Map<List<Object>, Object> cache = new HashMap<>();
        private Space mask;

        Unmask(Space root) {
            this.root = root;
            this.mask = root;
        }

        void push(Space mask) {
            masks.push(this.mask);
            this.mask = mask;
        }

        void pop() {
            mask = masks.pop();
        }

        Space space(Space space) {
            List<Object> key = List.of(mask, space);
            Object result = cache.get(key);
            if (result == null) {
                result = space.accept(this);
                cache.put(key, result);
            }
            return (Space) result;
        }

        Space space(Space space, Space mask) {
            push(mask);
            try {
                return space(space);
            } finally {
                pop();
            }
        }

        Code code(Code code) {
            List<Object> key = List.of(mask, code);
            Object result = cache.get(key);
            if (result == null) {
                result = code.accept(this);
                cache.put(key, result);
            }
            return (Code) result;
        }

        Code code(Code code, Space mask) {
            push(mask);
            try {
                return code(code);
            } finally {
                pop();
            }
        }

        List<Code> codes(List<Code> codes) {
            List<Code> result = new ArrayList<>(codes.size());
            for (Code code : codes) {
                result.add(code(code));
            }
            return result;
        }

        @Override
        public Space visitRoot(RootSpace space) {
            return space;
        }

        @Override
        public Space visitScalar(ScalarSpace space) {
            return space.withBase(space(space.base()));
        }

        @Override
        public Space visitDirectTable(DirectTableSpace space) {
            return space.withBase(space(space.base()));
        }

        @Override
        public Space visitFiberTable(FiberTableSpace space) {
            return space.withBase(space(space.base()));
        }

        @Override
        public Space visitQuotient(QuotientSpace space) {
            List<Code> kernels = new ArrayList<>();
            for (Code kernel : space.kernels()) {
                kernels.add(code(kernel, space.seed()));
            }
            if (kernels.stream().allMatch(kernel -> kernel.units().isEmpty())) {
                throw new RewriteException("an empty or constant kernel is not allowed", space.mark());
            }
            Space seed = space(space.seed(), space.base());
            return new QuotientSpace(space(space.base()), seed, kernels, space.mark());
        }

        @Override
        public Space visitComplement(ComplementSpace space) {
            return new ComplementSpace(space(space.base()), space.companions(), space.mark());
        }

        @Override
        public Space visitMoniker(MonikerSpace space) {
            Space seed = space(space.seed(), space.base());
            return new MonikerSpace(space(space.base()), seed, space.companions(), space.mark());
        }

        @Override
        public Space visitForked(ForkedSpace space) {
            Space seed = space(space.seed(), space.ground());
            List<Code> kernels = new ArrayList<>();
            for (Code kernel : space.kernels()) {
                kernels.add(code(kernel, space.base()));
            }
            return new ForkedSpace(space(space.base()), seed, kernels, space.companions(), space.mark());
        }

        @Override
        public Space visitAttach(AttachSpace space) {
            Space seed = space(space.seed(), space.base());
            List<Joint> images = new ArrayList<>();
            for (Joint joint : space.images()) {
                images.add(new Joint(code(joint.lop(), space.base()), code(joint.rop(), space.seed())));
            }
            return new AttachSpace(space(space.base()), seed, images, space.companions(), space.mark());
        }

        @Override
        public Space visitFiltered(FilteredSpace space) {
            if (space.prune(mask).equals(space.base().prune(mask))) {
                return space(space.base());
            }
            Code filter = space.base().dominates(mask)
                    ? code(space.filter())
                    : code(space.filter(), space.base());
            return new FilteredSpace(space(space.base()), filter, space.mark());
        }

        @Override
        public Space visitOrdered(OrderedSpace space) {
            if (space.prune(mask).equals(space.base().prune(mask))) {
                return space(space.base());
            }
            boolean dominated = space.base().dominates(mask);
            List<Ordering> order = new ArrayList<>();
            for (Ordering ordering : space.order()) {
                Code code = dominated ? code(ordering.code()) : code(ordering.code(), space.base());
                order.add(ordering.withCode(code));
            }
            Space base = space.isExpanding() ? space(space.base()) : space(space.base(), root);
            return new OrderedSpace(base, order, space.limit(), space.offset(), space.mark());
        }

        @Override
        public Code visitLiteral(LiteralCode code) {
            return code;
        }

        @Override
        public Code visitParameter(ParameterCode code) {
            return code;
        }

        @Override
        public Code visitCast(CastCode code) {
            return code.withBase(code(code.base()));
        }

        @Override
        public Code visitFormula(FormulaCode code) {
            return code.withArguments(codes(code.arguments()));
        }

        @Override
        public Code visitCorrelation(CorrelationCode code) {
            return new CorrelationCode(code(code.code()), code.mark());
        }

        /**
         * Moves a column across one-to-one direct joins when the column is
         * the join target: the value is then available from the origin.
         */
        @Override
        public Code visitColumn(ColumnUnit unit) {
            Space space = space(unit.space());
            ColumnEntity column = unit.column();
            while (space instanceof FiberTableSpace fiber && fiber.join() instanceof DirectJoin join
                    && fiber.isExpanding() && fiber.isContracting()) {
                int index = join.targetColumns().indexOf(column);
                if (index < 0) {
                    break;
                }
                space = fiber.base();
                column = join.originColumns().get(index);
            }
            return unit.withColumn(column, space);
        }

        @Override
        public Code visitScalar(ScalarUnit unit) {
            if (unit.space().dominates(mask)) {
                return code(unit.code());
            }
            if (unit.code() instanceof Unit inner && unit.space().dominates(inner.space())) {
                return code(unit.code());
            }
            Code code = code(unit.code(), unit.space());
            return new ScalarUnit(code, space(unit.space()), unit.mark());
        }

        @Override
        public Code visitAggregate(AggregateUnit unit) {
            return aggregate(unit);
        }

        @Override
        public Code visitCorrelated(CorrelatedUnit unit) {
            return aggregate(unit);
        }

        private Code aggregate(AggregateUnitBase unit) {
            Code code = code(unit.code(), unit.pluralSpace());
            Space plural = unit.space().dominates(mask)
                    ? space(unit.pluralSpace())
                    : space(unit.pluralSpace(), unit.space());
            return unit.withSpaces(code, plural, space(unit.space()));
        }

        @Override
        public Code visitKernel(KernelUnit unit) {
            int index = kernelIndex(unit);
            Space space = space(unit.space());
            return new KernelUnit(((QuotientFamily) space.family()).kernels().get(index), space, unit.mark());
        }

        @Override
        public Code visitComplement(ComplementUnit unit) {
            Code code = code(unit.code(), unit.covering().seed());
            return new ComplementUnit(code, space(unit.space()), unit.mark());
        }
    }
}
