package org.navql.engine.compile;

import org.navql.engine.code.AggregateUnit;
import org.navql.engine.code.Code;
import org.navql.engine.code.ColumnUnit;
import org.navql.engine.code.ComplementUnit;
import org.navql.engine.code.CorrelatedUnit;
import org.navql.engine.code.CorrelationCode;
import org.navql.engine.code.FormulaCode;
import org.navql.engine.code.Joint;
import org.navql.engine.code.KernelUnit;
import org.navql.engine.code.LiteralCode;
import org.navql.engine.code.Ordering;
import org.navql.engine.code.ScalarUnit;
import org.navql.engine.code.SegmentExpr;
import org.navql.engine.code.Unit;
import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.error.CompileException;
import org.navql.engine.error.Mark;
import org.navql.engine.signature.AndSig;
import org.navql.engine.signature.IsEqualSig;
import org.navql.engine.signature.IsNullSig;
import org.navql.engine.space.AttachSpace;
import org.navql.engine.space.ComplementSpace;
import org.navql.engine.space.CoveringSpace;
import org.navql.engine.space.DirectTableSpace;
import org.navql.engine.space.FiberTableSpace;
import org.navql.engine.space.FilteredSpace;
import org.navql.engine.space.ForkedSpace;
import org.navql.engine.space.MonikerSpace;
import org.navql.engine.space.OrderedSpace;
import org.navql.engine.space.QuotientSpace;
import org.navql.engine.space.RootSpace;
import org.navql.engine.space.ScalarSpace;
import org.navql.engine.space.Space;
import org.navql.engine.space.SpaceVisitor;
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
import org.navql.engine.term.WrapperTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates a rewritten segment into a tree of relational terms.
 *
 * <p>A space is compiled relative to a <em>baseline</em>: an inflated
 * ancestor of the space where the compiled term starts. Axes below the
 * baseline are not produced by the term and must be attached by the caller
 * using the joints returned by {@link Stitcher#tie}.
 *
 * <p>Units are added to a term by <em>injecting</em> them: each unit that
 * the term cannot already evaluate is compiled as a separate term (a
 * <em>shoot</em>) and joined to the term (the <em>trunk</em>).
 *
 * <p>A compiler instance is not thread-safe but may be reused.
 */
public final class Compiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final Deque<Space> baselines = new ArrayDeque<>();
    private int nextTag;
    private Space root;
    private Space baseline;

    public SegmentTerm compile(SegmentExpr segment) {
        nextTag = 1;
        root = segment.root();
        baseline = root;
        try {
            SegmentTerm term = compileSegment(segment);
            LOG.debug("Compiled segment into term #{} ({} terms)", term.tag(), nextTag - 1);
            return term;
        } finally {
            baselines.clear();
            root = null;
            baseline = null;
        }
    }

    private SegmentTerm compileSegment(SegmentExpr segment) {
        Space space = segment.space();
        List<Ordering> order = new ArrayList<>();
        Set<Code> duplicates = new LinkedHashSet<>();
        for (Space chain : List.of(segment.root(), space)) {
            for (Ordering ordering : Stitcher.arrange(chain)) {
                if (duplicates.add(ordering.code())) {
                    order.add(ordering);
                }
            }
        }
        List<Code> codes = new ArrayList<>(segment.codes());
        for (Ordering ordering : order) {
            codes.add(ordering.code());
        }
        Term kid = compile(space, root);
        kid = inject(kid, codes);
        if (!order.isEmpty()) {
            kid = new OrderTerm(tag(), kid, order, null, null, kid.space(), kid.baseline(), kid.routes());
        }
        return new SegmentTerm(tag(), kid, segment.codes(), kid.space(), kid.baseline(), kid.routes());
    }

    private int tag() {
        return nextTag++;
    }

    private Term compile(Space space, Space baseline) {
        baselines.push(this.baseline);
        this.baseline = baseline;
        try {
            return compile(space);
        } finally {
            this.baseline = baselines.pop();
        }
    }

    private Term compile(Space space) {
        if (!space.concludes(baseline)) {
            throw new IllegalStateException("Space " + space + " does not conclude the baseline " + baseline);
        }
        return space.accept(new CompileSpace(space));
    }

    /**
     * Compiles a space to be joined to a trunk: the baseline is the first
     * inflated ancestor not spanned by the trunk.
     */
    private Term compileShoot(Space space, Space trunk, List<? extends Code> codes) {
        Space shootBaseline = space;
        while (!shootBaseline.isInflated()) {
            shootBaseline = shootBaseline.base();
        }
        if (!trunk.spans(shootBaseline)) {
            while (!trunk.spans(shootBaseline.base())) {
                shootBaseline = shootBaseline.base();
            }
        }
        Term term = compile(space, shootBaseline);
        if (codes != null) {
            term = inject(term, codes);
        }
        return term;
    }

    /**
     * Joints attaching a shoot to a trunk.
     */
    private List<Joint> glueSpaces(Space space, Space baseline, Space shoot, Space shootBaseline) {
        Space backbone = space.inflate();
        Space shootBackbone = shoot.inflate();
        List<Joint> joints = new ArrayList<>();
        if (backbone.concludes(shootBaseline)) {
            Space axis = backbone;
            while (!shootBackbone.concludes(axis)) {
                axis = axis.base();
            }
            List<Space> axes = new ArrayList<>();
            while (!axis.equals(shootBaseline.base())) {
                if (!axis.isContracting() || axis.equals(shootBaseline)) {
                    axes.add(axis);
                }
                axis = axis.base();
            }
            Collections.reverse(axes);
            for (Space sewn : axes) {
                joints.addAll(Stitcher.sew(sewn));
            }
            return joints;
        }
        joints = Stitcher.tie(shootBaseline);
        Space origin = shootBaseline.base();
        if (baseline.concludes(origin) && !baseline.equals(origin)) {
            Space axis = baseline;
            while (!axis.base().equals(origin)) {
                axis = axis.base();
            }
            List<Joint> trunkJoints = Stitcher.tie(axis);
            boolean parallel = trunkJoints.size() == joints.size();
            for (int i = 0; parallel && i < joints.size(); i++) {
                parallel = trunkJoints.get(i).lop().equals(joints.get(i).lop());
            }
            if (parallel) {
                List<Joint> shortcut = new ArrayList<>();
                for (int i = 0; i < joints.size(); i++) {
                    shortcut.add(new Joint(trunkJoints.get(i).rop(), joints.get(i).rop()));
                }
                joints = shortcut;
            }
        }
        return joints;
    }

    private List<Joint> glueTerms(Term trunk, Term shoot) {
        return glueSpaces(trunk.space(), trunk.baseline(), shoot.space(), shoot.baseline());
    }

    private Term injectJoints(Term term, List<Joint> joints) {
        List<Code> codes = new ArrayList<>();
        for (Joint joint : joints) {
            codes.add(joint.lop());
        }
        return inject(term, codes);
    }

    private Term joinTerms(Term trunk, Term shoot, Map<Unit, Integer> extraRoutes) {
        List<Joint> joints = glueTerms(trunk, shoot);
        trunk = injectJoints(trunk, joints);
        Space space = trunk.space();
        while (!shoot.space().spans(space)) {
            space = space.base();
        }
        boolean isLeft = !shoot.space().dominates(space);
        Map<Unit, Integer> routes = new LinkedHashMap<>(trunk.routes());
        routes.putAll(extraRoutes);
        return new JoinTerm(tag(), trunk, shoot, joints, isLeft, false, trunk.space(), trunk.baseline(), routes);
    }

    private static Integer route(Map<Unit, Integer> routes, Unit unit) {
        Integer target = routes.get(unit);
        if (target == null) {
            throw new IllegalStateException("No route for " + unit);
        }
        return target;
    }

    /**
     * Copies routes for the units of a space from the equivalent units of
     * its backbone.
     */
    private static Map<Unit, Integer> rebase(Map<Unit, Integer> routes, Space space) {
        Map<Unit, Integer> rebased = new LinkedHashMap<>(routes);
        Space backbone = space.inflate();
        for (Unit unit : Stitcher.spread(space)) {
            rebased.put(unit, route(routes, unit.withSpace(backbone)));
        }
        return rebased;
    }

    private static Code notNull(List<Code> codes, Mark mark) {
        BooleanDomain bool = new BooleanDomain();
        List<Code> filters = new ArrayList<>();
        for (Code code : codes) {
            filters.add(new FormulaCode(new IsNullSig(-1), bool, code.mark(), code));
        }
        return filters.size() == 1 ? filters.get(0) : new FormulaCode(new AndSig(), bool, filters, mark);
    }

    private static Space inflatedGround(Space ground) {
        Space baseline = ground;
        while (!baseline.isInflated()) {
            baseline = baseline.base();
        }
        return baseline;
    }

    private final class CompileSpace implements SpaceVisitor<Term> {

        private final Space space;
        private final Space backbone;

        CompileSpace(Space space) {
            this.space = space;
            this.backbone = space.inflate();
        }

        @Override
        public Term visitRoot(RootSpace space) {
            return scalar();
        }

        @Override
        public Term visitScalar(ScalarSpace space) {
            return scalar();
        }

        private Term scalar() {
            if (space.equals(baseline)) {
                return new ScalarTerm(tag(), space, space);
            }
            Term term = compile(space.base());
            return new WrapperTerm(tag(), term, space, term.baseline(), term.routes());
        }

        @Override
        public Term visitDirectTable(DirectTableSpace space) {
            return table();
        }

        @Override
        public Term visitFiberTable(FiberTableSpace space) {
            return table();
        }

        private Term table() {
            if (space.equals(baseline)) {
                int tag = tag();
                Map<Unit, Integer> routes = new LinkedHashMap<>();
                for (Unit unit : Stitcher.spread(space)) {
                    routes.put(unit, tag);
                }
                return new TableTerm(tag, space, baseline, routes);
            }
            Term term = compile(space.base());
            if (space.conforms(term.space())
                    && term.routes().keySet().containsAll(Stitcher.spread(backbone))) {
                return new WrapperTerm(tag(), term, space, term.baseline(), rebase(term.routes(), space));
            }
            Term rkid = compile(backbone, backbone);
            List<Joint> joints = Stitcher.tie(space);
            Map<Unit, Integer> routes = new LinkedHashMap<>(term.routes());
            routes.putAll(rkid.routes());
            return new JoinTerm(tag(), term, rkid, joints, false, false, space, term.baseline(),
                    rebase(routes, space));
        }

        @Override
        public Term visitQuotient(QuotientSpace space) {
            Term seedTerm = compile(space.seed(), inflatedGround(space.ground()));
            if (!space.kernels().isEmpty()) {
                seedTerm = inject(seedTerm, space.kernels());
                seedTerm = new FilterTerm(tag(), seedTerm, notNull(space.kernels(), space.mark()),
                        seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
            }
            seedTerm = new WrapperTerm(tag(), seedTerm, seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
            boolean isRegular = seedTerm.baseline().equals(space.ground());
            Term trunkTerm = null;
            List<Code> basis = new ArrayList<>();
            List<Unit> units = new ArrayList<>();
            List<Joint> joints = new ArrayList<>();
            if (isRegular) {
                if (!space.equals(baseline)) {
                    trunkTerm = compile(space.base());
                    joints = Stitcher.tie(space);
                }
            } else {
                Space trunkBaseline = baseline.equals(space) ? baseline.base() : baseline;
                trunkTerm = compile(space.base(), trunkBaseline);
                for (Joint joint : glueTerms(trunkTerm, seedTerm)) {
                    basis.add(joint.rop());
                    Unit unit = new KernelUnit(joint.rop(), backbone, joint.rop().mark());
                    units.add(unit);
                    joints.add(joint.withRop(unit));
                }
            }
            for (Joint joint : Stitcher.tie(space.ground())) {
                basis.add(joint.rop());
                units.add(new KernelUnit(joint.rop(), backbone, joint.rop().mark()));
            }
            for (Code kernel : space.kernels()) {
                basis.add(kernel);
                units.add(new KernelUnit(kernel, backbone, kernel.mark()));
            }
            if (space.kernels().stream().allMatch(kernel -> kernel.units().isEmpty())) {
                Unit permanent = new ScalarUnit(new LiteralCode(true, new BooleanDomain(), space.mark()),
                        space.seed(), space.mark());
                basis.add(permanent);
                Map<Unit, Integer> routes = new LinkedHashMap<>(seedTerm.routes());
                routes.put(permanent, seedTerm.tag());
                seedTerm = new PermanentTerm(tag(), seedTerm, seedTerm.space(), seedTerm.baseline(), routes);
            }
            int tag = tag();
            Map<Unit, Integer> routes = new LinkedHashMap<>();
            for (Unit unit : units) {
                routes.put(unit, tag);
            }
            Term term = new ProjectionTerm(tag, seedTerm, basis, backbone, backbone, routes);
            if (trunkTerm == null) {
                return term;
            }
            Term lkid = injectJoints(trunkTerm, joints);
            routes = new LinkedHashMap<>(lkid.routes());
            routes.putAll(term.routes());
            for (Unit unit : units) {
                routes.put(unit.withSpace(space), term.tag());
            }
            return new JoinTerm(tag(), lkid, term, joints, false, false, space, lkid.baseline(), routes);
        }

        @Override
        public Term visitComplement(ComplementSpace space) {
            List<Code> codes = new ArrayList<>(space.kernels());
            codes.addAll(space.companions());
            Term seedTerm = compile(space.seed(), inflatedGround(space.ground()));
            seedTerm = inject(seedTerm, codes);
            boolean isRegular = seedTerm.baseline().equals(space.ground());
            boolean hasQuotient = (!baseline.equals(space) || !isRegular)
                    && space.base() instanceof QuotientSpace;
            if (hasQuotient && !space.kernels().isEmpty()) {
                seedTerm = new FilterTerm(tag(), seedTerm, notNull(space.kernels(), space.mark()),
                        seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
            }
            seedTerm = new WrapperTerm(tag(), seedTerm, seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
            Term trunkTerm = null;
            List<Unit> coveringUnits = new ArrayList<>();
            List<Unit> quotientUnits = new ArrayList<>();
            List<Joint> joints = new ArrayList<>();
            Space axis = hasQuotient ? space.base().base() : space.base();
            Space trunkBaseline = baseline;
            if (!isRegular) {
                while (!axis.concludes(trunkBaseline)) {
                    trunkBaseline = trunkBaseline.base();
                }
            }
            if (axis.concludes(trunkBaseline)) {
                trunkTerm = compile(axis, trunkBaseline);
                if (!isRegular) {
                    for (Joint joint : glueTerms(trunkTerm, seedTerm)) {
                        Unit unit = new ComplementUnit(joint.rop(), backbone, joint.rop().mark());
                        joints.add(joint.withRop(unit));
                        coveringUnits.add(unit);
                    }
                }
                joints.addAll(Stitcher.tie(hasQuotient ? space.base() : space));
            }
            if (hasQuotient) {
                quotientUnits.addAll(Stitcher.spread(space.base().inflate()));
            }
            for (Unit unit : seedTerm.routes().keySet()) {
                coveringUnits.add(new ComplementUnit(unit, backbone, unit.mark()));
            }
            for (Joint joint : Stitcher.tie(space.ground())) {
                coveringUnits.add(new ComplementUnit(joint.rop(), backbone, joint.rop().mark()));
            }
            for (Code code : codes) {
                coveringUnits.add(new ComplementUnit(code, backbone, code.mark()));
            }
            Map<Unit, Integer> routes = new LinkedHashMap<>();
            for (Unit unit : quotientUnits) {
                routes.put(unit, seedTerm.tag());
            }
            for (Unit unit : coveringUnits) {
                routes.put(unit, seedTerm.tag());
            }
            for (Unit unit : Stitcher.spread(space.seed())) {
                routes.put(unit.withSpace(backbone), route(seedTerm.routes(), unit));
            }
            Space termBaseline = hasQuotient ? backbone.base() : backbone;
            Term term = new WrapperTerm(tag(), seedTerm, backbone, termBaseline, routes);
            if (trunkTerm == null) {
                return term;
            }
            Term lkid = injectJoints(trunkTerm, joints);
            routes = new LinkedHashMap<>(lkid.routes());
            routes.putAll(term.routes());
            for (Unit unit : quotientUnits) {
                routes.put(unit.withSpace(space.base()), seedTerm.tag());
            }
            for (Unit unit : coveringUnits) {
                routes.put(unit.withSpace(space), seedTerm.tag());
            }
            for (Unit unit : Stitcher.spread(space.seed())) {
                routes.put(unit.withSpace(space), route(seedTerm.routes(), unit));
            }
            return new JoinTerm(tag(), lkid, term, joints, false, false, space, lkid.baseline(), routes);
        }

        @Override
        public Term visitMoniker(MonikerSpace space) {
            return covering(space, List.of());
        }

        @Override
        public Term visitForked(ForkedSpace space) {
            return covering(space, space.kernels());
        }

        @Override
        public Term visitAttach(AttachSpace space) {
            List<Code> images = new ArrayList<>();
            for (Joint image : space.images()) {
                images.add(image.rop());
            }
            return covering(space, images);
        }

        private Term covering(CoveringSpace space, List<Code> extra) {
            Term seedTerm = compile(space.seed(), inflatedGround(space.ground()));
            List<Code> codes = new ArrayList<>(extra);
            codes.addAll(space.companions());
            seedTerm = inject(seedTerm, codes);
            boolean isRegular = seedTerm.baseline().equals(space.ground());
            seedTerm = new WrapperTerm(tag(), seedTerm, seedTerm.space(), seedTerm.baseline(), seedTerm.routes());
            Term trunkTerm = null;
            List<Joint> joints = new ArrayList<>();
            if (isRegular) {
                if (!baseline.equals(space)) {
                    trunkTerm = compile(space.base());
                }
                joints.addAll(Stitcher.tie(space));
            } else {
                Space trunkBaseline = baseline.equals(space) ? baseline.base() : baseline;
                trunkTerm = compile(space.base(), trunkBaseline);
                List<Joint> seedJoints = space instanceof ForkedSpace
                        ? glueSpaces(trunkTerm.space(), trunkTerm.baseline(), space.ground().base(),
                                seedTerm.baseline())
                        : glueTerms(trunkTerm, seedTerm);
                for (Joint joint : seedJoints) {
                    joints.add(joint.withRop(new ComplementUnit(joint.rop(), backbone, joint.rop().mark())));
                }
                joints.addAll(Stitcher.tie(space));
            }
            List<Unit> units = new ArrayList<>();
            for (Unit unit : seedTerm.routes().keySet()) {
                units.add(new ComplementUnit(unit, backbone, unit.mark()));
            }
            for (Joint joint : joints) {
                units.add((Unit) joint.rop());
            }
            for (Code code : codes) {
                units.add(new ComplementUnit(code, backbone, code.mark()));
            }
            Map<Unit, Integer> routes = new LinkedHashMap<>();
            for (Unit unit : units) {
                routes.put(unit, seedTerm.tag());
            }
            for (Unit unit : Stitcher.spread(space.seed())) {
                routes.put(unit.withSpace(backbone), route(seedTerm.routes(), unit));
            }
            Term term = new WrapperTerm(tag(), seedTerm, backbone, backbone, routes);
            if (trunkTerm == null) {
                return term;
            }
            Term lkid = injectJoints(trunkTerm, joints);
            routes = new LinkedHashMap<>(lkid.routes());
            routes.putAll(term.routes());
            for (Unit unit : units) {
                routes.put(unit.withSpace(space), seedTerm.tag());
            }
            for (Unit unit : Stitcher.spread(space.seed())) {
                routes.put(unit.withSpace(space), route(seedTerm.routes(), unit));
            }
            return new JoinTerm(tag(), lkid, term, joints, false, false, space, lkid.baseline(), routes);
        }

        @Override
        public Term visitFiltered(FilteredSpace space) {
            Term kid = inject(compile(space.base()), List.of(space.filter()));
            return new FilterTerm(tag(), kid, space.filter(), space, kid.baseline(), rebase(kid.routes(), space));
        }

        @Override
        public Term visitOrdered(OrderedSpace space) {
            if (space.isExpanding()) {
                Term term = compile(space.base());
                return new WrapperTerm(tag(), term, space, term.baseline(), rebase(term.routes(), space));
            }
            List<Ordering> order = Stitcher.arrange(space);
            List<Code> codes = new ArrayList<>();
            for (Ordering ordering : order) {
                codes.add(ordering.code());
            }
            Term kid = compile(space.base(), root);
            kid = inject(kid, codes);
            return new OrderTerm(tag(), kid, order, space.limit(), space.offset(), space, kid.baseline(),
                    rebase(kid.routes(), space));
        }
    }

    private Term inject(Term term, List<? extends Code> codes) {
        for (Code code : codes) {
            for (Unit unit : code.units()) {
                if (!term.routes().containsKey(unit)) {
                    term = injectUnit(term, unit);
                }
            }
        }
        return term;
    }

    private Term injectSpace(Term term, Space space) {
        if (term.routes().keySet().containsAll(Stitcher.spread(space))) {
            return term;
        }
        if (term.space().concludes(space)) {
            Term lkid = compile(term.baseline().base(), space);
            List<Joint> joints = Stitcher.tie(term.baseline());
            lkid = injectJoints(lkid, joints);
            Map<Unit, Integer> routes = new LinkedHashMap<>(lkid.routes());
            routes.putAll(term.routes());
            return new JoinTerm(tag(), lkid, term, joints, false, false, term.space(), lkid.baseline(), routes);
        }
        Term shoot = compileShoot(space, term.space(), null);
        Map<Unit, Integer> extraRoutes = new LinkedHashMap<>();
        for (Unit unit : Stitcher.spread(space)) {
            extraRoutes.put(unit, route(shoot.routes(), unit));
        }
        return joinTerms(term, shoot, extraRoutes);
    }

    private Term injectUnit(Term term, Unit unit) {
        if (!term.space().spans(unit.space())) {
            throw new CompileException("a singular expression is expected", unit.mark());
        }
        if (unit instanceof ColumnUnit) {
            return injectSpace(term, unit.space());
        }
        if (unit instanceof ScalarUnit scalar) {
            return injectScalar(term, scalar);
        }
        if (unit instanceof AggregateUnit aggregate) {
            return injectAggregate(term, aggregate);
        }
        if (unit instanceof CorrelatedUnit correlated) {
            return injectCorrelated(term, correlated);
        }
        if (unit instanceof KernelUnit) {
            Term injected = injectSpace(term, unit.space());
            route(injected.routes(), unit);
            return injected;
        }
        if (unit instanceof ComplementUnit complement) {
            return injectComplement(term, complement);
        }
        throw new IllegalStateException("Unexpected unit: " + unit);
    }

    private Term injectScalar(Term term, ScalarUnit unit) {
        List<Code> codes = List.of(unit.code());
        if (unit.space().dominates(term.space())) {
            Term kid = inject(term, codes);
            int tag = tag();
            Map<Unit, Integer> routes = new LinkedHashMap<>(kid.routes());
            routes.put(unit, tag);
            return new WrapperTerm(tag, kid, kid.space(), kid.baseline(), routes);
        }
        Term unitTerm = compileShoot(unit.space(), term.space(), codes);
        if (unitTerm.isNullary()) {
            unitTerm = new WrapperTerm(tag(), unitTerm, unitTerm.space(), unitTerm.baseline(), unitTerm.routes());
        }
        return joinTerms(term, unitTerm, Map.of(unit, unitTerm.tag()));
    }

    private Term injectAggregate(Term term, AggregateUnit unit) {
        Space space = unit.space();
        List<Code> codes = List.of(unit.code());
        Space unitSpace = term.space();
        boolean isNative = false;
        while (unitSpace != null) {
            if (space.dominates(unitSpace)) {
                isNative = true;
                break;
            }
            unitSpace = unitSpace.base();
        }
        Term unitTerm;
        if (isNative) {
            unitTerm = term;
        } else {
            unitTerm = compileShoot(space, term.space(), null);
            unitSpace = unitTerm.space();
        }
        Space unitBaseline = unitTerm.baseline();
        Term pluralTerm = compileShoot(unit.pluralSpace(), unitSpace, codes);
        List<Joint> unitJoints = glueSpaces(unitSpace, unitBaseline, pluralTerm.space(), pluralTerm.baseline());
        unitTerm = injectJoints(unitTerm, unitJoints);
        List<Code> basis = new ArrayList<>();
        for (Joint joint : unitJoints) {
            basis.add(joint.rop());
        }
        QuotientSpace projected = new QuotientSpace(space.inflate(), unit.pluralSpace(), List.of(), unit.mark());
        int tag = tag();
        List<Joint> joints = new ArrayList<>();
        Map<Unit, Integer> routes = new LinkedHashMap<>();
        for (Joint joint : unitJoints) {
            Unit rop = new KernelUnit(joint.rop(), projected, joint.rop().mark());
            routes.put(rop, tag);
            joints.add(joint.withRop(rop));
        }
        Term projectedTerm = new ProjectionTerm(tag, pluralTerm, basis, projected, projected, routes);
        boolean isLeft = !projected.dominates(unitTerm.space());
        routes = new LinkedHashMap<>(unitTerm.routes());
        routes.put(unit, projectedTerm.tag());
        unitTerm = new JoinTerm(tag(), unitTerm, projectedTerm, joints, isLeft, false,
                unitTerm.space(), unitTerm.baseline(), routes);
        if (isNative) {
            return unitTerm;
        }
        return joinTerms(term, unitTerm, Map.of(unit, projectedTerm.tag()));
    }

    private Term injectCorrelated(Term term, CorrelatedUnit unit) {
        boolean isNative = unit.space().dominates(term.space());
        Term unitTerm = isNative ? term : compileShoot(unit.space(), term.space(), null);
        Term pluralTerm = compileShoot(unit.pluralSpace(), unitTerm.space(), List.of(unit.code()));
        List<Joint> joints = glueTerms(unitTerm, pluralTerm);
        unitTerm = injectJoints(unitTerm, joints);
        BooleanDomain bool = new BooleanDomain();
        List<Code> correlations = new ArrayList<>();
        List<Code> filters = new ArrayList<>();
        for (Joint joint : joints) {
            correlations.add(joint.lop());
            Code lop = new CorrelationCode(joint.lop(), joint.lop().mark());
            filters.add(new FormulaCode(new IsEqualSig(1), bool, unit.mark(), lop, joint.rop()));
        }
        if (!filters.isEmpty()) {
            Code filter = filters.size() == 1 ? filters.get(0) : new FormulaCode(new AndSig(), bool, filters, unit.mark());
            pluralTerm = new FilterTerm(tag(), pluralTerm, filter, pluralTerm.space(), pluralTerm.baseline(),
                    pluralTerm.routes());
        }
        pluralTerm = new CorrelationTerm(tag(), pluralTerm, pluralTerm.space(), pluralTerm.baseline(),
                pluralTerm.routes());
        Map<Unit, Integer> routes = new LinkedHashMap<>(unitTerm.routes());
        routes.put(unit, pluralTerm.tag());
        unitTerm = new EmbeddingTerm(tag(), unitTerm, pluralTerm, correlations, unitTerm.space(),
                unitTerm.baseline(), routes);
        if (isNative) {
            return unitTerm;
        }
        return joinTerms(term, unitTerm, Map.of(unit, pluralTerm.tag()));
    }

    /**
     * Injects a value exported by a covering space by compiling the covering
     * with the value added to its companions.
     */
    private Term injectComplement(Term term, ComplementUnit unit) {
        CoveringSpace covering = unit.covering();
        List<Code> companions = new ArrayList<>(covering.companions());
        companions.add(unit.code());
        Space space = withCompanions(unit.space(), companions);
        Term shoot = compileShoot(space, term.space(), null);
        Integer target = shoot.routes().get(unit);
        if (target == null) {
            target = route(shoot.routes(), unit.withSpace(covering));
        }
        return joinTerms(term, shoot, Map.of(unit, target));
    }

    private static Space withCompanions(Space space, List<Code> companions) {
        if (space instanceof CoveringSpace covering) {
            return covering.withCompanions(companions);
        }
        return space.withBase(withCompanions(space.base(), companions));
    }
}
