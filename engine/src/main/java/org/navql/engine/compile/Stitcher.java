package org.navql.engine.compile;

import org.navql.engine.code.Code;
import org.navql.engine.code.ColumnUnit;
import org.navql.engine.code.ComplementUnit;
import org.navql.engine.code.Joint;
import org.navql.engine.code.KernelUnit;
import org.navql.engine.code.Ordering;
import org.navql.engine.code.Unit;
import org.navql.engine.entity.ColumnEntity;
import org.navql.engine.entity.TableEntity;
import org.navql.engine.entity.UniqueKey;
import org.navql.engine.error.CompileException;
import org.navql.engine.space.AttachSpace;
import org.navql.engine.space.ComplementSpace;
import org.navql.engine.space.CoveringSpace;
import org.navql.engine.space.FiberTableSpace;
import org.navql.engine.space.ForkedSpace;
import org.navql.engine.space.MonikerSpace;
import org.navql.engine.space.OrderedSpace;
import org.navql.engine.space.QuotientFamily;
import org.navql.engine.space.QuotientSpace;
import org.navql.engine.space.Space;
import org.navql.engine.space.TableSpace;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers telling the compiler how the rows of a space are identified,
 * ordered and attached to their base.
 *
 * <ul>
 *   <li>{@link #arrange}: the ordering of a space. Strong orderings are the
 *       ones requested by the query, weak orderings make the result
 *       deterministic (by primary key for tables);</li>
 *   <li>{@link #spread}: the units a term for the space exports natively;</li>
 *   <li>{@link #sew}: joints connecting a space to a copy of itself;</li>
 *   <li>{@link #tie}: joints connecting a space to its base.</li>
 * </ul>
 */
public final class Stitcher {

    private Stitcher() {
    }

    public static List<Ordering> arrange(Space space) {
        return arrange(space, true, true);
    }

    public static List<Ordering> arrange(Space space, boolean withStrong, boolean withWeak) {
        List<Ordering> order = new ArrayList<>();
        Set<Code> duplicates = new LinkedHashSet<>();
        collect(space, withStrong, withWeak, order, duplicates);
        return order;
    }

    private static void collect(Space space, boolean withStrong, boolean withWeak,
                                List<Ordering> order, Set<Code> duplicates) {
        if (space instanceof OrderedSpace ordered) {
            if (withStrong) {
                collect(ordered.base(), true, false, order, duplicates);
                for (Ordering ordering : ordered.order()) {
                    add(ordering, order, duplicates);
                }
            }
            if (withWeak) {
                collect(ordered.base(), false, true, order, duplicates);
            }
            return;
        }
        if (space.base() != null) {
            collect(space.base(), withStrong, withWeak, order, duplicates);
        }
        if (!withWeak || !space.isAxis()) {
            return;
        }
        if (space instanceof TableSpace table) {
            if (!table.isContracting()) {
                Space inflated = table.inflate();
                for (ColumnEntity column : identity(table.table(), true)) {
                    add(new Ordering(new ColumnUnit(column, inflated, space.mark()), 1), order, duplicates);
                }
            }
        } else if (space instanceof QuotientSpace quotient) {
            Space inflated = quotient.inflate();
            for (Code kernel : quotient.kernels()) {
                add(new Ordering(new KernelUnit(kernel, inflated, kernel.mark()), 1), order, duplicates);
            }
        } else if (space instanceof CoveringSpace covering) {
            Space inflated = covering.inflate();
            Space base = covering.ground().base();
            for (Ordering ordering : arrange(covering.seed())) {
                boolean foreign = base == null || ordering.code().units().stream()
                        .anyMatch(unit -> !base.spans(unit.space()));
                if (foreign) {
                    Code code = new ComplementUnit(ordering.code(), inflated, ordering.code().mark());
                    add(new Ordering(code, ordering.direction()), order, duplicates);
                }
            }
        }
    }

    private static void add(Ordering ordering, List<Ordering> order, Set<Code> duplicates) {
        if (duplicates.add(ordering.code())) {
            order.add(ordering);
        }
    }

    /**
     * Units that a term for the space produces without joining anything.
     */
    public static List<Unit> spread(Space space) {
        if (!space.isAxis()) {
            List<Unit> units = new ArrayList<>();
            for (Unit unit : spread(space.base())) {
                units.add(unit.withSpace(space));
            }
            return units;
        }
        List<Unit> units = new ArrayList<>();
        if (space instanceof TableSpace table) {
            for (ColumnEntity column : table.table().columns()) {
                units.add(new ColumnUnit(column, space, space.mark()));
            }
        } else if (space instanceof QuotientSpace quotient) {
            QuotientFamily family = (QuotientFamily) quotient.family();
            for (Joint joint : tie(family.ground())) {
                units.add(new KernelUnit(joint.rop(), space, space.mark()));
            }
            for (Code kernel : family.kernels()) {
                units.add(new KernelUnit(kernel, space, space.mark()));
            }
        } else if (space instanceof CoveringSpace covering) {
            for (Unit unit : spread(covering.seed().inflate())) {
                units.add(new ComplementUnit(unit, space, space.mark()));
            }
        }
        return units;
    }

    /**
     * Joints matching each row of the space with itself.
     *
     * @throws CompileException if a table lacks a key identifying its rows
     */
    public static List<Joint> sew(Space space) {
        if (!space.isAxis()) {
            return sew(space.base());
        }
        List<Joint> joints = new ArrayList<>();
        if (space instanceof TableSpace table) {
            List<ColumnEntity> columns = identity(table.table(), false);
            if (columns.isEmpty()) {
                throw new CompileException("unable to connect a table lacking a primary key", space.mark(),
                        table.table().qualifiedName());
            }
            Space inflated = space.inflate();
            for (ColumnEntity column : columns) {
                Unit unit = new ColumnUnit(column, inflated, space.mark());
                joints.add(new Joint(unit, unit));
            }
        } else if (space instanceof QuotientSpace quotient) {
            Space inflated = quotient.inflate();
            QuotientFamily family = (QuotientFamily) inflated.family();
            for (Joint joint : tie(family.ground())) {
                Unit unit = new KernelUnit(joint.rop(), inflated, space.mark());
                joints.add(new Joint(unit, unit));
            }
            for (Code kernel : family.kernels()) {
                Unit unit = new KernelUnit(kernel, inflated, space.mark());
                joints.add(new Joint(unit, unit));
            }
        } else if (space instanceof CoveringSpace covering) {
            Space inflated = covering.inflate();
            Space seed = covering.seed().inflate();
            Space baseline = covering.ground().inflate();
            List<Space> axes = new ArrayList<>();
            for (Space axis = seed; axis != null && axis.concludes(baseline); axis = axis.base()) {
                axes.add(0, axis);
            }
            for (Space axis : axes) {
                if (!axis.isContracting() || axis.equals(baseline)) {
                    for (Joint joint : sew(axis)) {
                        Unit unit = new ComplementUnit(joint.lop(), inflated, space.mark());
                        joints.add(new Joint(unit, unit));
                    }
                }
            }
        }
        return joints;
    }

    /**
     * Joints matching each row of the space with its row of the base.
     */
    public static List<Joint> tie(Space space) {
        if (!space.isAxis()) {
            return tie(space.base());
        }
        List<Joint> joints = new ArrayList<>();
        if (space instanceof FiberTableSpace fiber) {
            FiberTableSpace inflated = (FiberTableSpace) fiber.inflate();
            List<ColumnEntity> origin = inflated.join().originColumns();
            List<ColumnEntity> target = inflated.join().targetColumns();
            for (int i = 0; i < origin.size(); i++) {
                joints.add(new Joint(new ColumnUnit(origin.get(i), inflated.base(), space.mark()),
                        new ColumnUnit(target.get(i), inflated, space.mark())));
            }
        } else if (space instanceof QuotientSpace quotient) {
            Space inflated = quotient.inflate();
            for (Joint joint : tie(((QuotientFamily) inflated.family()).ground())) {
                joints.add(joint.withRop(new KernelUnit(joint.rop(), inflated, space.mark())));
            }
        } else if (space instanceof ComplementSpace complement) {
            ComplementSpace inflated = (ComplementSpace) complement.inflate();
            for (Joint joint : tie(inflated.ground())) {
                Code op = joint.rop();
                joints.add(new Joint(new KernelUnit(op, inflated.base(), space.mark()),
                        new ComplementUnit(op, inflated, space.mark())));
            }
            for (Code kernel : inflated.kernels()) {
                joints.add(new Joint(new KernelUnit(kernel, inflated.base(), space.mark()),
                        new ComplementUnit(kernel, inflated, space.mark())));
            }
        } else if (space instanceof MonikerSpace moniker) {
            Space inflated = moniker.inflate();
            List<Joint> base = inflated.isContracting()
                    ? sew(moniker.ground())
                    : tie(moniker.ground());
            for (Joint joint : base) {
                joints.add(joint.withRop(new ComplementUnit(joint.rop(), inflated, space.mark())));
            }
        } else if (space instanceof ForkedSpace forked) {
            ForkedSpace inflated = (ForkedSpace) forked.inflate();
            for (Joint joint : tie(inflated.seed())) {
                Code lop = joint.rop();
                joints.add(new Joint(lop, new ComplementUnit(lop, inflated, space.mark())));
            }
            for (Code kernel : inflated.kernels()) {
                joints.add(new Joint(kernel, new ComplementUnit(kernel, inflated, space.mark())));
            }
        } else if (space instanceof AttachSpace attach) {
            AttachSpace inflated = (AttachSpace) attach.inflate();
            for (Joint image : inflated.images()) {
                joints.add(new Joint(image.lop(), new ComplementUnit(image.rop(), inflated, space.mark())));
            }
        }
        return joints;
    }

    /**
     * Columns identifying the rows of a table: the primary key, else the
     * first total unique key. With {@code fallback}, all columns when the
     * table has no such key.
     */
    static List<ColumnEntity> identity(TableEntity table, boolean fallback) {
        if (table.primaryKey().isPresent()) {
            return table.primaryKey().get().columns();
        }
        for (UniqueKey key : table.uniqueKeys()) {
            if (!key.isPartial() && key.isTotal()) {
                return key.columns();
            }
        }
        return fallback ? table.columns() : List.of();
    }
}
