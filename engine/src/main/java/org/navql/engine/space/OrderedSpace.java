package org.navql.engine.space;

import org.navql.engine.code.Ordering;
import org.navql.engine.error.Mark;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The rows of the base in the given order, optionally sliced by
 * {@code limit} and {@code offset}.
 *
 * <p>A sliced space is not commutative: moving a filter across it changes
 * which rows survive.
 */
public final class OrderedSpace extends Space {

    private final List<Ordering> order;
    private final Long limit;
    private final Long offset;

    public OrderedSpace(Space base, List<Ordering> order, Long limit, Long offset, Mark mark) {
        super(Objects.requireNonNull(base, "Base cannot be null"), base.family(), false, true,
                limit == null && offset == null, mark);
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        }
        this.order = List.copyOf(order);
        this.limit = limit;
        this.offset = offset;
    }

    public List<Ordering> order() {
        return order;
    }

    /**
     * @return The row limit, or null
     */
    public Long limit() {
        return limit;
    }

    /**
     * @return The number of skipped rows, or null
     */
    public Long offset() {
        return offset;
    }

    @Override
    public boolean isCommutative() {
        return limit == null && offset == null;
    }

    @Override
    public Space withBase(Space base) {
        return new OrderedSpace(base, order, limit, offset, mark());
    }

    public OrderedSpace withOrder(List<Ordering> order) {
        return new OrderedSpace(base(), order, limit, offset, mark());
    }

    @Override
    public <T> T accept(SpaceVisitor<T> visitor) {
        return visitor.visitOrdered(this);
    }

    @Override
    protected List<Object> computeBasis() {
        return Arrays.asList(base(), order, limit, offset);
    }

    @Override
    public String toString() {
        String indicator = order.stream().map(Object::toString).collect(Collectors.joining(","));
        if (limit != null || offset != null) {
            indicator += ";" + (offset != null ? offset : "") + ":" + (limit != null ? limit : "");
        }
        return base() + " [" + indicator + "]";
    }
}
