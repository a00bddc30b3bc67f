package org.navql.engine.frame;

/**
 * Where the value of an output column comes from: a position in the
 * select list of the segment frame, or a constant known in advance.
 */
public record SegmentOutput(int index, Object value) {

    public static SegmentOutput extract(int index) {
        return new SegmentOutput(index, null);
    }

    public static SegmentOutput constant(Object value) {
        return new SegmentOutput(-1, value);
    }

    public boolean isConstant() {
        return index < 0;
    }
}
