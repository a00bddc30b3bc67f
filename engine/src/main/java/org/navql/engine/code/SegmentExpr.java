package org.navql.engine.code;

import org.navql.engine.error.Mark;
import org.navql.engine.space.Expression;
import org.navql.engine.space.Space;

import java.util.List;
import java.util.Objects;

/**
 * The top of an encoded query: the codes to output for every row of a space.
 *
 * @see org.navql.engine.compile.Compiler
 */
public final class SegmentExpr extends Expression {

    private final Space root;
    private final Space space;
    private final List<Code> codes;

    public SegmentExpr(Space root, Space space, List<Code> codes, Mark mark) {
        super(mark);
        this.root = Objects.requireNonNull(root, "Root cannot be null");
        this.space = Objects.requireNonNull(space, "Space cannot be null");
        this.codes = List.copyOf(codes);
    }

    public Space root() {
        return root;
    }

    public Space space() {
        return space;
    }

    public List<Code> codes() {
        return codes;
    }

    public SegmentExpr with(Space root, Space space, List<Code> codes) {
        return new SegmentExpr(root, space, codes, mark());
    }

    @Override
    protected List<Object> computeBasis() {
        return List.of(root, space, codes);
    }

    @Override
    public String toString() {
        return space + " " + codes;
    }
}
