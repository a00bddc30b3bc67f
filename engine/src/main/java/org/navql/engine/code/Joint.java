package org.navql.engine.code;

import java.util.Objects;

/**
 * A pair of codes compared for equality: a join condition, or an image of
 * an attachment.
 */
public record Joint(Code lop, Code rop) {

    public Joint {
        Objects.requireNonNull(lop, "Left operand cannot be null");
        Objects.requireNonNull(rop, "Right operand cannot be null");
    }

    public Joint withLop(Code lop) {
        return new Joint(lop, rop);
    }

    public Joint withRop(Code rop) {
        return new Joint(lop, rop);
    }

    @Override
    public String toString() {
        return lop + " = " + rop;
    }
}
