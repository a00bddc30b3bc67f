package org.navql.engine.frame;

import java.util.Objects;

/**
 * An entry of a {@code FROM} list. The leading entry has no condition;
 * the following ones are joins, with a {@code null} condition for a cross
 * join.
 */
public record Anchor(Frame frame, Phrase condition, boolean isLeft, boolean isRight) {

    public Anchor {
        Objects.requireNonNull(frame, "Frame cannot be null");
    }

    public static Anchor leading(Frame frame) {
        return new Anchor(frame, null, false, false);
    }

    public Anchor with(Frame frame, Phrase condition) {
        return new Anchor(frame, condition, isLeft, isRight);
    }

    public boolean isCross() {
        return condition == null && !isLeft && !isRight;
    }
}
