package org.navql.engine.assemble;

import org.navql.engine.code.Unit;

import java.util.Objects;

/**
 * A request for the frame {@code broker} to export, in its select list,
 * the value of {@code unit} computed by the frame {@code target}.
 */
public record Claim(Unit unit, int broker, int target) {

    public Claim {
        Objects.requireNonNull(unit, "Unit cannot be null");
    }

    @Override
    public String toString() {
        return "(" + unit + ")->" + broker + "->" + target;
    }
}
