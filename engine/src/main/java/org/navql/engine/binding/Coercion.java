package org.navql.engine.binding;

import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.domain.DecimalDomain;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.FloatDomain;
import org.navql.engine.domain.IntegerDomain;
import org.navql.engine.domain.TextDomain;
import org.navql.engine.domain.UntypedDomain;

/**
 * Finds the common domain of operands.
 */
final class Coercion {

    private Coercion() {
    }

    static boolean isNumeric(Domain domain) {
        return domain instanceof IntegerDomain || domain instanceof DecimalDomain || domain instanceof FloatDomain;
    }

    /**
     * The domain both operands convert to, or null if there is none. Untyped
     * literals adopt the domain of the other operand; numbers widen from
     * integer to decimal to float.
     */
    static Domain unify(Domain left, Domain right) {
        if (left.equals(right)) {
            return left instanceof UntypedDomain ? new TextDomain() : left;
        }
        if (left instanceof UntypedDomain) {
            return right.isScalar() ? right : null;
        }
        if (right instanceof UntypedDomain) {
            return left.isScalar() ? left : null;
        }
        if (isNumeric(left) && isNumeric(right)) {
            return rank(left) >= rank(right) ? left : right;
        }
        return null;
    }

    /**
     * The domain of an untyped value used on its own.
     */
    static Domain settle(Domain domain) {
        return domain instanceof UntypedDomain ? new TextDomain() : domain;
    }

    static boolean isBoolean(Domain domain) {
        return domain instanceof BooleanDomain;
    }

    private static int rank(Domain domain) {
        if (domain instanceof IntegerDomain) {
            return 0;
        }
        if (domain instanceof DecimalDomain) {
            return 1;
        }
        return 2;
    }
}
