package org.navql.engine.encode;

import org.navql.engine.binding.CastBinding;
import org.navql.engine.code.CastCode;
import org.navql.engine.code.Code;
import org.navql.engine.code.FormulaCode;
import org.navql.engine.code.LiteralCode;
import org.navql.engine.code.ParameterCode;
import org.navql.engine.code.ScalarUnit;
import org.navql.engine.domain.BooleanDomain;
import org.navql.engine.domain.DateDomain;
import org.navql.engine.domain.DateTimeDomain;
import org.navql.engine.domain.DecimalDomain;
import org.navql.engine.domain.Domain;
import org.navql.engine.domain.DomainException;
import org.navql.engine.domain.EntityDomain;
import org.navql.engine.domain.FloatDomain;
import org.navql.engine.domain.IntegerDomain;
import org.navql.engine.domain.RecordDomain;
import org.navql.engine.domain.TextDomain;
import org.navql.engine.domain.TimeDomain;
import org.navql.engine.domain.UntypedDomain;
import org.navql.engine.error.EncodeException;
import org.navql.engine.error.Mark;
import org.navql.engine.signature.IsNullSig;
import org.navql.engine.signature.NullIfSig;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Encodes an explicit or implicit cast.
 *
 * <p>Untyped values are parsed into the target domain. Conversions to
 * Boolean test for a value being present: an entity converts to true when
 * the row exists, text when it is neither null nor empty, anything else
 * when it is not null. The remaining supported conversions become SQL casts.
 */
final class Conversion {

    private final Encoder encoder;
    private final CastBinding binding;
    private final Domain source;
    private final Domain target;
    private final Mark mark;

    Conversion(Encoder encoder, CastBinding binding) {
        this.encoder = encoder;
        this.binding = binding;
        this.source = binding.base().domain();
        this.target = binding.domain();
        this.mark = binding.mark();
    }

    Code convert() {
        if (source.equals(target)) {
            return encoder.encode(binding.base());
        }
        if (source instanceof UntypedDomain) {
            return fromUntyped();
        }
        if (target instanceof BooleanDomain) {
            return toBoolean();
        }
        if (source instanceof EntityDomain || source instanceof RecordDomain) {
            throw unsupported();
        }
        if (target instanceof TextDomain) {
            return cast();
        }
        if (target instanceof IntegerDomain) {
            if (source instanceof DecimalDomain || source instanceof FloatDomain || source instanceof TextDomain) {
                return cast();
            }
        } else if (target instanceof DecimalDomain) {
            if (source instanceof IntegerDomain || source instanceof FloatDomain || source instanceof TextDomain) {
                return widen();
            }
        } else if (target instanceof FloatDomain) {
            if (source instanceof IntegerDomain || source instanceof DecimalDomain || source instanceof TextDomain) {
                return widen();
            }
        } else if (target instanceof DateDomain || target instanceof TimeDomain) {
            if (source instanceof TextDomain || source instanceof DateTimeDomain) {
                return cast();
            }
        } else if (target instanceof DateTimeDomain) {
            if (source instanceof TextDomain || source instanceof DateDomain) {
                return cast();
            }
        }
        throw unsupported();
    }

    private Code fromUntyped() {
        Code code = encoder.encode(binding.base());
        Deque<ScalarUnit> wrappers = new ArrayDeque<>();
        while (code instanceof ScalarUnit unit) {
            wrappers.push(unit);
            code = unit.code();
        }
        Code converted;
        if (code instanceof LiteralCode literal) {
            converted = new LiteralCode(parse(literal.value()), target, mark);
        } else if (code instanceof ParameterCode parameter) {
            converted = new ParameterCode(parameter.name(), parse(parameter.value()), target, mark);
        } else {
            throw unsupported();
        }
        while (!wrappers.isEmpty()) {
            converted = wrappers.pop().withCode(converted);
        }
        return converted;
    }

    private Object parse(Object value) {
        if (value == null) {
            return null;
        }
        if (!target.isScalar()) {
            throw unsupported();
        }
        try {
            return target.parse(value.toString());
        } catch (DomainException e) {
            throw new EncodeException("cannot convert a value of type " + source.family() + " to "
                    + target.family(), mark, e.getMessage());
        }
    }

    private Code toBoolean() {
        BooleanDomain bool = new BooleanDomain();
        if (source instanceof EntityDomain || source instanceof RecordDomain) {
            Code indicator = new ScalarUnit(new LiteralCode(true, bool, mark), encoder.relate(binding.base()), mark);
            return new FormulaCode(new IsNullSig(-1), bool, mark, indicator);
        }
        Code code = encoder.encode(binding.base());
        if (source instanceof TextDomain) {
            code = new FormulaCode(new NullIfSig(), source, mark, code, new LiteralCode("", source, mark));
        }
        return new FormulaCode(new IsNullSig(-1), bool, mark, code);
    }

    /**
     * A numeric widening, folded when applied to a literal.
     */
    private Code widen() {
        Code code = encoder.encode(binding.base());
        if (code instanceof LiteralCode literal && !(source instanceof TextDomain)) {
            Object value = literal.value();
            if (value == null) {
                return new LiteralCode(null, target, mark);
            }
            if (target instanceof DecimalDomain && !(source instanceof FloatDomain)) {
                return new LiteralCode(new BigDecimal(value.toString()), target, mark);
            }
            if (target instanceof FloatDomain) {
                return new LiteralCode(((Number) value).doubleValue(), target, mark);
            }
        }
        return new CastCode(code, target, mark);
    }

    private Code cast() {
        return new CastCode(encoder.encode(binding.base()), target, mark);
    }

    private EncodeException unsupported() {
        return new EncodeException("cannot convert a value of type " + source.family() + " to "
                + target.family(), mark);
    }
}
