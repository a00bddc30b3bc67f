package org.navql.engine.domain;

/**
 * A scalar type descriptor.
 *
 * <p>Domains are immutable and compared structurally. Each one converts
 * between the textual form of a value and its Java representation:
 * {@code parse(dump(x))} equals {@code x} for every value in range, except
 * for {@link OpaqueDomain}.
 */
public sealed interface Domain permits BooleanDomain, IntegerDomain, FloatDomain, DecimalDomain,
        TextDomain, DateDomain, TimeDomain, DateTimeDomain, EnumDomain, ListDomain, RecordDomain,
        IdentityDomain, OpaqueDomain, UntypedDomain, VoidDomain, EntityDomain {

    /**
     * @return The family name used in messages and profiles
     */
    String family();

    /**
     * Converts text to a value; {@code null} maps to {@code null}.
     *
     * @throws DomainException if the text is not a valid literal
     */
    Object parse(String text);

    /**
     * Converts a value to text; {@code null} maps to {@code null}.
     */
    String dump(Object value);

    /**
     * Normalizes a value produced by a database driver.
     */
    default Object fromDatabase(Object value) {
        return value;
    }

    /**
     * @return true for scalar domains that can appear in a select list
     */
    default boolean isScalar() {
        return true;
    }

    static BooleanDomain bool() {
        return new BooleanDomain();
    }

    static IntegerDomain integer() {
        return new IntegerDomain();
    }

    static TextDomain text() {
        return new TextDomain();
    }

    static UntypedDomain untyped() {
        return new UntypedDomain();
    }
}
