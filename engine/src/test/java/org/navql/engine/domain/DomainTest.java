package org.navql.engine.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Domain text conversions")
class DomainTest {

    static Stream<Arguments> values() {
        return Stream.of(
                Arguments.of(new BooleanDomain(), true),
                Arguments.of(new BooleanDomain(), false),
                Arguments.of(new IntegerDomain(), 0L),
                Arguments.of(new IntegerDomain(), -42L),
                Arguments.of(new IntegerDomain(), Long.MAX_VALUE),
                Arguments.of(new DecimalDomain(), new BigDecimal("3.1400")),
                Arguments.of(new FloatDomain(), 6.02e23),
                Arguments.of(new TextDomain(), "O'Brien"),
                Arguments.of(new TextDomain(), ""),
                Arguments.of(new DateDomain(), LocalDate.of(2010, 4, 1)),
                Arguments.of(new TimeDomain(), LocalTime.of(13, 45, 30)),
                Arguments.of(new DateTimeDomain(), LocalDateTime.of(2010, 4, 1, 13, 45, 30)),
                Arguments.of(new EnumDomain(List.of("bs", "ms", "phd")), "ms"),
                Arguments.of(new ListDomain(new TextDomain()), List.of("alpha", "beta"))
        );
    }

    @ParameterizedTest(name = "{0}: {1}")
    @MethodSource("values")
    @DisplayName("parse(dump(v)) gives back v")
    void testRoundTrip(Domain domain, Object value) {
        assertEquals(value, domain.parse(domain.dump(value)));
    }

    @Test
    @DisplayName("null converts to null both ways")
    void testNull() {
        assertNull(new IntegerDomain().dump(null));
        assertNull(new IntegerDomain().parse(null));
    }

    @Test
    @DisplayName("Invalid literals raise DomainException")
    void testInvalidLiteral() {
        assertThrows(DomainException.class, () -> new IntegerDomain().parse("twelve"));
        assertThrows(DomainException.class, () -> new DateDomain().parse("2010-13-45"));
        assertThrows(DomainException.class, () -> new BooleanDomain().parse("yes"));
    }

    @Test
    @DisplayName("Driver values are normalized to the domain representation")
    void testFromDatabase() {
        assertEquals(7L, new IntegerDomain().fromDatabase(7));
        assertEquals(new BigDecimal("2.5"), new DecimalDomain().fromDatabase(2.5));
    }
}
