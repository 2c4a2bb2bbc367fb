// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.padic.core.error.InvalidPrecisionException;
import sh.padic.primitives.Rational;

/**
 * Tests for {@link PAdicNumber#isEqualTo} and structural equality.
 */
class PAdicEqualityTest {

    @Test
    void equalValuesAreEqual() {
        PAdicNumber a = PAdicNumber.of(Rational.of(3, 7), 5);
        PAdicNumber b = PAdicNumber.of(Rational.of(6, 14), 5);
        assertTrue(a.isEqualTo(b));
        assertTrue(b.isEqualTo(a));
        assertTrue(a.isEqualTo(a));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    @DisplayName("42 and 542 agree in three 5-adic digits but not in four")
    void agreementWithinPrecision() {
        assertTrue(PAdicNumber.of(42, 5, 3).isEqualTo(PAdicNumber.of(542, 5, 3)));
        assertFalse(PAdicNumber.of(42, 5).isEqualTo(PAdicNumber.of(542, 5)));
        assertTrue(PAdicNumber.of(42, 5).isEqualTo(PAdicNumber.of(542, 5), 3));
        assertFalse(PAdicNumber.of(42, 5).isEqualTo(PAdicNumber.of(542, 5), 4));
    }

    @Test
    @DisplayName("equality up to precision is not transitive")
    void notTransitive() {
        PAdicNumber a = PAdicNumber.of(Rational.of(1, 3), 5);
        PAdicNumber b = PAdicNumber.of(Rational.of(1, 3).add(Rational.of(625)), 5);
        PAdicNumber c = PAdicNumber.ofDigits(5, 0, new int[] {2, 3, 1, 3}, 4);

        assertTrue(a.isEqualTo(c));
        assertTrue(c.isEqualTo(b));
        assertFalse(a.isEqualTo(b));
    }

    @Test
    void trailingZerosDoNotMatter() {
        PAdicNumber stored = PAdicNumber.of(Rational.of(8, 7), 5, 3);
        PAdicNumber written = PAdicNumber.ofDigits(5, 0, new int[] {4, 3, 0}, 3);
        assertTrue(stored.isEqualTo(written));
    }

    @Test
    void differentPrimesAreNeverEqual() {
        assertFalse(PAdicNumber.of(1, 5).isEqualTo(PAdicNumber.of(1, 7)));
        assertFalse(PAdicNumber.zero(5).isEqualTo(PAdicNumber.zero(7)));
    }

    @Test
    void zeroEqualsOnlyZero() {
        assertTrue(PAdicNumber.zero(5, 3).isEqualTo(PAdicNumber.zero(5, 30)));
        assertFalse(PAdicNumber.zero(5).isEqualTo(PAdicNumber.of(25, 5)));
        assertFalse(PAdicNumber.of(25, 5).isEqualTo(PAdicNumber.zero(5)));
    }

    @Test
    void differentValuationsAreNotEqual() {
        assertFalse(PAdicNumber.of(1, 5).isEqualTo(PAdicNumber.of(5, 5)));
    }

    @Test
    void comparisonWindowMustBePositive() {
        assertThrows(InvalidPrecisionException.class,
                () -> PAdicNumber.of(1, 5).isEqualTo(PAdicNumber.of(1, 5), 0));
    }

    @Test
    @DisplayName("structural equality also compares precision")
    void structuralEqualityIsStrict() {
        PAdicNumber short1 = PAdicNumber.of(42, 5, 10);
        PAdicNumber long1 = PAdicNumber.of(42, 5, 20);
        assertTrue(short1.isEqualTo(long1));
        assertNotEquals(short1, long1);
    }
}
