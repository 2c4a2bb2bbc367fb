// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.padic.core.error.InvalidPrecisionException;
import sh.padic.core.error.InvalidPrimeException;
import sh.padic.primitives.Rational;

class PAdicInputTest {

    @Test
    void factoriesPickTheVariant() {
        assertInstanceOf(PAdicInput.OfInteger.class, PAdicInput.of(42));
        assertInstanceOf(PAdicInput.OfInteger.class, PAdicInput.of(BigInteger.TEN));
        assertInstanceOf(PAdicInput.OfRational.class, PAdicInput.of(Rational.of(1, 3)));
        assertInstanceOf(PAdicInput.OfPAdic.class, PAdicInput.of(PAdicNumber.of(1, 5)));
    }

    @Test
    void integerInputMatchesDirectConstruction() {
        assertEquals(PAdicNumber.of(-42, 5), PAdicNumber.of(PAdicInput.of(-42), 5, 20));
    }

    @Test
    void rationalInputMatchesDirectConstruction() {
        assertEquals(PAdicNumber.of(Rational.of(3, 7), 5, 10),
                PAdicNumber.of(PAdicInput.of(Rational.of(3, 7)), 5, 10));
    }

    @Test
    void pAdicInputCopies() {
        PAdicNumber source = PAdicNumber.of(Rational.of(3, 4), 5);
        PAdicNumber copy = PAdicNumber.of(PAdicInput.of(source), 7, 10);
        assertEquals(7, copy.prime());
        assertEquals(Rational.of(3, 4), copy.toRational());
    }

    @Test
    void conversionValidatesArguments() {
        assertThrows(InvalidPrimeException.class, () -> PAdicNumber.of(PAdicInput.of(1), 4, 10));
        assertThrows(InvalidPrecisionException.class, () -> PAdicNumber.of(PAdicInput.of(1), 5, 0));
    }

    @Test
    void variantsRejectNull() {
        assertThrows(NullPointerException.class, () -> PAdicInput.of((BigInteger) null));
        assertThrows(NullPointerException.class, () -> PAdicInput.of((Rational) null));
        assertThrows(NullPointerException.class, () -> PAdicInput.of((PAdicNumber) null));
        assertThrows(NullPointerException.class, () -> PAdicNumber.of((PAdicInput) null, 5, 10));
    }
}
