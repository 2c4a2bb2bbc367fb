// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.expansion;

import java.math.BigInteger;
import java.util.Objects;

import sh.padic.core.error.InvalidInputException;
import sh.padic.core.error.InvalidPrimeException;
import sh.padic.primitives.Rational;

/**
 * Evaluates a base-p digit sequence back into an exact rational.
 *
 * <p>Digits are read lowest power first. Positions past the end of the array
 * are implicit zeros, so a trimmed digit array describes the same value as the
 * zero-padded one.
 *
 * @since 0.1.0
 */
public final class SeriesReconstructor {

    private SeriesReconstructor() {
        // Utility class
    }

    /**
     * Returns {@code sum(digits[i] * p^(valuation + i))}, evaluated with Horner's
     * method from the highest-order digit down.
     *
     * <p>The result is exact for the given digits. It equals the p-adic number the
     * digits were taken from only when that number's expansion is finite; otherwise
     * it is the truncation at {@code p^(valuation + digits.length)}.
     *
     * @throws InvalidInputException if a digit lies outside {@code [0, p)}
     */
    public static Rational reconstruct(final int valuation, final int[] digits, final int prime) {
        Objects.requireNonNull(digits, "digits");
        final BigInteger p = base(prime);
        checkDigits(digits, prime);
        return scale(horner(digits, 0, digits.length, p), valuation, p);
    }

    /**
     * Returns the exact value of an eventually periodic expansion: the digits in
     * {@code [0, periodStart)} followed by the block {@code [periodStart,
     * periodStart + periodLength)} repeated forever.
     *
     * <p>With prefix {@code A} (m digits) and block {@code C} (k digits) the unscaled
     * value is {@code A + p^m * C / (1 - p^k)}. A {@code periodLength} of 0 means the
     * expansion terminates after the prefix.
     *
     * @throws InvalidInputException if a digit lies outside {@code [0, p)} or the bounds are negative
     */
    public static Rational reconstructPeriodic(
            final int valuation, final int[] digits, final int periodStart, final int periodLength, final int prime) {
        Objects.requireNonNull(digits, "digits");
        final BigInteger p = base(prime);
        checkDigits(digits, prime);
        if (periodStart < 0 || periodLength < 0) {
            throw new InvalidInputException(
                    "Invalid period bounds: start=%d length=%d".formatted(periodStart, periodLength));
        }

        final Rational prefix = Rational.of(horner(digits, 0, periodStart, p));
        if (periodLength == 0) {
            return scale(prefix.numerator(), valuation, p);
        }

        final BigInteger block = horner(digits, periodStart, periodStart + periodLength, p);
        final Rational tail = Rational.of(
                block.multiply(p.pow(periodStart)),
                BigInteger.ONE.subtract(p.pow(periodLength)));
        return prefix.add(tail).multiply(power(valuation, p));
    }

    private static BigInteger horner(final int[] digits, final int from, final int to, final BigInteger p) {
        BigInteger acc = BigInteger.ZERO;
        for (int i = to - 1; i >= from; i--) {
            acc = acc.multiply(p);
            if (i < digits.length) {
                acc = acc.add(BigInteger.valueOf(digits[i]));
            }
        }
        return acc;
    }

    private static Rational scale(final BigInteger value, final int valuation, final BigInteger p) {
        return valuation >= 0
                ? Rational.of(value.multiply(p.pow(valuation)))
                : Rational.of(value, p.pow(-valuation));
    }

    private static Rational power(final int exponent, final BigInteger p) {
        return exponent >= 0 ? Rational.of(p.pow(exponent)) : Rational.of(BigInteger.ONE, p.pow(-exponent));
    }

    private static BigInteger base(final int prime) {
        if (prime < 2) {
            throw new InvalidPrimeException(prime);
        }
        return BigInteger.valueOf(prime);
    }

    private static void checkDigits(final int[] digits, final int prime) {
        for (int i = 0; i < digits.length; i++) {
            if (digits[i] < 0 || digits[i] >= prime) {
                throw new InvalidInputException(
                        "Digit %d at position %d is outside [0, %d)".formatted(digits[i], i, prime));
            }
        }
    }
}
