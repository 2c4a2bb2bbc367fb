// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.expansion;

import java.math.BigInteger;
import java.util.Objects;

import sh.padic.core.error.InvalidInputException;
import sh.padic.core.error.InvalidPrimeException;
import sh.padic.primitives.Rational;

/**
 * Factors the exact power of p out of a non-zero rational.
 *
 * <p>Zero has no finite valuation; callers special-case it before extraction.
 *
 * @since 0.1.0
 */
public final class ValuationExtractor {

    private ValuationExtractor() {
        // Utility class
    }

    public static Valuation extract(final Rational value, final int prime) {
        Objects.requireNonNull(value, "value");
        return extract(value.numerator(), value.denominator(), prime);
    }

    /**
     * Divides p out of the numerator (raising the valuation) and out of the
     * denominator (lowering it) until neither is divisible.
     *
     * <p>The inputs need not be in lowest terms. A negative denominator moves its
     * sign to the numerator.
     *
     * @param numerator   non-zero numerator
     * @param denominator non-zero denominator
     * @param prime       the base; its primality is the caller's concern
     * @return the valuation and the p-free remainder
     * @throws InvalidInputException if the denominator or the numerator is zero
     * @throws InvalidPrimeException if {@code prime < 2}
     */
    public static Valuation extract(final BigInteger numerator, final BigInteger denominator, final int prime) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (prime < 2) {
            throw new InvalidPrimeException(prime);
        }
        if (denominator.signum() == 0) {
            throw new InvalidInputException("Denominator must not be zero");
        }
        if (numerator.signum() == 0) {
            throw new InvalidInputException("Zero has no finite valuation");
        }

        final BigInteger p = BigInteger.valueOf(prime);
        BigInteger num = denominator.signum() < 0 ? numerator.negate() : numerator;
        BigInteger den = denominator.abs();
        int valuation = 0;

        BigInteger[] qr = num.divideAndRemainder(p);
        while (qr[1].signum() == 0) {
            num = qr[0];
            valuation++;
            qr = num.divideAndRemainder(p);
        }

        qr = den.divideAndRemainder(p);
        while (qr[1].signum() == 0) {
            den = qr[0];
            valuation--;
            qr = den.divideAndRemainder(p);
        }

        return new Valuation(valuation, num, den);
    }
}
