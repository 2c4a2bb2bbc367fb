// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.expansion;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import sh.padic.core.error.InvalidInputException;
import sh.padic.core.error.InvalidPrecisionException;
import sh.padic.core.error.InvalidPrimeException;

/**
 * Base-p long division of a rational whose denominator is coprime to p.
 *
 * <p>The running state is {@code a / b} with {@code b} fixed. Each step emits
 * {@code d = a * b^-1 mod p} and continues with {@code (a - d*b) / p}, which is
 * exact because {@code a - d*b} is divisible by p. Since {@code |a|} is
 * eventually bounded by {@code |b|}, the state sequence is eventually periodic;
 * a repeat (or a zero state) is reported so callers can tell an exact expansion
 * from a lossy truncation.
 *
 * @since 0.1.0
 */
public final class DigitExpander {

    private DigitExpander() {
        // Utility class
    }

    /**
     * Expands {@code numerator / denominator} into exactly {@code digitCount} base-p digits.
     *
     * @param numerator   numerator of the value, any sign
     * @param denominator denominator of the value, non-zero and coprime to p
     * @param prime       the base
     * @param digitCount  the digit budget
     * @return the digits and the periodicity observed within the budget
     * @throws InvalidInputException     if the denominator is zero or divisible by p
     * @throws InvalidPrecisionException if {@code digitCount <= 0}
     * @throws InvalidPrimeException     if {@code prime < 2}
     */
    public static Expansion expand(
            final BigInteger numerator, final BigInteger denominator, final int prime, final int digitCount) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (prime < 2) {
            throw new InvalidPrimeException(prime);
        }
        if (digitCount <= 0) {
            throw new InvalidPrecisionException(digitCount);
        }
        if (denominator.signum() == 0) {
            throw new InvalidInputException("Denominator must not be zero");
        }

        final BigInteger p = BigInteger.valueOf(prime);
        final BigInteger residue = denominator.mod(p);
        if (residue.signum() == 0) {
            throw new InvalidInputException(
                    "Denominator %s is divisible by %d; extract the valuation first".formatted(denominator, prime));
        }
        final BigInteger inverse = residue.modInverse(p);

        final int[] digits = new int[digitCount];
        final Map<BigInteger, Integer> seen = new HashMap<>();
        BigInteger state = numerator;

        // One extra pass at i == digitCount inspects the state left after the last digit.
        for (int i = 0; i <= digitCount; i++) {
            if (state.signum() == 0) {
                return new Expansion(digits, Expansion.Kind.TERMINATING, i, 0);
            }
            final Integer first = seen.putIfAbsent(state, i);
            if (first != null) {
                final int period = i - first;
                for (int j = i; j < digitCount; j++) {
                    digits[j] = digits[first + (j - first) % period];
                }
                return new Expansion(digits, Expansion.Kind.PERIODIC, first, period);
            }
            if (i == digitCount) {
                break;
            }
            final int digit = state.mod(p).multiply(inverse).mod(p).intValueExact();
            digits[i] = digit;
            state = state.subtract(denominator.multiply(BigInteger.valueOf(digit))).divide(p);
        }
        return new Expansion(digits, Expansion.Kind.TRUNCATED, 0, 0);
    }

    public static Expansion expand(final Valuation valuation, final int prime, final int digitCount) {
        Objects.requireNonNull(valuation, "valuation");
        return expand(valuation.numerator(), valuation.denominator(), prime, digitCount);
    }
}
