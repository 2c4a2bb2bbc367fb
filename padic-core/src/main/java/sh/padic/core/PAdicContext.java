// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core;

import java.math.BigInteger;
import java.util.Objects;

import sh.padic.core.error.InvalidInputException;
import sh.padic.core.error.InvalidPrecisionException;
import sh.padic.core.error.InvalidPrimeException;
import sh.padic.core.series.SeriesFormatter;
import sh.padic.primitives.Primes;
import sh.padic.primitives.Rational;

/**
 * Fixed prime, precision and display width shared by a group of p-adic numbers.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * PAdicContext q5 = PAdicContext.builder(5)
 *         .precision(30)
 *         .showDigits(8)
 *         .build();
 *
 * PAdicNumber x = q5.of(Rational.of(3, 7));
 * String text = q5.format(x);
 * }</pre>
 *
 * <p>
 * {@link #fromSystemProperties(int)} reads {@value #PRECISION_PROPERTY} and
 * {@value #SHOW_DIGITS_PROPERTY}, falling back to the defaults when a property is
 * not set.
 *
 * @param prime      the prime every number in this context uses
 * @param precision  digits kept per number (default {@value PAdicNumber#DEFAULT_PRECISION})
 * @param showDigits digit positions rendered by {@link #format(PAdicNumber)}
 *                   (default {@value PAdicNumber#DEFAULT_SHOW_DIGITS})
 * @since 0.1.0
 */
public record PAdicContext(int prime, int precision, int showDigits) {

    public static final String PRECISION_PROPERTY = "padic.precision";
    public static final String SHOW_DIGITS_PROPERTY = "padic.showDigits";

    public PAdicContext {
        if (!Primes.isPrime(prime)) {
            throw new InvalidPrimeException(prime);
        }
        if (precision <= 0) {
            throw new InvalidPrecisionException(precision);
        }
        if (showDigits <= 0) {
            throw new InvalidPrecisionException(showDigits);
        }
    }

    /**
     * Returns a context for {@code prime} with the default precision and display width.
     */
    public static PAdicContext forPrime(final int prime) {
        return builder(prime).build();
    }

    public static Builder builder(final int prime) {
        return new Builder(prime);
    }

    /**
     * Creates a context whose precision and display width come from system properties.
     *
     * @throws InvalidPrecisionException if a property is set but is not an integer
     */
    public static PAdicContext fromSystemProperties(final int prime) {
        return builder(prime)
                .precision(intProperty(PRECISION_PROPERTY, PAdicNumber.DEFAULT_PRECISION))
                .showDigits(intProperty(SHOW_DIGITS_PROPERTY, PAdicNumber.DEFAULT_SHOW_DIGITS))
                .build();
    }

    private static int intProperty(final String name, final int fallback) {
        final String value = System.getProperty(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidPrecisionException("Property " + name + " is not an integer: " + value, e);
        }
    }

    public PAdicNumber of(final long value) {
        return PAdicNumber.of(value, prime, precision);
    }

    public PAdicNumber of(final BigInteger value) {
        return PAdicNumber.of(value, prime, precision);
    }

    public PAdicNumber of(final Rational value) {
        return PAdicNumber.of(value, prime, precision);
    }

    /**
     * @throws InvalidInputException if {@code denominator} is zero
     */
    public PAdicNumber of(final BigInteger numerator, final BigInteger denominator) {
        return PAdicNumber.of(numerator, denominator, prime, precision);
    }

    /**
     * @throws InvalidInputException if the text is not a rational
     * @see PAdicNumber#parseRational(String, int, int)
     */
    public PAdicNumber parseRational(final String text) {
        return PAdicNumber.parseRational(text, prime, precision);
    }

    public PAdicNumber copyOf(final PAdicNumber value) {
        return PAdicNumber.copyOf(value, prime, precision);
    }

    public PAdicNumber zero() {
        return PAdicNumber.zero(prime, precision);
    }

    public PAdicNumber parse(final String text) {
        return PAdicNumber.parse(text, prime, precision);
    }

    public String format(final PAdicNumber value) {
        Objects.requireNonNull(value, "value");
        return SeriesFormatter.format(value, showDigits);
    }

    /**
     * Builder for {@link PAdicContext}.
     */
    public static final class Builder {
        private final int prime;
        private int precision = PAdicNumber.DEFAULT_PRECISION;
        private int showDigits = PAdicNumber.DEFAULT_SHOW_DIGITS;

        private Builder(final int prime) {
            this.prime = prime;
        }

        public Builder precision(final int precision) {
            this.precision = precision;
            return this;
        }

        public Builder showDigits(final int showDigits) {
            this.showDigits = showDigits;
            return this;
        }

        public PAdicContext build() {
            return new PAdicContext(prime, precision, showDigits);
        }
    }
}
