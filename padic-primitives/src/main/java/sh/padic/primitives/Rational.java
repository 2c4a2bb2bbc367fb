// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.primitives;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Exact rational number with arbitrary-precision numerator and denominator.
 * <p>
 * Instances are always normalized:
 * <ul>
 * <li>numerator and denominator share no common factor</li>
 * <li>the denominator is strictly positive</li>
 * <li>zero is stored as {@code 0/1}</li>
 * </ul>
 * Two rationals are therefore {@link #equals(Object) equal} exactly when they
 * denote the same number.
 * <p>
 * The JSON form is the canonical string, e.g. {@code "-7/25"} or {@code "42"}.
 *
 * @param numerator   the reduced numerator, carries the sign
 * @param denominator the reduced denominator, always positive
 * @since 0.1.0
 */
public record Rational(BigInteger numerator, BigInteger denominator) implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

    public Rational {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.signum() == 0) {
            throw new IllegalArgumentException("denominator must not be zero");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        final BigInteger gcd = numerator.gcd(denominator);
        if (numerator.signum() == 0) {
            denominator = BigInteger.ONE;
        } else if (!gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
    }

    public static Rational of(final long value) {
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(final long numerator, final long denominator) {
        return new Rational(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational of(final BigInteger value) {
        return new Rational(value, BigInteger.ONE);
    }

    public static Rational of(final BigInteger numerator, final BigInteger denominator) {
        return new Rational(numerator, denominator);
    }

    /**
     * Parses {@code "n"} or {@code "n/d"} (optional sign on either part, whitespace
     * around the tokens is ignored).
     *
     * @param text the text to parse
     * @return the parsed rational
     * @throws IllegalArgumentException if the text is malformed or the denominator is zero
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Rational parse(final String text) {
        Objects.requireNonNull(text, "text");
        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty rational");
        }
        final int slash = trimmed.indexOf('/');
        try {
            if (slash < 0) {
                return of(new BigInteger(trimmed));
            }
            final BigInteger num = new BigInteger(trimmed.substring(0, slash).trim());
            final BigInteger den = new BigInteger(trimmed.substring(slash + 1).trim());
            return new Rational(num, den);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid rational: " + text, e);
        }
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    /**
     * @throws ArithmeticException if this rational is zero
     */
    public Rational reciprocal() {
        if (isZero()) {
            throw new ArithmeticException("Zero has no reciprocal");
        }
        return new Rational(denominator, numerator);
    }

    public Rational add(final Rational other) {
        Objects.requireNonNull(other, "other");
        if (denominator.equals(other.denominator)) {
            return new Rational(numerator.add(other.numerator), denominator);
        }
        return new Rational(
                numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational subtract(final Rational other) {
        Objects.requireNonNull(other, "other");
        return add(other.negate());
    }

    public Rational multiply(final Rational other) {
        Objects.requireNonNull(other, "other");
        return new Rational(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /**
     * @throws ArithmeticException if {@code other} is zero
     */
    public Rational divide(final Rational other) {
        Objects.requireNonNull(other, "other");
        if (other.isZero()) {
            throw new ArithmeticException("Division by zero");
        }
        return new Rational(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    /**
     * Raises this rational to an integer power. Negative exponents invert first.
     *
     * @throws ArithmeticException if this rational is zero and {@code exponent} is negative
     */
    public Rational pow(final int exponent) {
        if (exponent < 0) {
            return reciprocal().pow(-exponent);
        }
        return new Rational(numerator.pow(exponent), denominator.pow(exponent));
    }

    /**
     * Returns the residue of this rational in {@code Z/mZ}, i.e. the unique
     * {@code r} in {@code [0, m)} with {@code r * denominator == numerator (mod m)}.
     *
     * @param modulus a positive modulus
     * @return the residue
     * @throws ArithmeticException if the denominator is not invertible modulo {@code modulus}
     */
    public BigInteger mod(final BigInteger modulus) {
        Objects.requireNonNull(modulus, "modulus");
        if (modulus.signum() <= 0) {
            throw new ArithmeticException("Modulus must be positive: " + modulus);
        }
        return numerator.multiply(denominator.modInverse(modulus)).mod(modulus);
    }

    @Override
    public int compareTo(final Rational other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @JsonValue
    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }
}
