// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core;

import java.math.BigInteger;
import java.util.Objects;

import sh.padic.primitives.Rational;

/**
 * The values a {@link PAdicNumber} can be built from.
 *
 * <p>The input kind is fixed when the variant is created; each variant routes
 * itself to its own conversion path, so construction never inspects runtime
 * types.
 *
 * <pre>{@code
 * PAdicNumber a = PAdicNumber.of(PAdicInput.of(-42), 5, 20);
 * PAdicNumber b = PAdicNumber.of(PAdicInput.of(Rational.of(3, 7)), 5, 10);
 * PAdicNumber c = PAdicNumber.of(PAdicInput.of(b), 7, 10);
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed interface PAdicInput permits PAdicInput.OfInteger, PAdicInput.OfRational, PAdicInput.OfPAdic {

    static PAdicInput of(final long value) {
        return new OfInteger(BigInteger.valueOf(value));
    }

    static PAdicInput of(final BigInteger value) {
        return new OfInteger(value);
    }

    static PAdicInput of(final Rational value) {
        return new OfRational(value);
    }

    static PAdicInput of(final PAdicNumber value) {
        return new OfPAdic(value);
    }

    /**
     * Converts this input. Prime and precision are already validated by the caller.
     */
    PAdicNumber convert(int prime, int precision);

    /**
     * An integer value.
     *
     * @param value the integer
     */
    record OfInteger(BigInteger value) implements PAdicInput {
        public OfInteger {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public PAdicNumber convert(final int prime, final int precision) {
            return PAdicNumber.fromInteger(value, prime, precision);
        }
    }

    /**
     * An exact rational value.
     *
     * @param value the rational
     */
    record OfRational(Rational value) implements PAdicInput {
        public OfRational {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public PAdicNumber convert(final int prime, final int precision) {
            return PAdicNumber.fromRational(value, prime, precision);
        }
    }

    /**
     * Another p-adic number, copied into the target prime and precision.
     *
     * @param value the source number
     */
    record OfPAdic(PAdicNumber value) implements PAdicInput {
        public OfPAdic {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public PAdicNumber convert(final int prime, final int precision) {
            return PAdicNumber.fromPAdic(value, prime, precision);
        }
    }
}
