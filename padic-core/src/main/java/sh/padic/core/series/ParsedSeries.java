// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.series;

import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Output of {@link SeriesParser}: a digit sequence anchored at {@code valuation}
 * and the exponent of the {@code O(p^e)} term, if the text had one.
 *
 * <p>An empty digit array is the zero series (valuation 0).
 *
 * @param valuation     exponent of the first digit
 * @param digits        the digits lowest power first; the first one is non-zero
 * @param orderExponent the big-O exponent, or null for an exact finite sum
 * @since 0.1.0
 */
public record ParsedSeries(int valuation, int[] digits, @Nullable Integer orderExponent) {

    public ParsedSeries {
        Objects.requireNonNull(digits, "digits");
        digits = Arrays.copyOf(digits, digits.length);
    }

    @Override
    public int[] digits() {
        return Arrays.copyOf(digits, digits.length);
    }

    public boolean isExact() {
        return orderExponent == null;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedSeries other)) {
            return false;
        }
        return valuation == other.valuation
                && Objects.equals(orderExponent, other.orderExponent)
                && Arrays.equals(digits, other.digits);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(valuation, orderExponent) + Arrays.hashCode(digits);
    }

    @Override
    public String toString() {
        return "ParsedSeries[valuation=" + valuation
                + ", digits=" + Arrays.toString(digits)
                + ", orderExponent=" + orderExponent + "]";
    }
}
