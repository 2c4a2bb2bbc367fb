// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.expansion;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Result of {@link ValuationExtractor}: {@code value = p^valuation * numerator / denominator}
 * where neither {@code numerator} nor {@code denominator} is divisible by p.
 *
 * @param valuation   the signed p-adic valuation
 * @param numerator   the p-free numerator, carries the sign
 * @param denominator the p-free denominator, always positive
 * @since 0.1.0
 */
public record Valuation(int valuation, BigInteger numerator, BigInteger denominator) {

    public Valuation {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
    }
}
