// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.error;

/**
 * Thrown when a rational is requested with a bound on the power of p in its
 * denominator that is tighter than the valuation of the number allows.
 *
 * @since 0.1.0
 */
public final class PrecisionExceededException extends PAdicException {

    private final int maxDenominatorPower;
    private final int requiredPower;

    public PrecisionExceededException(final int maxDenominatorPower, final int requiredPower) {
        super("Denominator needs p^%d but at most p^%d was allowed"
                .formatted(requiredPower, maxDenominatorPower));
        this.maxDenominatorPower = maxDenominatorPower;
        this.requiredPower = requiredPower;
    }

    public int maxDenominatorPower() {
        return maxDenominatorPower;
    }

    public int requiredPower() {
        return requiredPower;
    }
}
