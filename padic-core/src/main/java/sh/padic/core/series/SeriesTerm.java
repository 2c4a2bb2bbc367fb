// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.series;

/**
 * One non-zero term {@code digit * p^exponent} of a p-adic series.
 *
 * @param exponent the power of p
 * @param digit    the coefficient, in {@code [1, p)}
 * @since 0.1.0
 */
public record SeriesTerm(int exponent, int digit) {
}
