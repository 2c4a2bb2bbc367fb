// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.series;

import java.util.Objects;
import java.util.StringJoiner;

import sh.padic.core.PAdicNumber;

/**
 * Renders p-adic numbers in series notation, e.g. {@code 2 + 3*5 + 1*5^2} or
 * {@code 1/5 + 2 + 4*5 + O(5^3)}.
 *
 * <p>Term layout by exponent {@code k}: {@code a} for 0, {@code a*p} for 1,
 * {@code a*p^k} above that, {@code a/p} for -1 and {@code a/p^n} with {@code n = -k} below that. Zero
 * digits are skipped. {@link SeriesParser} reads the same notation back.
 *
 * @since 0.1.0
 */
public final class SeriesFormatter {

    private SeriesFormatter() {
        // Utility class
    }

    public static String format(final PAdicNumber value, final int showDigits) {
        Objects.requireNonNull(value, "value");
        return format(value.terms(showDigits), value.prime());
    }

    public static String format(final SeriesTerms series, final int prime) {
        Objects.requireNonNull(series, "series");
        if (series.isZero()) {
            return "0";
        }
        final StringJoiner joiner = new StringJoiner(" + ");
        for (SeriesTerm term : series.terms()) {
            joiner.add(formatTerm(term, prime));
        }
        if (series.truncated()) {
            joiner.add("O(" + prime + "^" + series.orderExponent() + ")");
        }
        return joiner.toString();
    }

    static String formatTerm(final SeriesTerm term, final int prime) {
        final int k = term.exponent();
        if (k == 0) {
            return Integer.toString(term.digit());
        }
        if (k == 1) {
            return term.digit() + "*" + prime;
        }
        if (k == -1) {
            return term.digit() + "/" + prime;
        }
        if (k > 0) {
            return term.digit() + "*" + prime + "^" + k;
        }
        return term.digit() + "/" + prime + "^" + (-k);
    }
}
