// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.series;

import java.util.List;
import java.util.Objects;

/**
 * The leading terms of a p-adic number as shown to a reader.
 *
 * @param terms         the non-zero terms in increasing exponent order
 * @param orderExponent exponent {@code e} of the {@code O(p^e)} remainder, i.e. the
 *                      first exponent not covered by the window
 * @param truncated     true when the value is not fully described by {@code terms}
 * @since 0.1.0
 */
public record SeriesTerms(List<SeriesTerm> terms, int orderExponent, boolean truncated) {

    public SeriesTerms {
        Objects.requireNonNull(terms, "terms");
        terms = List.copyOf(terms);
    }

    /**
     * @return true for the exact zero series
     */
    public boolean isZero() {
        return terms.isEmpty() && !truncated;
    }
}
