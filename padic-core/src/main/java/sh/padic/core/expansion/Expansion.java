// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.expansion;

import java.util.Arrays;
import java.util.Objects;

/**
 * Output of {@link DigitExpander}: exactly the requested number of base-p digits,
 * lowest power first, plus what is known about the digits past the budget.
 *
 * <p>For {@link Kind#TERMINATING} expansions {@code periodStart} is the number of
 * significant digits and {@code periodLength} is 0. For {@link Kind#PERIODIC}
 * expansions the digits from {@code periodStart} repeat with period
 * {@code periodLength} forever. For {@link Kind#TRUNCATED} expansions both are 0.
 *
 * @param digits       the digits, each in {@code [0, p)}
 * @param kind         how the expansion continues past the budget
 * @param periodStart  index of the first repeating digit (or the significant length)
 * @param periodLength length of the repeating block
 * @since 0.1.0
 */
public record Expansion(int[] digits, Kind kind, int periodStart, int periodLength) {

    /**
     * What the expander established about the infinite expansion.
     */
    public enum Kind {
        /** Every digit past {@code periodStart} is zero. */
        TERMINATING,
        /** The state repeated; the digits are eventually periodic. */
        PERIODIC,
        /** Neither was observed within the budget. */
        TRUNCATED;

        /**
         * @return true when the full infinite expansion is known
         */
        public boolean isExact() {
            return this != TRUNCATED;
        }
    }

    public Expansion {
        Objects.requireNonNull(digits, "digits");
        Objects.requireNonNull(kind, "kind");
        if (periodStart < 0 || periodLength < 0) {
            throw new IllegalArgumentException("period bounds must be non-negative");
        }
        if (kind == Kind.PERIODIC && periodLength == 0) {
            throw new IllegalArgumentException("periodic expansion needs a non-empty period");
        }
        digits = Arrays.copyOf(digits, digits.length);
    }

    @Override
    public int[] digits() {
        return Arrays.copyOf(digits, digits.length);
    }

    public boolean isExact() {
        return kind.isExact();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Expansion other)) {
            return false;
        }
        return kind == other.kind
                && periodStart == other.periodStart
                && periodLength == other.periodLength
                && Arrays.equals(digits, other.digits);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(kind, periodStart, periodLength);
        return 31 * result + Arrays.hashCode(digits);
    }

    @Override
    public String toString() {
        return "Expansion[digits=" + Arrays.toString(digits)
                + ", kind=" + kind
                + ", periodStart=" + periodStart
                + ", periodLength=" + periodLength + "]";
    }
}
