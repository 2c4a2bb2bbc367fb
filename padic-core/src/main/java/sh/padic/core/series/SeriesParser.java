// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.series;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import sh.padic.core.error.InvalidInputException;

/**
 * Parses series notation such as {@code "1/5 + 2 + 3*5"} or
 * {@code "3 + 1*5 + 3*5^2 + O(5^3)"} into a {@link ParsedSeries}.
 *
 * <p>Accepted terms ({@code p} must be the prime, exponents are integers):
 * <ul>
 * <li>{@code a}: coefficient at exponent 0</li>
 * <li>{@code a*p}, {@code a*p^k}, {@code p^k}: coefficient 1 may be left out when the exponent is written</li>
 * <li>{@code a/p}, {@code a/p^k}: exponent {@code -k}</li>
 * <li>{@code O(p^e)}, {@code O(p)}: the remainder, last term only</li>
 * </ul>
 * Coefficients must lie in {@code [0, p)} and each exponent may appear once.
 *
 * @since 0.1.0
 */
public final class SeriesParser {

    private static final Pattern ORDER = Pattern.compile("O\\(\\s*(\\d+)\\s*(?:\\^\\s*(-?\\d+)\\s*)?\\)");
    private static final Pattern CONSTANT = Pattern.compile("(\\d+)");
    private static final Pattern POSITIVE = Pattern.compile("(?:(\\d+)\\s*\\*\\s*)?(\\d+)\\s*\\^\\s*(-?\\d+)|(\\d+)\\s*\\*\\s*(\\d+)");
    private static final Pattern NEGATIVE = Pattern.compile("(\\d+)\\s*/\\s*(\\d+)(?:\\s*\\^\\s*(\\d+))?");

    private SeriesParser() {
        // Utility class
    }

    /**
     * @param text  the series text
     * @param prime the base every power in the text must use
     * @return the digits anchored at their lowest exponent
     * @throws InvalidInputException if the text does not follow the notation
     */
    public static ParsedSeries parse(final String text, final int prime) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new InvalidInputException("Empty series");
        }

        final TreeMap<Integer, Integer> coefficients = new TreeMap<>();
        Integer order = null;
        for (String raw : text.split("\\+", -1)) {
            final String part = raw.trim();
            if (part.isEmpty()) {
                throw new InvalidInputException("Empty term in series: " + text);
            }
            if (order != null) {
                throw new InvalidInputException("O-term must be the last term: " + text);
            }
            final Matcher orderMatcher = ORDER.matcher(part);
            if (orderMatcher.matches()) {
                checkBase(orderMatcher.group(1), prime, text);
                order = orderMatcher.group(2) == null ? 1 : parseInt(orderMatcher.group(2), text);
                continue;
            }
            addTerm(coefficients, part, prime, text);
        }

        if (order != null && !coefficients.isEmpty() && coefficients.lastKey() >= order) {
            throw new InvalidInputException("Term p^%d is not below O(p^%d): %s"
                    .formatted(coefficients.lastKey(), order, text));
        }

        coefficients.values().removeIf(digit -> digit == 0);
        if (coefficients.isEmpty()) {
            return new ParsedSeries(0, new int[0], order);
        }
        final int valuation = coefficients.firstKey();
        final int[] digits = new int[coefficients.lastKey() - valuation + 1];
        for (Map.Entry<Integer, Integer> entry : coefficients.entrySet()) {
            digits[entry.getKey() - valuation] = entry.getValue();
        }
        return new ParsedSeries(valuation, digits, order);
    }

    private static void addTerm(
            final Map<Integer, Integer> coefficients, final String term, final int prime, final String text) {
        final int digit;
        final int exponent;

        Matcher m;
        if ((m = CONSTANT.matcher(term)).matches()) {
            digit = parseInt(m.group(1), text);
            exponent = 0;
        } else if ((m = POSITIVE.matcher(term)).matches()) {
            if (m.group(2) != null) {
                digit = m.group(1) == null ? 1 : parseInt(m.group(1), text);
                checkBase(m.group(2), prime, text);
                exponent = parseInt(m.group(3), text);
            } else {
                digit = parseInt(m.group(4), text);
                checkBase(m.group(5), prime, text);
                exponent = 1;
            }
        } else if ((m = NEGATIVE.matcher(term)).matches()) {
            digit = parseInt(m.group(1), text);
            checkBase(m.group(2), prime, text);
            final int k = m.group(3) == null ? 1 : parseInt(m.group(3), text);
            if (k == 0) {
                throw new InvalidInputException("Use a plain coefficient for p^0: " + text);
            }
            exponent = -k;
        } else {
            throw new InvalidInputException("Unrecognized term '" + term + "' in: " + text);
        }

        if (digit >= prime) {
            throw new InvalidInputException("Coefficient %d is not a digit below %d: %s".formatted(digit, prime, text));
        }
        if (coefficients.putIfAbsent(exponent, digit) != null) {
            throw new InvalidInputException("Exponent %d appears twice: %s".formatted(exponent, text));
        }
    }

    private static void checkBase(final String base, final int prime, final String text) {
        if (parseInt(base, text) != prime) {
            throw new InvalidInputException("Expected powers of %d but found %s: %s".formatted(prime, base, text));
        }
    }

    private static int parseInt(final String value, final String text) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Number out of range in series: " + text, e);
        }
    }
}
