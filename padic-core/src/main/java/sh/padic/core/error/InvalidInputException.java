// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.error;

/**
 * Thrown for unparseable input, zero denominators, division by zero, and
 * internal contract violations such as a denominator still divisible by the
 * prime after valuation extraction.
 *
 * @since 0.1.0
 */
public final class InvalidInputException extends PAdicException {

    public InvalidInputException(final String message) {
        super(message);
    }

    public InvalidInputException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
