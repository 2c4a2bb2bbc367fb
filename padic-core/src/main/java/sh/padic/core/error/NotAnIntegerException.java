// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.error;

/**
 * Thrown when an integer is requested from a p-adic number with a negative
 * valuation or a non-integral rational value.
 *
 * @since 0.1.0
 */
public final class NotAnIntegerException extends PAdicException {

    public NotAnIntegerException(final String message) {
        super(message);
    }
}
