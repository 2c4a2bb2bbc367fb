// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.error;

/**
 * Thrown when a digit budget (precision, display width, comparison window) is not positive.
 *
 * @since 0.1.0
 */
public final class InvalidPrecisionException extends PAdicException {

    private final long precision;

    public InvalidPrecisionException(final long precision) {
        super("Precision must be a positive integer: " + precision);
        this.precision = precision;
    }

    public InvalidPrecisionException(final String message) {
        super(message);
        this.precision = 0;
    }

    public InvalidPrecisionException(final String message, final Throwable cause) {
        super(message, cause);
        this.precision = 0;
    }

    /**
     * Returns the rejected value, or 0 when the failure was not about a specific number.
     */
    public long precision() {
        return precision;
    }
}
