// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.error;

/**
 * Thrown when arithmetic combines p-adic numbers over different primes.
 *
 * @since 0.1.0
 */
public final class PrimeMismatchException extends PAdicException {

    private final int expected;
    private final int actual;

    public PrimeMismatchException(final int expected, final int actual) {
        super("Prime mismatch: expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
