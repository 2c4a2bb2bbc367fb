// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.error;

/**
 * Thrown when the base of a p-adic number fails the primality check.
 *
 * @since 0.1.0
 */
public final class InvalidPrimeException extends PAdicException {

    private final long prime;

    public InvalidPrimeException(final long prime) {
        super("Not a prime: " + prime);
        this.prime = prime;
    }

    public long prime() {
        return prime;
    }
}
