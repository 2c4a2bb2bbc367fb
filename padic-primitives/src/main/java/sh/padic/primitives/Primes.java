// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.primitives;

/**
 * Primality predicate used to validate the base of a p-adic number.
 *
 * @since 0.1.0
 */
public final class Primes {

    private Primes() {
        // Utility class
    }

    /**
     * Deterministic primality test by trial division over 2, 3 and {@code 6k ± 1}.
     *
     * @param n the candidate
     * @return true if {@code n} is prime; false for every {@code n < 2}
     */
    public static boolean isPrime(final long n) {
        if (n < 2) {
            return false;
        }
        if (n < 4) {
            return true;
        }
        if (n % 2 == 0 || n % 3 == 0) {
            return false;
        }
        // i <= n / i avoids overflowing i * i near Long.MAX_VALUE
        for (long i = 5; i <= n / i; i += 6) {
            if (n % i == 0 || n % (i + 2) == 0) {
                return false;
            }
        }
        return true;
    }
}
