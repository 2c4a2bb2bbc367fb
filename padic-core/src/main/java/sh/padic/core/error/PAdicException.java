// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.error;

/**
 * Base runtime exception for all p-adic failures.
 *
 * <p>
 * The hierarchy is sealed so that every error kind raised by the library is
 * known up front. All of them are raised synchronously at the point of
 * violation; nothing is retried.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * PAdicException
 * ├── {@link InvalidPrimeException} - base is not a prime
 * ├── {@link InvalidPrecisionException} - digit budget is not positive
 * ├── {@link InvalidInputException} - malformed or out-of-contract input
 * ├── {@link PrimeMismatchException} - arithmetic across different bases
 * ├── {@link NotAnIntegerException} - integer conversion of a non-integer
 * └── {@link PrecisionExceededException} - denominator bound tighter than the value
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     long n = PAdicNumber.parse(text, 5).toLong();
 * } catch (NotAnIntegerException e) {
 *     // value has a fractional part
 * } catch (PAdicException e) {
 *     // any other p-adic error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class PAdicException extends RuntimeException
        permits InvalidPrimeException,
        InvalidPrecisionException,
        InvalidInputException,
        PrimeMismatchException,
        NotAnIntegerException,
        PrecisionExceededException {

    public PAdicException(final String message) {
        super(message);
    }

    public PAdicException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
