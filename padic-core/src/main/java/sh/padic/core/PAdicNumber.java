// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.padic.core.error.InvalidInputException;
import sh.padic.core.error.InvalidPrecisionException;
import sh.padic.core.error.InvalidPrimeException;
import sh.padic.core.error.NotAnIntegerException;
import sh.padic.core.error.PrecisionExceededException;
import sh.padic.core.error.PrimeMismatchException;
import sh.padic.core.expansion.DigitExpander;
import sh.padic.core.expansion.Expansion;
import sh.padic.core.expansion.SeriesReconstructor;
import sh.padic.core.expansion.Valuation;
import sh.padic.core.expansion.ValuationExtractor;
import sh.padic.core.series.ParsedSeries;
import sh.padic.core.series.SeriesFormatter;
import sh.padic.core.series.SeriesParser;
import sh.padic.core.series.SeriesTerm;
import sh.padic.core.series.SeriesTerms;
import sh.padic.primitives.Primes;
import sh.padic.primitives.Rational;

/**
 * A p-adic number truncated to a fixed digit budget.
 * <p>
 * The value is {@code sum(digits[i] * p^(valuation + i))}. Digits are stored
 * lowest power first; the first stored digit of a non-zero number is never 0 and
 * trailing zeros are not stored. At most {@code precision} digits are kept.
 * <p>
 * <strong>Exactness:</strong> when the number was built from a known rational and
 * its expansion terminated or started repeating within the budget, the whole
 * infinite expansion is known and {@link #toRational()} returns the exact value
 * (so {@code of(-42, 5).toLong() == -42}). Otherwise the stored digits are a
 * truncation and {@link #toRational()} returns their finite sum, which agrees with
 * the true value modulo {@code p^(valuation + precision)}.
 * <p>
 * <strong>Equality:</strong> {@link #isEqualTo(PAdicNumber)} is the p-adic notion
 * of equality: digits are compared only up to the smaller precision, so it is
 * reflexive and symmetric but not transitive. {@link #equals(Object)} is strict
 * structural equality.
 * <p>
 * Instances are immutable and safe to share between threads.
 *
 * <pre>{@code
 * PAdicNumber x = PAdicNumber.of(Rational.of(7, 25), 5);   // valuation -2
 * PAdicNumber y = PAdicNumber.of(3, 5);
 * PAdicNumber sum = x.add(y);
 * System.out.println(sum.toSeriesString());              // 2/5^2 + 1/5 + 3
 * }</pre>
 *
 * @since 0.1.0
 */
public final class PAdicNumber {

    public static final int DEFAULT_PRECISION = 20;
    public static final int DEFAULT_SHOW_DIGITS = 10;

    private static final Logger LOG = LoggerFactory.getLogger(PAdicNumber.class);
    private static final int[] NO_DIGITS = new int[0];
    private static final long UNBOUNDED = Long.MAX_VALUE;

    private final int prime;
    private final int precision;
    private final int valuation;
    private final int[] digits;
    private final Expansion.Kind kind;
    private final int periodStart;
    private final int periodLength;

    private PAdicNumber(
            final int prime,
            final int precision,
            final int valuation,
            final int[] digits,
            final Expansion.Kind kind,
            final int periodStart,
            final int periodLength) {
        this.prime = prime;
        this.precision = precision;
        this.valuation = valuation;
        this.digits = digits;
        this.kind = kind;
        this.periodStart = periodStart;
        this.periodLength = periodLength;
    }

    // ═══════════════════════════════════════════════════════════════
    // Construction
    // ═══════════════════════════════════════════════════════════════

    public static PAdicNumber of(final long value, final int prime) {
        return of(value, prime, DEFAULT_PRECISION);
    }

    public static PAdicNumber of(final long value, final int prime, final int precision) {
        return fromInteger(BigInteger.valueOf(value), prime, precision);
    }

    public static PAdicNumber of(final BigInteger value, final int prime) {
        return of(value, prime, DEFAULT_PRECISION);
    }

    public static PAdicNumber of(final BigInteger value, final int prime, final int precision) {
        return fromInteger(Objects.requireNonNull(value, "value"), prime, precision);
    }

    public static PAdicNumber of(final Rational value, final int prime) {
        return of(value, prime, DEFAULT_PRECISION);
    }

    public static PAdicNumber of(final Rational value, final int prime, final int precision) {
        return fromRational(Objects.requireNonNull(value, "value"), prime, precision);
    }

    public static PAdicNumber of(final BigInteger numerator, final BigInteger denominator, final int prime) {
        return of(numerator, denominator, prime, DEFAULT_PRECISION);
    }

    /**
     * Builds the p-adic expansion of {@code numerator / denominator}; the pair need
     * not be in lowest terms.
     *
     * @throws InvalidInputException if {@code denominator} is zero
     */
    public static PAdicNumber of(
            final BigInteger numerator, final BigInteger denominator, final int prime, final int precision) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        checkArguments(prime, precision);
        if (denominator.signum() == 0) {
            throw new InvalidInputException("Denominator must not be zero: " + numerator + "/0");
        }
        return fromRational(Rational.of(numerator, denominator), prime, precision);
    }

    public static PAdicNumber parseRational(final String text, final int prime) {
        return parseRational(text, prime, DEFAULT_PRECISION);
    }

    /**
     * Parses a plain rational such as {@code "-3/7"} or {@code "42"} and expands it.
     * For series notation use {@link #parse(String, int, int)}.
     *
     * @throws InvalidInputException if the text is not a rational or its denominator is zero
     */
    public static PAdicNumber parseRational(final String text, final int prime, final int precision) {
        Objects.requireNonNull(text, "text");
        checkArguments(prime, precision);
        final Rational value;
        try {
            value = Rational.parse(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Not a rational: " + text, e);
        }
        return fromRational(value, prime, precision);
    }

    /**
     * Builds a p-adic number from any supported input.
     *
     * @throws InvalidPrimeException     if {@code prime} is not prime
     * @throws InvalidPrecisionException if {@code precision <= 0}
     */
    public static PAdicNumber of(final PAdicInput input, final int prime, final int precision) {
        Objects.requireNonNull(input, "input");
        return input.convert(prime, precision);
    }

    public static PAdicNumber fromInt(final long value, final int prime) {
        return of(value, prime);
    }

    public static PAdicNumber fromInt(final long value, final int prime, final int precision) {
        return of(value, prime, precision);
    }

    public static PAdicNumber copyOf(final PAdicNumber source, final int prime) {
        return copyOf(source, prime, DEFAULT_PRECISION);
    }

    /**
     * Copies {@code source} into the given prime and precision.
     * <p>
     * A source over another prime is re-expanded from its rational value. Over the
     * same prime, an exact source is re-expanded losslessly while a truncated one is
     * cut to the new precision; a truncated source is never extended, because its
     * digits past its own precision are unknown.
     *
     * @return the copy; for a truncated same-prime source and a {@code precision}
     *         above its own, the source itself, still at its own precision
     */
    public static PAdicNumber copyOf(final PAdicNumber source, final int prime, final int precision) {
        return fromPAdic(Objects.requireNonNull(source, "source"), prime, precision);
    }

    public static PAdicNumber zero(final int prime) {
        return zero(prime, DEFAULT_PRECISION);
    }

    public static PAdicNumber zero(final int prime, final int precision) {
        checkArguments(prime, precision);
        return new PAdicNumber(prime, precision, 0, NO_DIGITS, Expansion.Kind.TERMINATING, 0, 0);
    }

    public static PAdicNumber ofDigits(final int prime, final int valuation, final int[] digits) {
        return ofDigits(prime, valuation, digits, DEFAULT_PRECISION);
    }

    /**
     * Builds a truncated series directly from digits.
     * <p>
     * Leading zeros raise the valuation, trailing zeros are dropped, and digits past
     * {@code precision} are cut off. An all-zero sequence is zero.
     *
     * @param digits digits lowest power first, each in {@code [0, prime)}
     * @throws InvalidInputException if a digit is out of range
     */
    public static PAdicNumber ofDigits(final int prime, final int valuation, final int[] digits, final int precision) {
        Objects.requireNonNull(digits, "digits");
        checkArguments(prime, precision);
        int first = -1;
        for (int i = 0; i < digits.length; i++) {
            if (digits[i] < 0 || digits[i] >= prime) {
                throw new InvalidInputException(
                        "Digit %d at position %d is outside [0, %d)".formatted(digits[i], i, prime));
            }
            if (first < 0 && digits[i] != 0) {
                first = i;
            }
        }
        if (first < 0) {
            return zero(prime, precision);
        }
        final int end = (int) Math.min(digits.length, (long) first + precision);
        final int[] kept = stripTrailingZeros(Arrays.copyOfRange(digits, first, end));
        return new PAdicNumber(
                prime, precision, Math.addExact(valuation, first), kept, Expansion.Kind.TRUNCATED, 0, 0);
    }

    public static PAdicNumber parse(final String text, final int prime) {
        return parse(text, prime, null);
    }

    /**
     * Parses series notation such as {@code "1/5 + 2 + 3*5"}.
     * <p>
     * Without an {@code O(p^e)} term the text is an exact finite sum. With one, the
     * result is a truncated series whose precision is {@code e - valuation}, capped
     * at {@code precision}.
     *
     * @throws InvalidInputException if the text is not valid series notation
     * @see SeriesParser
     */
    public static PAdicNumber parse(final String text, final int prime, final int precision) {
        return parse(text, prime, Integer.valueOf(precision));
    }

    private static PAdicNumber parse(final String text, final int prime, final @Nullable Integer precision) {
        Objects.requireNonNull(text, "text");
        final int budget = precision == null ? DEFAULT_PRECISION : precision;
        checkArguments(prime, budget);

        final ParsedSeries series = SeriesParser.parse(text, prime);
        final int[] parsed = series.digits();
        final Integer order = series.orderExponent();
        if (parsed.length == 0) {
            return zero(prime, budget);
        }
        if (order == null) {
            return fromRational(SeriesReconstructor.reconstruct(series.valuation(), parsed, prime), prime, budget);
        }
        final int known = order - series.valuation();
        return ofDigits(prime, series.valuation(), parsed, precision == null ? known : Math.min(known, precision));
    }

    static PAdicNumber fromInteger(final BigInteger value, final int prime, final int precision) {
        checkArguments(prime, precision);
        if (value.signum() == 0) {
            return zero(prime, precision);
        }
        return expand(ValuationExtractor.extract(value, BigInteger.ONE, prime), prime, precision);
    }

    static PAdicNumber fromRational(final Rational value, final int prime, final int precision) {
        checkArguments(prime, precision);
        if (value.isZero()) {
            return zero(prime, precision);
        }
        return expand(ValuationExtractor.extract(value, prime), prime, precision);
    }

    static PAdicNumber fromPAdic(final PAdicNumber source, final int prime, final int precision) {
        checkArguments(prime, precision);
        if (source.isZero()) {
            return zero(prime, precision);
        }
        if (source.prime != prime || source.isExact()) {
            return fromRational(source.toRational(), prime, precision);
        }
        if (precision > source.precision) {
            LOG.debug("Keeping precision {} of truncated {}-adic source; {} digits requested",
                    source.precision, prime, precision);
            return source;
        }
        return source.cut(precision);
    }

    private static PAdicNumber expand(final Valuation extracted, final int prime, final int precision) {
        final Expansion expansion = DigitExpander.expand(extracted, prime, precision);
        final PAdicNumber result = new PAdicNumber(
                prime,
                precision,
                extracted.valuation(),
                stripTrailingZeros(expansion.digits()),
                expansion.kind(),
                expansion.periodStart(),
                expansion.periodLength());
        if (PAdicDebug.isEnabled(PAdicDebug.Area.CONVERSION)) {
            DebugLogger.log(PAdicDebug.Area.CONVERSION, "%s/%s * %d^%d -> digits=%s kind=%s (precision=%d)",
                    extracted.numerator(), extracted.denominator(), prime, extracted.valuation(),
                    Arrays.toString(result.digits), result.kind, precision);
        }
        return result;
    }

    private static void checkArguments(final int prime, final int precision) {
        if (!Primes.isPrime(prime)) {
            throw new InvalidPrimeException(prime);
        }
        if (precision <= 0) {
            throw new InvalidPrecisionException(precision);
        }
    }

    private static int[] stripTrailingZeros(final int[] digits) {
        int end = digits.length;
        while (end > 0 && digits[end - 1] == 0) {
            end--;
        }
        return end == digits.length ? digits : Arrays.copyOf(digits, end);
    }

    // ═══════════════════════════════════════════════════════════════
    // Accessors
    // ═══════════════════════════════════════════════════════════════

    public int prime() {
        return prime;
    }

    public int precision() {
        return precision;
    }

    /**
     * Returns the exponent of the lowest non-zero digit; 0 for zero.
     */
    public int valuation() {
        return valuation;
    }

    /**
     * Returns a copy of the stored digits, lowest power first, without trailing zeros.
     */
    public int[] digits() {
        return Arrays.copyOf(digits, digits.length);
    }

    /**
     * Returns the coefficient of {@code p^(valuation + index)}; positions past the
     * stored digits are 0.
     *
     * @throws IndexOutOfBoundsException if {@code index} is negative
     */
    public int digitAt(final int index) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Negative digit index: " + index);
        }
        return index < digits.length ? digits[index] : 0;
    }

    public boolean isZero() {
        return digits.length == 0;
    }

    /**
     * Returns true when the complete expansion is known, i.e. it terminated or its
     * repeating block was found within the precision.
     */
    public boolean isExact() {
        return kind.isExact();
    }

    public Expansion.Kind kind() {
        return kind;
    }

    /**
     * For periodic numbers, the digit index where the repeating block starts;
     * for terminating numbers, the count of significant digits; otherwise 0.
     */
    public int periodStart() {
        return periodStart;
    }

    /**
     * Length of the repeating block, or 0 when there is none.
     */
    public int periodLength() {
        return periodLength;
    }

    // ═══════════════════════════════════════════════════════════════
    // Conversion
    // ═══════════════════════════════════════════════════════════════

    /**
     * Returns the exact value for exact numbers and the finite sum of the stored
     * digits otherwise.
     */
    public Rational toRational() {
        return rational(null);
    }

    /**
     * Like {@link #toRational()}, but refuses numbers whose denominator needs more
     * than {@code p^maxDenominatorPower}.
     *
     * @throws PrecisionExceededException if {@code -valuation > maxDenominatorPower}
     * @throws InvalidInputException      if {@code maxDenominatorPower} is negative
     */
    public Rational toRational(final int maxDenominatorPower) {
        if (maxDenominatorPower < 0) {
            throw new InvalidInputException("maxDenominatorPower must be non-negative: " + maxDenominatorPower);
        }
        return rational(maxDenominatorPower);
    }

    /**
     * Returns the finite sum of the stored digits, ignoring any known periodicity.
     */
    public Rational toTruncatedRational() {
        if (isZero()) {
            return Rational.ZERO;
        }
        return SeriesReconstructor.reconstruct(valuation, digits, prime);
    }

    /**
     * @throws NotAnIntegerException if the valuation is negative or the value is not integral
     */
    public BigInteger toBigInteger() {
        if (isZero()) {
            return BigInteger.ZERO;
        }
        if (valuation < 0) {
            throw new NotAnIntegerException("Valuation %d is negative: %s".formatted(valuation, this));
        }
        final Rational value = toRational();
        if (!value.isInteger()) {
            throw new NotAnIntegerException("%s is not an integer: %s".formatted(value, this));
        }
        return value.numerator();
    }

    /**
     * @throws NotAnIntegerException if the value is not an integer
     * @throws ArithmeticException   if the integer does not fit in a long
     */
    public long toLong() {
        return toBigInteger().longValueExact();
    }

    private Rational rational(final @Nullable Integer maxDenominatorPower) {
        if (isZero()) {
            return Rational.ZERO;
        }
        if (maxDenominatorPower != null && -valuation > maxDenominatorPower) {
            throw new PrecisionExceededException(maxDenominatorPower, -valuation);
        }
        if (kind.isExact()) {
            return SeriesReconstructor.reconstructPeriodic(valuation, digits, periodStart, periodLength, prime);
        }
        return SeriesReconstructor.reconstruct(valuation, digits, prime);
    }

    // ═══════════════════════════════════════════════════════════════
    // Arithmetic
    // ═══════════════════════════════════════════════════════════════

    /**
     * Adds two numbers over the same prime. The result has at most the smaller of
     * the two precisions and is exact only when both operands are. With a truncated
     * operand the result keeps only the digits below the first power of p that the
     * operands leave unknown; if none is left, the result is zero.
     *
     * @throws PrimeMismatchException if the primes differ
     */
    public PAdicNumber add(final PAdicNumber other) {
        return combine(other, Operation.ADD);
    }

    public PAdicNumber subtract(final PAdicNumber other) {
        return combine(other, Operation.SUBTRACT);
    }

    public PAdicNumber multiply(final PAdicNumber other) {
        return combine(other, Operation.MULTIPLY);
    }

    /**
     * @throws InvalidInputException  if {@code other} is zero
     * @throws PrimeMismatchException if the primes differ
     */
    public PAdicNumber divide(final PAdicNumber other) {
        requireSamePrime(other);
        if (other.isZero()) {
            throw new InvalidInputException("Division by zero");
        }
        return combine(other, Operation.DIVIDE);
    }

    public PAdicNumber negate() {
        if (isZero()) {
            return this;
        }
        final PAdicNumber result = fromRational(operand(precision).negate(), prime, precision);
        return isExact() ? result : result.truncated();
    }

    /**
     * Returns the p-adic absolute value {@code p^-valuation}, or 0 for zero.
     */
    public Rational norm() {
        if (isZero()) {
            return Rational.ZERO;
        }
        return Rational.of(prime).pow(-valuation);
    }

    /**
     * Returns the unit part: the same digits shifted to valuation 0.
     */
    public PAdicNumber unit() {
        if (isZero() || valuation == 0) {
            return this;
        }
        return new PAdicNumber(prime, precision, 0, digits, kind, periodStart, periodLength);
    }

    private PAdicNumber combine(final PAdicNumber other, final Operation operation) {
        requireSamePrime(other);
        final int limit = Math.min(precision, other.precision);
        final Rational left = operand(limit);
        final Rational right = other.operand(limit);
        final Rational value = operation.function.apply(left, right);

        PAdicNumber result = fromRational(value, prime, limit);
        if (!isExact() || !other.isExact()) {
            result = result.within(knownBound(other, operation, limit));
        }
        if (PAdicDebug.isEnabled(PAdicDebug.Area.ARITHMETIC)) {
            DebugLogger.log(PAdicDebug.Area.ARITHMETIC, "(%s) %s (%s) = %s in Q_%d, precision=%d, exact=%s",
                    left, operation.symbol, right, value, prime, limit, result.isExact());
        }
        return result;
    }

    /**
     * Exponent {@code N} such that the result of {@code this op other} is known
     * modulo {@code p^N}, given that each operand entered with {@code limit} digits.
     */
    private long knownBound(final PAdicNumber other, final Operation operation, final int limit) {
        final long a = absolutePrecision(limit);
        final long b = other.absolutePrecision(limit);
        return switch (operation) {
            case ADD, SUBTRACT -> Math.min(a, b);
            case MULTIPLY -> Math.min(shift(b, valuation), shift(a, other.valuation));
            case DIVIDE -> shift(Math.min(a, shift(b, (long) valuation - other.valuation)), -(long) other.valuation);
        };
    }

    /**
     * Exponent of the first unknown power of p; unbounded for exact numbers.
     */
    private long absolutePrecision(final int limit) {
        return isExact() ? UNBOUNDED : (long) valuation + limit;
    }

    private static long shift(final long bound, final long by) {
        return bound == UNBOUNDED ? UNBOUNDED : bound + by;
    }

    /**
     * Drops the digits at or above {@code p^bound} and marks the result truncated.
     * A number with no digit below the bound is indistinguishable from zero.
     */
    private PAdicNumber within(final long bound) {
        if (isZero()) {
            return this;
        }
        if (valuation >= bound) {
            return zero(prime, precision);
        }
        final int known = (int) Math.min(precision, bound - valuation);
        return known < precision ? cut(known) : truncated();
    }

    private PAdicNumber cut(final int newPrecision) {
        final int[] kept = stripTrailingZeros(Arrays.copyOf(digits, Math.min(digits.length, newPrecision)));
        if (kept.length == 0) {
            return zero(prime, newPrecision);
        }
        return new PAdicNumber(prime, newPrecision, valuation, kept, Expansion.Kind.TRUNCATED, 0, 0);
    }

    private void requireSamePrime(final PAdicNumber other) {
        Objects.requireNonNull(other, "other");
        if (other.prime != prime) {
            throw new PrimeMismatchException(prime, other.prime);
        }
    }

    /**
     * The rational an operand enters arithmetic with: its exact value when known,
     * otherwise the sum of its first {@code limit} digits.
     */
    private Rational operand(final int limit) {
        if (isZero()) {
            return Rational.ZERO;
        }
        if (isExact()) {
            return toRational();
        }
        return SeriesReconstructor.reconstruct(valuation, Arrays.copyOf(digits, Math.min(digits.length, limit)), prime);
    }

    private PAdicNumber truncated() {
        if (isZero() || kind == Expansion.Kind.TRUNCATED) {
            return this;
        }
        return new PAdicNumber(prime, precision, valuation, digits, Expansion.Kind.TRUNCATED, 0, 0);
    }

    // ═══════════════════════════════════════════════════════════════
    // Comparison
    // ═══════════════════════════════════════════════════════════════

    /**
     * p-adic equality up to the smaller of the two precisions.
     *
     * @see #isEqualTo(PAdicNumber, int)
     */
    public boolean isEqualTo(final PAdicNumber other) {
        return isEqualTo(other, Integer.MAX_VALUE);
    }

    /**
     * Approximate equality: true if both numbers are zero, or both are non-zero over
     * the same prime with the same valuation and the same digits in the first
     * {@code min(precision, other.precision, withinPrecision)} positions (unstored
     * positions count as 0).
     * <p>
     * The relation is reflexive and symmetric but not transitive, since numbers of
     * different precisions can each agree with a third one.
     *
     * @throws InvalidPrecisionException if {@code withinPrecision <= 0}
     */
    public boolean isEqualTo(final PAdicNumber other, final int withinPrecision) {
        Objects.requireNonNull(other, "other");
        if (withinPrecision <= 0) {
            throw new InvalidPrecisionException(withinPrecision);
        }
        if (prime != other.prime) {
            return false;
        }
        if (isZero() || other.isZero()) {
            return isZero() && other.isZero();
        }
        if (valuation != other.valuation) {
            return false;
        }
        final int limit = Math.min(Math.min(precision, other.precision), withinPrecision);
        for (int i = 0; i < limit; i++) {
            if (digitAt(i) != other.digitAt(i)) {
                return false;
            }
        }
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // Display
    // ═══════════════════════════════════════════════════════════════

    /**
     * Enumerates the non-zero terms among the first {@code min(showDigits, precision)}
     * digit positions.
     * <p>
     * The window is marked truncated unless the number is known to terminate inside it.
     *
     * @throws InvalidPrecisionException if {@code showDigits <= 0}
     */
    public SeriesTerms terms(final int showDigits) {
        if (showDigits <= 0) {
            throw new InvalidPrecisionException(showDigits);
        }
        final int shown = Math.min(showDigits, precision);
        if (isZero()) {
            return new SeriesTerms(List.of(), shown, false);
        }
        final List<SeriesTerm> terms = new ArrayList<>();
        for (int i = 0; i < Math.min(shown, digits.length); i++) {
            if (digits[i] != 0) {
                terms.add(new SeriesTerm(valuation + i, digits[i]));
            }
        }
        final boolean truncated = kind != Expansion.Kind.TERMINATING || digits.length > shown;
        return new SeriesTerms(terms, valuation + shown, truncated);
    }

    public String toSeriesString() {
        return toSeriesString(DEFAULT_SHOW_DIGITS);
    }

    public String toSeriesString(final int showDigits) {
        return SeriesFormatter.format(this, showDigits);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PAdicNumber other)) {
            return false;
        }
        return prime == other.prime
                && precision == other.precision
                && valuation == other.valuation
                && kind == other.kind
                && periodStart == other.periodStart
                && periodLength == other.periodLength
                && Arrays.equals(digits, other.digits);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(prime, precision, valuation, kind, periodStart, periodLength);
        return 31 * result + Arrays.hashCode(digits);
    }

    @Override
    public String toString() {
        return "PAdicNumber(" + toSeriesString() + ", p=" + prime + ", precision=" + precision + ")";
    }

    private enum Operation {
        ADD("+", Rational::add),
        SUBTRACT("-", Rational::subtract),
        MULTIPLY("*", Rational::multiply),
        DIVIDE("/", Rational::divide);

        private final String symbol;
        private final BinaryOperator<Rational> function;

        Operation(final String symbol, final BinaryOperator<Rational> function) {
            this.symbol = symbol;
            this.function = function;
        }
    }
}
