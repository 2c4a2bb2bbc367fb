// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.examples;

import java.util.Arrays;

import sh.padic.core.PAdicContext;
import sh.padic.core.PAdicDebug;
import sh.padic.core.PAdicNumber;
import sh.padic.core.error.PAdicException;
import sh.padic.core.expansion.SeriesReconstructor;
import sh.padic.core.expansion.Valuation;
import sh.padic.core.expansion.ValuationExtractor;
import sh.padic.primitives.Rational;

/**
 * Converts rationals to p-adic numbers and back.
 *
 * <p>Usage:
 *
 * <p>1) Built-in scenarios:
 * <pre>
 * mvn -q -pl padic-examples exec:java \
 *   -Dexec.mainClass=sh.padic.examples.ConversionExample
 * </pre>
 *
 * <p>2) Convert the arguments (rationals such as {@code 3/7}) in the given prime:
 * <pre>
 * mvn -q -pl padic-examples exec:java \
 *   -Dexec.mainClass=sh.padic.examples.ConversionExample \
 *   -Dpadic.examples.mode=convert -Dpadic.examples.prime=7 -Dpadic.precision=12 \
 *   -Dexec.args="3/7 -1 1/49"
 * </pre>
 *
 * <p>Add {@code -Dpadic.examples.debug=true} to trace every conversion and operation,
 * or {@code -Dpadic.debug=conversion} to pick areas.
 */
public final class ConversionExample {

    private ConversionExample() {
    }

    public static void main(String[] args) {
        if (Boolean.getBoolean("padic.examples.debug")) {
            PAdicDebug.setEnabled(true);
        }
        final String mode = System.getProperty("padic.examples.mode", "scenarios");
        switch (mode) {
            case "scenarios" -> runScenarios();
            case "convert" -> runConvert(args);
            default -> {
                System.out.println("Unknown mode: " + mode);
                System.out.println("Use -Dpadic.examples.mode=scenarios or convert");
            }
        }
    }

    private static void runScenarios() {
        System.out.println("=== Valuation ===");
        final Valuation v = ValuationExtractor.extract(Rational.of(7, 25), 5);
        System.out.println("7/25 in Q_5 = 5^" + v.valuation() + " * " + v.numerator() + "/" + v.denominator());

        System.out.println("=== Reconstruction ===");
        System.out.println("[2, 1, 3] at valuation 0 in Q_5 = "
                + SeriesReconstructor.reconstruct(0, new int[] {2, 1, 3}, 5));

        System.out.println("=== Round trips ===");
        show(PAdicNumber.of(42, 5));
        show(PAdicNumber.of(-42, 5));
        show(PAdicNumber.of(Rational.of(3, 7), 5, 10));
        show(PAdicNumber.of(Rational.of(1, 3), 5));
        show(PAdicNumber.of(Rational.of(-3, 5), 5));

        System.out.println("=== Errors ===");
        try {
            PAdicNumber.of(1, 4);
        } catch (PAdicException e) {
            System.out.println(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static void runConvert(final String[] args) {
        final PAdicContext context = PAdicContext.fromSystemProperties(Integer.getInteger("padic.examples.prime", 5));
        for (String arg : args) {
            try {
                show(context.parseRational(arg));
            } catch (PAdicException e) {
                System.out.println(arg + ": " + e.getMessage());
            }
        }
    }

    private static void show(final PAdicNumber x) {
        System.out.println(x.toSeriesString());
        System.out.println("  valuation = " + x.valuation());
        System.out.println("  digits    = " + Arrays.toString(x.digits()));
        System.out.println("  kind      = " + x.kind());
        System.out.println("  rational  = " + x.toRational());
    }
}
