// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.examples;

import sh.padic.core.PAdicContext;
import sh.padic.core.PAdicDebug;
import sh.padic.core.PAdicNumber;
import sh.padic.core.error.PrimeMismatchException;
import sh.padic.primitives.Rational;

/**
 * Demonstrates p-adic arithmetic and approximate equality.
 *
 * <pre>
 * mvn -q -pl padic-examples exec:java \
 *   -Dexec.mainClass=sh.padic.examples.ArithmeticExample \
 *   -Dpadic.examples.debug=true
 * </pre>
 */
public final class ArithmeticExample {

    private ArithmeticExample() {
    }

    public static void main(String[] args) {
        PAdicDebug.setEnabled(PAdicDebug.Area.ARITHMETIC, Boolean.getBoolean("padic.examples.debug"));
        final PAdicContext q5 = PAdicContext.builder(5).precision(12).showDigits(6).build();

        final PAdicNumber third = q5.of(Rational.of(1, 3));
        final PAdicNumber sevenTwentyFifths = q5.of(Rational.of(7, 25));

        System.out.println("1/3          = " + q5.format(third));
        System.out.println("7/25         = " + q5.format(sevenTwentyFifths));
        System.out.println("1/3 + 7/25   = " + q5.format(third.add(sevenTwentyFifths)));
        System.out.println("1/3 * 7/25   = " + q5.format(third.multiply(sevenTwentyFifths)));
        System.out.println("3 * 1/3      = " + q5.format(third.multiply(q5.of(3))));
        System.out.println("1/3 / 7/25   = " + third.divide(sevenTwentyFifths).toRational());
        System.out.println("|7/25|_5     = " + sevenTwentyFifths.norm());

        // Only the first 4 digits of the coarse copy are known; it still agrees with 1/3.
        final PAdicNumber coarse = PAdicNumber.ofDigits(5, 0, third.digits(), 4);
        System.out.println("coarse ~ 1/3 : " + coarse.isEqualTo(third));
        System.out.println("coarse == 1/3: " + coarse.equals(third));

        try {
            third.add(PAdicNumber.of(1, 7));
        } catch (PrimeMismatchException e) {
            System.out.println("PrimeMismatchException: " + e.getMessage());
        }
    }
}
