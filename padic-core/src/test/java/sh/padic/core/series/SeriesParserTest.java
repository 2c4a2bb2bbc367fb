// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.padic.core.series;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.padic.core.error.InvalidInputException;

class SeriesParserTest {

    @Nested
    @DisplayName("Valid series")
    class Valid {

        @Test
        void exactSumWithNegativePower() {
            assertEquals(new ParsedSeries(-1, new int[] {1, 2, 3}, null), SeriesParser.parse("1/5 + 2 + 3*5", 5));
        }

        @Test
        void orderTermIsRecorded() {
            ParsedSeries series = SeriesParser.parse("3 + 1*5 + 3*5^2 + O(5^3)", 5);
            assertEquals(new ParsedSeries(0, new int[] {3, 1, 3}, 3), series);
            assertFalse(series.isExact());
        }

        @Test
        void orderWithoutExponentMeansFirstPower() {
            assertEquals(Integer.valueOf(1), SeriesParser.parse("2 + O(7)", 7).orderExponent());
        }

        @Test
        void coefficientOneMayBeOmitted() {
            assertEquals(new ParsedSeries(2, new int[] {1}, null), SeriesParser.parse("5^2", 5));
        }

        @Test
        void gapsAreFilledWithZeros() {
            assertEquals(new ParsedSeries(-2, new int[] {2, 0, 0, 4}, null), SeriesParser.parse("2/5^2 + 4*5", 5));
        }

        @Test
        void termsMayAppearInAnyOrder() {
            assertEquals(SeriesParser.parse("1 + 2*3", 3), SeriesParser.parse("2*3 + 1", 3));
        }

        @Test
        void whitespaceIsFlexible() {
            assertEquals(new ParsedSeries(0, new int[] {1, 0, 0, 2}, null), SeriesParser.parse("  1+2 * 5 ^ 3 ", 5));
        }

        @Test
        void zeroTermsAreDropped() {
            assertEquals(new ParsedSeries(1, new int[] {1}, null), SeriesParser.parse("0 + 1*5", 5));
            assertEquals(new ParsedSeries(0, new int[0], null), SeriesParser.parse("0", 5));
        }

        @Test
        void bareOrderTermIsZeroSeries() {
            ParsedSeries series = SeriesParser.parse("O(5^4)", 5);
            assertEquals(0, series.digits().length);
            assertEquals(Integer.valueOf(4), series.orderExponent());
        }
    }

    @Nested
    @DisplayName("Invalid series")
    class Invalid {

        @ParameterizedTest
        @ValueSource(strings = {
                "",
                "   ",
                "1 + ",
                "+ 1",
                "1 + + 2",
                "O(5^3) + 1",
                "1*5^3 + O(5^3)",
                "abc",
                "-1",
                "7",
                "1 + 2",
                "1*7",
                "1/5^0",
                "O(7^2)",
                "99999999999",
                "2*x"
        })
        void rejected(String text) {
            assertThrows(InvalidInputException.class, () -> SeriesParser.parse(text, 5));
        }

        @Test
        void messageNamesOffendingTerm() {
            InvalidInputException ex = assertThrows(InvalidInputException.class,
                    () -> SeriesParser.parse("1 + foo", 5));
            assertTrue(ex.getMessage().contains("'foo'"), ex.getMessage());
        }
    }
}
