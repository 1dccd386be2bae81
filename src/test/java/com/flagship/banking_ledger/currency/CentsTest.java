package com.flagship.banking_ledger.currency;

import com.flagship.banking_ledger.exception.AmountOverflowException;
import com.flagship.banking_ledger.exception.InvalidAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for exact cents parsing, formatting and checked arithmetic.
 *
 * The parser is the only gate between user text and balances, so these tests
 * lean on the grammar edges: signs, separators, digit counts and the 64-bit boundary.
 */
class CentsTest {

    private static final String MAX_AS_TEXT = "184467440737095516.15";

    @ParameterizedTest(name = "\"{0}\" parses to {1} cents")
    @CsvSource({
        "0, 0",
        "2, 200",
        "30, 3000",
        ".0, 0",
        ".02, 2",
        ".2, 20",
        ".1, 10",
        "0.0, 0",
        "0.00, 0",
        "1.00, 100",
        "1.02, 102",
        "3.1, 310",
        "30.2, 3020",
        "40.02, 4002",
        "40.12, 4012",
        "40.20, 4020",
        "50.99, 5099",
        "007, 700"
    })
    @DisplayName("Valid amount text should parse to exact minor units")
    void testParseValid(String text, long expectedMinorUnits) {
        assertEquals(Cents.ofMinorUnits(expectedMinorUnits), Cents.parse(text));
    }

    @Test
    @DisplayName("Single decimal digit should be read as tenths")
    void testSingleDecimalDigitScaling() {
        assertEquals(Cents.parse("40.20"), Cents.parse("40.2"));
        assertEquals(10L, Cents.parse(".1").minorUnits());
    }

    @ParameterizedTest(name = "\"{0}\" is rejected")
    @ValueSource(strings = {
        "", ".", "-2", "-0.0", "-1.0", "+2", "2a", "wef", "1.", "2.002", ".002",
        "1.1.2", ".1.2", ".1a", "a.2", "..2", " 1", "1 ", "1,00", "1e3", "١٢"
    })
    @DisplayName("Text violating the decimal grammar should be rejected as invalid")
    void testParseInvalid(String text) {
        InvalidAmountException e = assertThrows(InvalidAmountException.class, () -> Cents.parse(text));
        assertEquals(text, e.getText());
    }

    @Test
    @DisplayName("Null text should be rejected as invalid")
    void testParseNull() {
        assertThrows(InvalidAmountException.class, () -> Cents.parse(null));
    }

    @Test
    @DisplayName("Largest representable amount should parse to MAX")
    void testParseMaximum() {
        assertEquals(Cents.MAX, Cents.parse(MAX_AS_TEXT));
        assertEquals("18446744073709551615", Cents.MAX.minorUnitsAsString());
    }

    @ParameterizedTest(name = "\"{0}\" overflows")
    @ValueSource(strings = {
        "184467440737095516.16",
        "184467440737095517",
        "18446744073709551615",
        "18446744073709551615.1",
        "18446744073709551614.9",
        "99999999999999999999999.99"
    })
    @DisplayName("Well-formed text beyond the representable range should overflow")
    void testParseOverflow(String text) {
        AmountOverflowException e = assertThrows(AmountOverflowException.class, () -> Cents.parse(text));
        assertEquals(text, e.getText());
        assertEquals("amount " + text + " would overflow", e.getMessage());
    }

    @ParameterizedTest(name = "{0} cents formats as {1}")
    @CsvSource({
        "0, 0.00",
        "9, 0.09",
        "10, 0.10",
        "12, 0.12",
        "99, 0.99",
        "100, 1.00",
        "109, 1.09",
        "199, 1.99",
        "4023, 40.23",
        "5000, 50.00"
    })
    @DisplayName("Format should always render two zero-padded decimal digits")
    void testFormat(long minorUnits, String expected) {
        Cents cents = Cents.ofMinorUnits(minorUnits);
        assertEquals(expected, cents.format());
        assertEquals("$" + expected, cents.toString());
    }

    @Test
    @DisplayName("Formatted values should parse back to the same amount")
    void testFormatParsesBack() {
        long[] samples = {0L, 1L, 9L, 10L, 99L, 100L, 12345L, Long.MAX_VALUE, Long.MIN_VALUE, -2L, -1L};
        for (long sample : samples) {
            Cents cents = Cents.ofMinorUnits(sample);
            assertEquals(cents, Cents.parse(cents.format()), () -> "round trip of " + cents.minorUnitsAsString());
        }
        assertEquals(MAX_AS_TEXT, Cents.MAX.format());
    }

    @Test
    @DisplayName("Addition should be exact below the maximum and empty past it")
    void testPlus() {
        assertEquals(Optional.of(Cents.ofMinorUnits(4000)), Cents.ofMinorUnits(2000).plus(Cents.ofMinorUnits(2000)));
        assertEquals(Optional.of(Cents.MAX), Cents.ofMinorUnits(-2L).plus(Cents.ofMinorUnits(1)));
        assertEquals(Optional.empty(), Cents.MAX.plus(Cents.ofMinorUnits(1)));
        assertEquals(Optional.empty(), Cents.ofMinorUnits(-2L).plus(Cents.ofMinorUnits(200)));
    }

    @Test
    @DisplayName("Subtraction should be exact down to zero and empty below it")
    void testMinus() {
        assertEquals(Optional.of(Cents.ZERO), Cents.ofMinorUnits(2000).minus(Cents.ofMinorUnits(2000)));
        assertEquals(Optional.of(Cents.ofMinorUnits(20)), Cents.ofMinorUnits(120).minus(Cents.ofMinorUnits(100)));
        assertEquals(Optional.empty(), Cents.ofMinorUnits(2).minus(Cents.ofMinorUnits(10)));
        assertEquals(Optional.of(Cents.ofMinorUnits(1)), Cents.MAX.minus(Cents.ofMinorUnits(-2L)));
    }

    @Test
    @DisplayName("Ordering should treat the full 64 bits as unsigned")
    void testUnsignedOrdering() {
        Cents aboveSignedRange = Cents.ofMinorUnits(Long.MIN_VALUE);
        assertTrue(aboveSignedRange.compareTo(Cents.ofMinorUnits(Long.MAX_VALUE)) > 0);
        assertTrue(Cents.ZERO.compareTo(Cents.MAX) < 0);
        assertEquals(0, Cents.parse("1.5").compareTo(Cents.ofMinorUnits(150)));
        assertTrue(Cents.ZERO.isZero());
    }

    @Test
    @DisplayName("Minor-unit text should read back through ofMinorUnits")
    void testMinorUnitsText() {
        Cents cents = Cents.ofMinorUnits("18446744073709551000");
        assertEquals("18446744073709551000", cents.minorUnitsAsString());
        assertThrows(NumberFormatException.class, () -> Cents.ofMinorUnits("-5"));
    }
}
