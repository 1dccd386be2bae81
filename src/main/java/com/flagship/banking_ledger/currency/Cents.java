package com.flagship.banking_ledger.currency;

import com.flagship.banking_ledger.exception.AmountOverflowException;
import com.flagship.banking_ledger.exception.InvalidAmountException;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Exact non-negative monetary amount, counted in minor units (hundredths of the base unit).
 *
 * The count is held in a {@code long} but always read as an unsigned 64-bit integer,
 * so the representable range is 0 to 18446744073709551615 minor units.
 * Arithmetic never wraps: results outside the range come back empty.
 *
 * Key invariants:
 * - Immutable; arithmetic returns new instances
 * - Equality and ordering follow the unsigned minor-unit count
 * - No floating point anywhere, including formatting
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Cents implements Comparable<Cents> {

    public static final Cents ZERO = new Cents(0L);
    public static final Cents MAX = new Cents(-1L);

    private static final char SEPARATOR = '.';
    private static final long MINOR_UNITS_PER_UNIT = 100L;
    private static final long MAX_WHOLE_UNITS = Long.divideUnsigned(-1L, MINOR_UNITS_PER_UNIT);

    private final long minorUnits;

    /**
     * Wraps a raw minor-unit count. Negative values stand for counts above {@link Long#MAX_VALUE}.
     */
    public static Cents ofMinorUnits(long minorUnits) {
        return new Cents(minorUnits);
    }

    /**
     * Reads a minor-unit count written by {@link #minorUnitsAsString()}.
     *
     * @throws NumberFormatException if the text is not an unsigned 64-bit decimal
     */
    public static Cents ofMinorUnits(String unsignedDecimal) {
        return new Cents(Long.parseUnsignedLong(unsignedDecimal));
    }

    /**
     * Parses decimal amount text into cents.
     *
     * Accepted forms: {@code 12}, {@code 12.3}, {@code 12.34}, {@code .3}, {@code .34}.
     * A single decimal digit means tenths, so {@code .1} is ten cents.
     *
     * @param text amount text, digits with at most one '.' and at most two decimal digits
     * @return the parsed amount
     * @throws InvalidAmountException if the text does not match the grammar
     * @throws AmountOverflowException if the amount does not fit in 64 unsigned bits of cents
     */
    public static Cents parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidAmountException(text);
        }

        int separator = text.indexOf(SEPARATOR);
        String integerDigits = separator < 0 ? text : text.substring(0, separator);
        String decimalDigits = separator < 0 ? "" : text.substring(separator + 1);

        if (!isDigits(integerDigits) || !isDigits(decimalDigits)) {
            throw new InvalidAmountException(text);
        }
        // "1." and ".123" both fail here; "." alone is caught as an empty decimal part
        if (separator >= 0 && (decimalDigits.isEmpty() || decimalDigits.length() > 2)) {
            throw new InvalidAmountException(text);
        }

        long wholeUnits = parseWholeUnits(integerDigits, text);
        if (Long.compareUnsigned(wholeUnits, MAX_WHOLE_UNITS) > 0) {
            throw new AmountOverflowException(text);
        }

        long fraction = decimalDigits.isEmpty() ? 0L : Long.parseLong(decimalDigits);
        if (decimalDigits.length() == 1) {
            fraction *= 10;
        }

        return new Cents(wholeUnits * MINOR_UNITS_PER_UNIT)
            .plus(new Cents(fraction))
            .orElseThrow(() -> new AmountOverflowException(text));
    }

    private static long parseWholeUnits(String integerDigits, String text) {
        if (integerDigits.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseUnsignedLong(integerDigits);
        } catch (NumberFormatException e) {
            // Digits were already validated, so the only failure left is range
            throw new AmountOverflowException(text);
        }
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * Exact sum, or empty when it would exceed {@link #MAX}.
     */
    public Optional<Cents> plus(Cents other) {
        long sum = minorUnits + other.minorUnits;
        if (Long.compareUnsigned(sum, minorUnits) < 0) {
            return Optional.empty();
        }
        return Optional.of(new Cents(sum));
    }

    /**
     * Exact difference, or empty when {@code other} is larger than this amount.
     */
    public Optional<Cents> minus(Cents other) {
        if (Long.compareUnsigned(minorUnits, other.minorUnits) < 0) {
            return Optional.empty();
        }
        return Optional.of(new Cents(minorUnits - other.minorUnits));
    }

    public boolean isZero() {
        return minorUnits == 0L;
    }

    /**
     * Raw minor-unit bits. Read with {@link Long#toUnsignedString(long)} or the unsigned helpers.
     */
    public long minorUnits() {
        return minorUnits;
    }

    public String minorUnitsAsString() {
        return Long.toUnsignedString(minorUnits);
    }

    /**
     * Renders the amount as {@code units.cc}, always with two decimal digits.
     * The result parses back to the same value.
     */
    public String format() {
        long whole = Long.divideUnsigned(minorUnits, MINOR_UNITS_PER_UNIT);
        long fraction = Long.remainderUnsigned(minorUnits, MINOR_UNITS_PER_UNIT);
        return Long.toUnsignedString(whole) + SEPARATOR + (fraction < 10 ? "0" : "") + fraction;
    }

    @Override
    public int compareTo(Cents other) {
        return Long.compareUnsigned(minorUnits, other.minorUnits);
    }

    /**
     * Display form with a dollar prefix, e.g. {@code $40.23}.
     */
    @Override
    public String toString() {
        return "$" + format();
    }
}
