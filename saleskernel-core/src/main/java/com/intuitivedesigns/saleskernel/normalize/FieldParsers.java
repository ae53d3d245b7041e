/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.normalize;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure, per-field coercions from untyped source values.
 *
 * Every method maps {@code null} to {@link FieldOutcome#missing()} and never throws:
 * anything it cannot interpret becomes {@link FieldOutcome#malformed(String)}.
 */
public final class FieldParsers {

    /** day/month/year, one or two digit day and month, four digit year. */
    public static final DateTimeFormatter PURCHASE_DATE_FORMAT =
            DateTimeFormatter.ofPattern("d/M/uuuu", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);

    // First run of digits with an optional fractional part, or a bare fraction (".5").
    private static final Pattern NUMERIC_RUN = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    // More integer digits than this can never fit an int, whatever the scaling.
    private static final int MAX_INTEGER_DIGITS = 12;

    private FieldParsers() {}

    /**
     * Absent or empty identifiers are missing; anything else is stringified as is.
     */
    public static FieldOutcome<String> identifier(Object raw) {
        if (raw == null) return FieldOutcome.missing();
        String s = String.valueOf(raw);
        return s.isEmpty() ? FieldOutcome.missing() : FieldOutcome.parsed(s);
    }

    /**
     * Lower-cases then strips surrounding whitespace. Non-string values are stringified first.
     */
    public static FieldOutcome<String> text(Object raw) {
        if (raw == null) return FieldOutcome.missing();
        try {
            return FieldOutcome.parsed(String.valueOf(raw).toLowerCase(Locale.ROOT).strip());
        } catch (RuntimeException e) {
            return FieldOutcome.malformed("text normalization failed: " + e.getMessage());
        }
    }

    /**
     * Major currency amount to integer minor units: {@code value * 100}, truncated toward zero.
     * Uses exact decimal arithmetic, so "0.29" is 29 cents.
     */
    public static FieldOutcome<Integer> cents(Object raw) {
        if (raw == null) return FieldOutcome.missing();
        BigDecimal amount = decimalOrNull(raw);
        if (amount == null) {
            return FieldOutcome.malformed("not a decimal amount: '" + raw + "'");
        }
        // Checked before any rescaling: "9e99999999" is short text but a huge number.
        int digits = integerDigits(amount);
        if (digits > MAX_INTEGER_DIGITS) {
            return FieldOutcome.malformed("amount out of range: '" + raw + "'");
        }
        if (digits < -2) {
            return FieldOutcome.parsed(0);
        }
        try {
            return FieldOutcome.parsed(amount.multiply(HUNDRED).setScale(0, RoundingMode.DOWN).intValueExact());
        } catch (ArithmeticException e) {
            return FieldOutcome.malformed("amount out of range: '" + raw + "'");
        }
    }

    /**
     * Like {@link #cents(Object)}, but first extracts the first numeric run embedded in the
     * value, so currency symbols and unit suffixes are tolerated ("R$ 12.50" is 1250).
     */
    public static FieldOutcome<Integer> embeddedCents(Object raw) {
        if (raw == null) return FieldOutcome.missing();
        Matcher m = NUMERIC_RUN.matcher(String.valueOf(raw));
        if (!m.find()) {
            return FieldOutcome.malformed("no numeric value in '" + raw + "'");
        }
        FieldOutcome<Integer> parsed = cents(m.group(1));
        return parsed.isParsed()
                ? parsed
                : FieldOutcome.malformed(parsed.detail() + " (extracted from '" + raw + "')");
    }

    /**
     * Whole numbers. Integral strings parse directly; fractional numbers are truncated toward zero;
     * fractional strings are malformed.
     */
    public static FieldOutcome<Integer> integer(Object raw) {
        if (raw == null) return FieldOutcome.missing();
        try {
            if (raw instanceof Integer i) {
                return FieldOutcome.parsed(i);
            }
            if (raw instanceof Long || raw instanceof Short || raw instanceof Byte || raw instanceof BigInteger) {
                return FieldOutcome.parsed(new BigInteger(raw.toString()).intValueExact());
            }
            if (raw instanceof Number n) {
                BigDecimal d = decimalOrNull(n);
                if (d == null) return FieldOutcome.malformed("not a finite number: '" + raw + "'");
                int digits = integerDigits(d);
                if (digits > MAX_INTEGER_DIGITS) return FieldOutcome.malformed("not an integer: '" + raw + "'");
                if (digits < 1) return FieldOutcome.parsed(0);
                return FieldOutcome.parsed(d.setScale(0, RoundingMode.DOWN).intValueExact());
            }
            if (raw instanceof CharSequence cs) {
                return FieldOutcome.parsed(Integer.parseInt(cs.toString().strip()));
            }
        } catch (NumberFormatException | ArithmeticException e) {
            return FieldOutcome.malformed("not an integer: '" + raw + "'");
        }
        return FieldOutcome.malformed("unsupported integer type " + raw.getClass().getSimpleName() + ": '" + raw + "'");
    }

    /**
     * Floating point coordinates. Non-finite values are malformed.
     */
    public static FieldOutcome<Double> decimal(Object raw) {
        if (raw == null) return FieldOutcome.missing();
        BigDecimal d = decimalOrNull(raw);
        if (d == null) {
            return FieldOutcome.malformed("not a number: '" + raw + "'");
        }
        double v = d.doubleValue();
        if (Double.isInfinite(v)) {
            return FieldOutcome.malformed("number out of range: '" + raw + "'");
        }
        return FieldOutcome.parsed(v);
    }

    /**
     * Strict {@code day/month/year}. Blank strings are missing; surrounding whitespace is not accepted.
     */
    public static FieldOutcome<LocalDate> purchaseDate(Object raw) {
        if (raw == null) return FieldOutcome.missing();
        if (!(raw instanceof CharSequence)) {
            return FieldOutcome.malformed("date is not a string: '" + raw + "'");
        }
        String s = raw.toString();
        if (s.isBlank()) return FieldOutcome.missing();
        try {
            return FieldOutcome.parsed(LocalDate.parse(s, PURCHASE_DATE_FORMAT));
        } catch (DateTimeParseException e) {
            return FieldOutcome.malformed("date '" + s + "' does not match dd/MM/yyyy");
        }
    }

    // --- Helpers ---

    /**
     * Digits left of the decimal point, negative for magnitudes below 0.1.
     * {@code |value| < 10^integerDigits} always holds.
     */
    private static int integerDigits(BigDecimal value) {
        return value.precision() - value.scale();
    }

    private static BigDecimal decimalOrNull(Object raw) {
        if (raw instanceof Boolean) return null;
        if (raw instanceof BigDecimal bd) return bd;
        if (raw instanceof Double d && (d.isNaN() || d.isInfinite())) return null;
        if (raw instanceof Float f && (f.isNaN() || f.isInfinite())) return null;
        try {
            return new BigDecimal(String.valueOf(raw).strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
