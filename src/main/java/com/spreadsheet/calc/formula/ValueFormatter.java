package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Canonical text forms of values, shared by display, export and the "&amp;" operator.
 */
public final class ValueFormatter {

    private static final MathContext DISPLAY_PRECISION = new MathContext(15, RoundingMode.HALF_UP);
    private static final double LARGEST_PLAIN_INTEGER = 1e15;

    private ValueFormatter() {
    }

    /**
     * Text shown in the grid: errors become their short code, empty becomes "".
     */
    public static String display(CellValue value) {
        if (value.isError()) {
            return value.getError().getCode();
        }
        return toText(value);
    }

    /**
     * Text form used when a value is needed as a string. Not defined for errors.
     */
    public static String toText(CellValue value) {
        switch (value.getType()) {
            case EMPTY:
                return "";
            case NUMBER:
                return formatNumber(value.getNumber());
            case TEXT:
                return value.getText();
            case BOOLEAN:
                return value.getBoolean() ? "TRUE" : "FALSE";
            default:
                throw new IllegalArgumentException("No text form for " + value);
        }
    }

    /**
     * Integers print without a decimal point; anything else is rounded
     * to 15 significant digits with trailing zeros removed, never in exponent form.
     */
    public static String formatNumber(double number) {
        if (number == 0) {
            return "0";
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return ErrorKind.INVALID_NUMBER.getCode();
        }
        if (number == Math.rint(number) && Math.abs(number) < LARGEST_PLAIN_INTEGER) {
            return Long.toString((long) number);
        }
        return new BigDecimal(number).round(DISPLAY_PRECISION).stripTrailingZeros().toPlainString();
    }
}
