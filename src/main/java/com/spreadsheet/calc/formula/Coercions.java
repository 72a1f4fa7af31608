package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.exceptions.EvaluationException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

import java.util.Locale;

/**
 * Conversions applied when an operator or function needs a specific value type.
 * A value that cannot be converted aborts evaluation with TYPE_MISMATCH.
 */
public final class Coercions {

    private Coercions() {
    }

    /**
     * NUMBER as is, EMPTY as 0, BOOLEAN as 1 or 0.
     */
    public static double toNumber(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case EMPTY:
                return 0;
            case BOOLEAN:
                return value.getBoolean() ? 1 : 0;
            default:
                throw new EvaluationException(ErrorKind.TYPE_MISMATCH,
                        "Expected a number, got " + describe(value));
        }
    }

    public static String toText(CellValue value) {
        return ValueFormatter.toText(value);
    }

    /**
     * BOOLEAN as is, numbers are true when non-zero, EMPTY is false,
     * and the texts "TRUE"/"FALSE" in any case.
     */
    public static boolean toBoolean(CellValue value) {
        switch (value.getType()) {
            case BOOLEAN:
                return value.getBoolean();
            case NUMBER:
                return value.getNumber() != 0;
            case EMPTY:
                return false;
            case TEXT:
                String text = value.getText().trim().toUpperCase(Locale.ROOT);
                if ("TRUE".equals(text) || "FALSE".equals(text)) {
                    return "TRUE".equals(text);
                }
                throw new EvaluationException(ErrorKind.TYPE_MISMATCH,
                        "Expected a logical value, got " + describe(value));
            default:
                throw new EvaluationException(ErrorKind.TYPE_MISMATCH,
                        "Expected a logical value, got " + describe(value));
        }
    }

    /**
     * Wraps an arithmetic result, rejecting NaN and infinities.
     */
    public static CellValue checkedNumber(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new EvaluationException(ErrorKind.INVALID_NUMBER, "Result is not a finite number");
        }
        return CellValue.number(number);
    }

    private static String describe(CellValue value) {
        return value.isText() ? "text \"" + value.getText() + "\"" : value.getType().name().toLowerCase(Locale.ROOT);
    }
}
