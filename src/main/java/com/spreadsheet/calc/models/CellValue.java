package com.spreadsheet.calc.models;

import java.util.Objects;

/**
 * Immutable computed value of a cell or sub-expression.
 * Exactly one payload is meaningful, chosen by {@link #getType()}.
 */
public final class CellValue {

    private static final CellValue EMPTY = new CellValue(ValueType.EMPTY, 0d, null, false, null);
    private static final CellValue TRUE = new CellValue(ValueType.BOOLEAN, 0d, null, true, null);
    private static final CellValue FALSE = new CellValue(ValueType.BOOLEAN, 0d, null, false, null);

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final CellError error;

    private CellValue(ValueType type, double number, String text, boolean bool, CellError error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue number(double value) {
        return new CellValue(ValueType.NUMBER, value, null, false, null);
    }

    public static CellValue text(String value) {
        return new CellValue(ValueType.TEXT, 0d, Objects.requireNonNull(value, "text"), false, null);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue error(CellError error) {
        return new CellValue(ValueType.ERROR, 0d, null, false, Objects.requireNonNull(error, "error"));
    }

    public static CellValue error(ErrorKind kind, String message) {
        return error(CellError.of(kind, message));
    }

    public ValueType getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isText() {
        return type == ValueType.TEXT;
    }

    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public double getNumber() {
        requireType(ValueType.NUMBER);
        return number;
    }

    public String getText() {
        requireType(ValueType.TEXT);
        return text;
    }

    public boolean getBoolean() {
        requireType(ValueType.BOOLEAN);
        return bool;
    }

    public CellError getError() {
        requireType(ValueType.ERROR);
        return error;
    }

    private void requireType(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Value is " + type + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        if (type != that.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, that.number) == 0;
            case TEXT:
                return text.equals(that.text);
            case BOOLEAN:
                return bool == that.bool;
            case ERROR:
                return error.equals(that.error);
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NUMBER:
                return Objects.hash(type, number);
            case TEXT:
                return Objects.hash(type, text);
            case BOOLEAN:
                return Objects.hash(type, bool);
            case ERROR:
                return Objects.hash(type, error);
            default:
                return type.hashCode();
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return "NUMBER(" + number + ")";
            case TEXT:
                return "TEXT(" + text + ")";
            case BOOLEAN:
                return "BOOLEAN(" + bool + ")";
            case ERROR:
                return "ERROR(" + error + ")";
            default:
                return "EMPTY";
        }
    }
}
