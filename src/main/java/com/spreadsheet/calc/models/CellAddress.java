package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.calc.exceptions.InvalidCellAddressException;

import java.util.Objects;

/**
 * Identifies a cell by (column, row), both 1-based.
 * Column 1 is "A", 26 is "Z", 27 is "AA" and so on.
 * Ordering is row-major: first by row, then by column.
 */
public final class CellAddress implements Comparable<CellAddress> {

    private final int column;
    private final int row;

    public CellAddress(int column, int row) {
        if (column < 1 || row < 1) {
            throw new InvalidCellAddressException("Column and row must be positive, got column="
                    + column + ", row=" + row);
        }
        this.column = column;
        this.row = row;
    }

    public static CellAddress of(int column, int row) {
        return new CellAddress(column, row);
    }

    /**
     * Parses text such as "B2" or "aa10" (letters are case-insensitive).
     */
    public static CellAddress parse(String text) {
        if (text == null) {
            throw new InvalidCellAddressException("Cell address is missing");
        }
        String trimmed = text.trim();
        int i = 0;
        long column = 0;
        while (i < trimmed.length() && isAsciiLetter(trimmed.charAt(i))) {
            column = column * 26 + (Character.toUpperCase(trimmed.charAt(i)) - 'A' + 1);
            if (column > Integer.MAX_VALUE) {
                throw new InvalidCellAddressException("Column out of range in address: " + text);
            }
            i++;
        }
        if (i == 0 || i == trimmed.length()) {
            throw new InvalidCellAddressException("Not a cell address: " + text);
        }
        long row = 0;
        for (int j = i; j < trimmed.length(); j++) {
            char c = trimmed.charAt(j);
            if (c < '0' || c > '9') {
                throw new InvalidCellAddressException("Not a cell address: " + text);
            }
            row = row * 10 + (c - '0');
            if (row > Integer.MAX_VALUE) {
                throw new InvalidCellAddressException("Row out of range in address: " + text);
            }
        }
        if (row == 0) {
            throw new InvalidCellAddressException("Rows start at 1, got: " + text);
        }
        return new CellAddress((int) column, (int) row);
    }

    /**
     * Converts a 1-based column index to its letter code (1 -> "A", 28 -> "AB").
     */
    public static String columnName(int column) {
        StringBuilder sb = new StringBuilder();
        int n = column;
        while (n > 0) {
            n--;
            sb.append((char) ('A' + n % 26));
            n /= 26;
        }
        return sb.reverse().toString();
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    @Override
    public int compareTo(CellAddress other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return column == that.column && row == that.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row);
    }

    @JsonValue
    @Override
    public String toString() {
        return columnName(column) + row;
    }
}
