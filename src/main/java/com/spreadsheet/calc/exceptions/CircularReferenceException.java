package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.CellAddress;

/**
 * Thrown when a write would make a cell depend on itself,
 * either directly (A1 = A1 + 1) or through a loop of several cells.
 * The rejected write has already been rolled back when this is thrown.
 */
public class CircularReferenceException extends RuntimeException {
    private final CellAddress address;

    public CircularReferenceException(CellAddress address, String message) {
        super(message);
        this.address = address;
    }

    public CellAddress getAddress() {
        return address;
    }
}
