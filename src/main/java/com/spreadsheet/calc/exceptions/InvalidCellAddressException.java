package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a caller passes text that is not a cell address,
 * for example "A0", "12" or "B-3".
 */
public class InvalidCellAddressException extends RuntimeException {
    public InvalidCellAddressException(String message) {
        super(message);
    }
}
