package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a sheet ID is not (or no longer) held by the service.
 */
public class SheetNotFoundException extends RuntimeException {
    private final long sheetId;

    public SheetNotFoundException(long sheetId) {
        super("Sheet not found: " + sheetId);
        this.sheetId = sheetId;
    }

    public long getSheetId() {
        return sheetId;
    }
}
