package com.spreadsheet.calc.models;

/**
 * Lifecycle state of a cell as seen by callers.
 * EMPTY, LITERAL and FORMULA follow the content; ERROR wins whenever
 * the cached value is an error.
 */
public enum CellState {
    EMPTY,
    LITERAL,
    FORMULA,
    ERROR
}
