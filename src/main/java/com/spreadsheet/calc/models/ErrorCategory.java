package com.spreadsheet.calc.models;

/**
 * SYNTAX errors are reported when a cell is written;
 * EVALUATION errors are produced during recalculation and stored as values.
 */
public enum ErrorCategory {
    SYNTAX,
    EVALUATION
}
