package com.spreadsheet.calc.models;

/**
 * Enumerates the kinds of value a cell can hold once computed.
 */
public enum ValueType {
    EMPTY,
    NUMBER,
    TEXT,
    BOOLEAN,
    ERROR
}
