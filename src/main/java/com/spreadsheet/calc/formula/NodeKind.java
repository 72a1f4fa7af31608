package com.spreadsheet.calc.formula;

/**
 * The closed set of expression node kinds. The evaluator switches over this
 * enum, so adding a kind means handling it there.
 */
public enum NodeKind {
    LITERAL,
    REFERENCE,
    RANGE,
    UNARY_OP,
    BINARY_OP,
    CALL
}
