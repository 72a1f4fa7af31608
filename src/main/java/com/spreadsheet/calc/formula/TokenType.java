package com.spreadsheet.calc.formula;

/**
 * Lexical categories produced by the {@link Tokenizer}.
 */
public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    REFERENCE,
    RANGE,
    // Name directly followed by "("
    FUNCTION,
    // Any other bare word; never valid in a formula
    IDENTIFIER,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA
}
