package com.spreadsheet.calc.models;

/**
 * Closed set of reasons a cell can fail.
 * Each kind carries the short code shown in the grid, except PROPAGATED_ERROR
 * which is displayed with the code of the error it passes along.
 */
public enum ErrorKind {
    // Syntax
    UNTERMINATED_STRING(ErrorCategory.SYNTAX, "#SYNTAX!"),
    UNRECOGNIZED_CHARACTER(ErrorCategory.SYNTAX, "#SYNTAX!"),
    EMPTY_EXPRESSION(ErrorCategory.SYNTAX, "#SYNTAX!"),
    UNBALANCED_PARENS(ErrorCategory.SYNTAX, "#SYNTAX!"),
    UNEXPECTED_TOKEN(ErrorCategory.SYNTAX, "#SYNTAX!"),
    INVALID_REFERENCE(ErrorCategory.SYNTAX, "#REF!"),

    // Evaluation
    TYPE_MISMATCH(ErrorCategory.EVALUATION, "#VALUE!"),
    DIVIDE_BY_ZERO(ErrorCategory.EVALUATION, "#DIV/0!"),
    ARGUMENT_COUNT(ErrorCategory.EVALUATION, "#N/A"),
    UNKNOWN_FUNCTION(ErrorCategory.EVALUATION, "#NAME?"),
    // No code of its own; the grid shows the code of the root kind
    PROPAGATED_ERROR(ErrorCategory.EVALUATION, null),
    CIRCULAR_REFERENCE(ErrorCategory.EVALUATION, "#CIRC!"),
    INVALID_NUMBER(ErrorCategory.EVALUATION, "#NUM!");

    private final ErrorCategory category;
    private final String code;

    ErrorKind(ErrorCategory category, String code) {
        this.category = category;
        this.code = code;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public boolean isSyntax() {
        return category == ErrorCategory.SYNTAX;
    }
}
