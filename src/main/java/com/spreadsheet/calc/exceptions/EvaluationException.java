package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.ErrorKind;

/**
 * Aborts the evaluation of a single formula. The evaluator catches it and
 * stores the carried error as the cell's value, so it never leaves the engine.
 */
public class EvaluationException extends RuntimeException {
    private final CellError error;

    public EvaluationException(CellError error) {
        super(error.getMessage());
        this.error = error;
    }

    public EvaluationException(ErrorKind kind, String message) {
        this(CellError.of(kind, message));
    }

    public CellError getError() {
        return error;
    }
}
