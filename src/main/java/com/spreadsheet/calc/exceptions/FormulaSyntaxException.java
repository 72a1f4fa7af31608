package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.ErrorKind;

/**
 * Thrown by the tokenizer and parser when formula text is malformed.
 * Carries the syntax error kind and the 0-based offset of the offending input.
 */
public class FormulaSyntaxException extends RuntimeException {
    private final ErrorKind kind;
    private final int position;

    public FormulaSyntaxException(ErrorKind kind, int position, String message) {
        super(message + " (at position " + position + ")");
        this.kind = kind;
        this.position = position;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    public CellError toCellError() {
        return CellError.syntax(kind, getMessage(), position);
    }
}
