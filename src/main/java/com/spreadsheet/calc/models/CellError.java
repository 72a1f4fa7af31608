package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Error state of a cell: the kind, a human-readable message and,
 * for errors passed along from a referenced cell, the kind that started it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CellError {

    private final ErrorKind kind;
    private final ErrorKind rootKind;
    private final String message;
    // Offset inside the formula text, syntax errors only
    private final Integer position;

    private CellError(ErrorKind kind, ErrorKind rootKind, String message, Integer position) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.rootKind = Objects.requireNonNull(rootKind, "rootKind");
        this.message = message;
        this.position = position;
    }

    public static CellError of(ErrorKind kind, String message) {
        return new CellError(kind, kind, message, null);
    }

    public static CellError syntax(ErrorKind kind, String message, int position) {
        return new CellError(kind, kind, message, position);
    }

    /**
     * Wraps the error of a referenced cell. The root kind is kept
     * so a chain of references still reports the original failure.
     */
    public static CellError propagated(CellError source, CellAddress from) {
        return new CellError(ErrorKind.PROPAGATED_ERROR, source.rootKind,
                "Referenced cell " + from + " has an error: " + source.rootKind, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ErrorKind getRootKind() {
        return rootKind;
    }

    public String getMessage() {
        return message;
    }

    public Integer getPosition() {
        return position;
    }

    public String getCode() {
        return rootKind.getCode();
    }

    @JsonIgnore
    public boolean isSyntax() {
        return kind.isSyntax();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellError)) {
            return false;
        }
        CellError that = (CellError) o;
        return kind == that.kind && rootKind == that.rootKind
                && Objects.equals(message, that.message)
                && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rootKind, message, position);
    }

    @Override
    public String toString() {
        return kind + (rootKind != kind ? "(" + rootKind + ")" : "") + ": " + message;
    }
}
