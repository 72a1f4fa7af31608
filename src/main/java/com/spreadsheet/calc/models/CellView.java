package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read-only snapshot of one cell for the grid front end:
 * what the user typed, what to show, and the error (if any) behind it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellView {
    private final String address;
    private final String content;
    private final String display;
    private final CellState state;
    private final ValueType type;
    private final CellError error;

    public CellView(String address, String content, String display, CellState state, ValueType type,
                    CellError error) {
        this.address = address;
        this.content = content;
        this.display = display;
        this.state = state;
        this.type = type;
        this.error = error;
    }

    public String getAddress() {
        return address;
    }

    public String getContent() {
        return content;
    }

    public String getDisplay() {
        return display;
    }

    public CellState getState() {
        return state;
    }

    public ValueType getType() {
        return type;
    }

    public CellError getError() {
        return error;
    }
}
