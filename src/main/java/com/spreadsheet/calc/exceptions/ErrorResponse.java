package com.spreadsheet.calc.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "SYNTAX_ERROR",
 *   "message": "Missing closing quote (at position 3)",
 *   "kind": "UNTERMINATED_STRING",
 *   "position": 3
 * }
 * "kind" and "position" are only present for syntax errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String code;
    private String message;
    private String kind;
    private Integer position;

    public ErrorResponse(String code, String message) {
        this(code, message, null, null);
    }

    public ErrorResponse(String code, String message, String kind, Integer position) {
        this.code = code;
        this.message = message;
        this.kind = kind;
        this.position = position;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getKind() {
        return kind;
    }

    public Integer getPosition() {
        return position;
    }
}
