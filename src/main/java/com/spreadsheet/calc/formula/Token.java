package com.spreadsheet.calc.formula;

import java.util.Objects;

/**
 * A typed slice of formula text. For STRING tokens the text is the decoded
 * string value; for FUNCTION tokens it is the upper-cased name.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int position;

    public Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token token = (Token) o;
        return position == token.position && type == token.type && text.equals(token.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, position);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
