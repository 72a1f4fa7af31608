package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.exceptions.FormulaSyntaxException;
import com.spreadsheet.calc.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical analyzer for formula text.
 * Converts a formula body (the text after "=") into a list of tokens.
 * Token positions are offsets into the string handed to {@link #tokenize(String, int)}.
 */
public final class Tokenizer {

    // Column letters followed by row digits, e.g. "A1", "bc20"
    private static final Pattern REFERENCE_PATTERN = Pattern.compile("[A-Za-z]+[0-9]+");

    private Tokenizer() {
    }

    public static List<Token> tokenize(String text) {
        return tokenize(text, 0);
    }

    /**
     * Tokenizes {@code text} starting at {@code start}; used to skip the leading "=".
     */
    public static List<Token> tokenize(String text, int start) {
        List<Token> tokens = new ArrayList<>();
        int i = start;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (isDigit(c) || (c == '.' && i + 1 < text.length() && isDigit(text.charAt(i + 1)))) {
                i = readNumber(text, i, tokens);
                continue;
            }
            if (c == '"') {
                i = readString(text, i, tokens);
                continue;
            }
            if (isWordStart(c)) {
                i = readWord(text, i, tokens);
                continue;
            }
            switch (c) {
                case '(':
                case '[':
                case '{':
                    tokens.add(new Token(TokenType.LEFT_PAREN, String.valueOf(c), i));
                    i++;
                    continue;
                case ')':
                case ']':
                case '}':
                    tokens.add(new Token(TokenType.RIGHT_PAREN, String.valueOf(c), i));
                    i++;
                    continue;
                case ',':
                    tokens.add(new Token(TokenType.COMMA, ",", i));
                    i++;
                    continue;
                case '<':
                    if (i + 1 < text.length() && (text.charAt(i + 1) == '=' || text.charAt(i + 1) == '>')) {
                        tokens.add(new Token(TokenType.OPERATOR, text.substring(i, i + 2), i));
                        i += 2;
                    } else {
                        tokens.add(new Token(TokenType.OPERATOR, "<", i));
                        i++;
                    }
                    continue;
                case '>':
                    if (i + 1 < text.length() && text.charAt(i + 1) == '=') {
                        tokens.add(new Token(TokenType.OPERATOR, ">=", i));
                        i += 2;
                    } else {
                        tokens.add(new Token(TokenType.OPERATOR, ">", i));
                        i++;
                    }
                    continue;
                case '+':
                case '-':
                case '*':
                case '/':
                case '^':
                case '&':
                case '=':
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i));
                    i++;
                    continue;
                default:
                    throw new FormulaSyntaxException(ErrorKind.UNRECOGNIZED_CHARACTER, i,
                            "Unrecognized character '" + c + "'");
            }
        }
        return tokens;
    }

    private static int readNumber(String text, int start, List<Token> tokens) {
        int i = start;
        while (i < text.length() && isDigit(text.charAt(i))) {
            i++;
        }
        if (i < text.length() && text.charAt(i) == '.') {
            i++;
            while (i < text.length() && isDigit(text.charAt(i))) {
                i++;
            }
        }
        // Exponent only counts when digits follow, so "2e" stays a number and a word
        if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < text.length() && (text.charAt(j) == '+' || text.charAt(j) == '-')) {
                j++;
            }
            if (j < text.length() && isDigit(text.charAt(j))) {
                i = j;
                while (i < text.length() && isDigit(text.charAt(i))) {
                    i++;
                }
            }
        }
        tokens.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
        return i;
    }

    private static int readString(String text, int start, List<Token> tokens) {
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"') {
                // A doubled quote is an escaped quote
                if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    value.append('"');
                    i += 2;
                    continue;
                }
                tokens.add(new Token(TokenType.STRING, value.toString(), start));
                return i + 1;
            }
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                switch (next) {
                    case 'n':
                        value.append('\n');
                        break;
                    case 't':
                        value.append('\t');
                        break;
                    default:
                        value.append(next);
                }
                i += 2;
                continue;
            }
            value.append(c);
            i++;
        }
        throw new FormulaSyntaxException(ErrorKind.UNTERMINATED_STRING, start, "Missing closing quote");
    }

    private static int readWord(String text, int start, List<Token> tokens) {
        int i = readWordEnd(text, start);
        String word = text.substring(start, i);

        int next = skipSpaces(text, i);
        if (next < text.length() && text.charAt(next) == '(') {
            tokens.add(new Token(TokenType.FUNCTION, word.toUpperCase(Locale.ROOT), start));
            return i;
        }
        if (REFERENCE_PATTERN.matcher(word).matches()) {
            if (i < text.length() && text.charAt(i) == ':') {
                int secondStart = i + 1;
                int secondEnd = secondStart < text.length() && isWordStart(text.charAt(secondStart))
                        ? readWordEnd(text, secondStart) : secondStart;
                String second = text.substring(secondStart, secondEnd);
                if (!REFERENCE_PATTERN.matcher(second).matches()) {
                    throw new FormulaSyntaxException(ErrorKind.UNRECOGNIZED_CHARACTER, i,
                            "Range '" + word + ":' must end with a cell reference");
                }
                tokens.add(new Token(TokenType.RANGE, word + ":" + second, start));
                return secondEnd;
            }
            tokens.add(new Token(TokenType.REFERENCE, word, start));
            return i;
        }
        if ("TRUE".equalsIgnoreCase(word) || "FALSE".equalsIgnoreCase(word)) {
            tokens.add(new Token(TokenType.BOOLEAN, word.toUpperCase(Locale.ROOT), start));
            return i;
        }
        tokens.add(new Token(TokenType.IDENTIFIER, word, start));
        return i;
    }

    private static int readWordEnd(String text, int start) {
        int i = start;
        while (i < text.length() && isWordPart(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipSpaces(String text, int start) {
        int i = start;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isWordPart(char c) {
        return isWordStart(c) || isDigit(c);
    }
}
