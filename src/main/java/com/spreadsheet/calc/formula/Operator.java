package com.spreadsheet.calc.formula;

/**
 * Operators understood by the formula parser with their precedence and associativity.
 * Higher precedence binds tighter. Lowest to highest:
 * comparisons, "&amp;", "+ -", "* /", unary sign, "^".
 */
public enum Operator {
    EQUAL("=", 1, Associativity.LEFT, false),
    NOT_EQUAL("<>", 1, Associativity.LEFT, false),
    LESS("<", 1, Associativity.LEFT, false),
    GREATER(">", 1, Associativity.LEFT, false),
    LESS_OR_EQUAL("<=", 1, Associativity.LEFT, false),
    GREATER_OR_EQUAL(">=", 1, Associativity.LEFT, false),
    CONCAT("&", 2, Associativity.LEFT, false),
    ADD("+", 3, Associativity.LEFT, false),
    SUBTRACT("-", 3, Associativity.LEFT, false),
    MULTIPLY("*", 4, Associativity.LEFT, false),
    DIVIDE("/", 4, Associativity.LEFT, false),
    NEGATE("-", 5, Associativity.RIGHT, true),
    UNARY_PLUS("+", 5, Associativity.RIGHT, true),
    POWER("^", 6, Associativity.RIGHT, false);

    public enum Associativity {
        LEFT,
        RIGHT
    }

    private final String symbol;
    private final int precedence;
    private final Associativity associativity;
    private final boolean unary;

    Operator(String symbol, int precedence, Associativity associativity, boolean unary) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
        this.unary = unary;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public Associativity getAssociativity() {
        return associativity;
    }

    public boolean isUnary() {
        return unary;
    }

    /**
     * Whether an operator already on the stack must be applied before {@code incoming} is pushed.
     */
    public boolean appliesBefore(Operator incoming) {
        return precedence > incoming.precedence
                || (precedence == incoming.precedence && incoming.associativity == Associativity.LEFT);
    }

    public static Operator binary(String symbol) {
        return find(symbol, false);
    }

    public static Operator unary(String symbol) {
        return find(symbol, true);
    }

    private static Operator find(String symbol, boolean unary) {
        for (Operator op : values()) {
            if (op.unary == unary && op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }
}
