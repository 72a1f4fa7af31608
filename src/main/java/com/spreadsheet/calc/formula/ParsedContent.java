package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellValue;

/**
 * Result of classifying cell text: a formula tree, or a literal value.
 */
public final class ParsedContent {
    private final ExprNode expression;
    private final CellValue literalValue;

    private ParsedContent(ExprNode expression, CellValue literalValue) {
        this.expression = expression;
        this.literalValue = literalValue;
    }

    public static ParsedContent formula(ExprNode expression) {
        return new ParsedContent(expression, null);
    }

    public static ParsedContent literal(CellValue value) {
        return new ParsedContent(null, value);
    }

    public boolean isFormula() {
        return expression != null;
    }

    public ExprNode getExpression() {
        return expression;
    }

    public CellValue getLiteralValue() {
        return literalValue;
    }
}
