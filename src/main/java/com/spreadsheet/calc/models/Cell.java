package com.spreadsheet.calc.models;

import com.spreadsheet.calc.formula.ExprNode;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its address
 * - rawValue (literal text, or a formula starting with "=")
 * - expression (the parsed formula tree, null for literals and empty cells)
 * - evaluatedValue (the cached result of the last evaluation)
 * - dirty flag, set while a recalculation pass has scheduled but not yet reached the cell
 */
public class Cell {
    private final CellAddress address;
    private String rawValue = "";
    private ExprNode expression;
    private CellValue evaluatedValue = CellValue.empty();
    private boolean dirty = false;

    public Cell(CellAddress address) {
        this.address = address;
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getRawValue() {
        return rawValue;
    }

    public ExprNode getExpression() {
        return expression;
    }

    public boolean isFormula() {
        return expression != null;
    }

    /**
     * Replaces the content. Literal content has no expression and its value is
     * known immediately; formula content gets its value from the next evaluation.
     */
    public void setContent(String rawValue, ExprNode expression, CellValue literalValue) {
        this.rawValue = rawValue;
        this.expression = expression;
        if (expression == null) {
            setEvaluatedValue(literalValue);
        } else {
            this.dirty = true;
        }
    }

    public void clear() {
        setContent("", null, CellValue.empty());
    }

    public CellValue getEvaluatedValue() {
        return evaluatedValue;
    }

    public void setEvaluatedValue(CellValue evaluatedValue) {
        this.evaluatedValue = evaluatedValue;
        this.dirty = false;
    }

    public void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * Whether the cell has anything to show: content, or an error left by a rejected write.
     */
    public boolean isPopulated() {
        return !rawValue.isEmpty() || evaluatedValue.isError();
    }

    public CellState getState() {
        if (evaluatedValue.isError()) {
            return CellState.ERROR;
        }
        if (expression != null) {
            return CellState.FORMULA;
        }
        return rawValue.isEmpty() ? CellState.EMPTY : CellState.LITERAL;
    }
}
