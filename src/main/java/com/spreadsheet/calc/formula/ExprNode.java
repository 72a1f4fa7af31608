package com.spreadsheet.calc.formula;

/**
 * Base of the formula expression tree. A tree belongs to exactly one cell.
 * Subclasses are final and hold data only; evaluation lives in {@link Evaluator}.
 */
public abstract class ExprNode {

    private final int position;

    protected ExprNode(int position) {
        this.position = position;
    }

    public abstract NodeKind getKind();

    /**
     * Offset of the token this node was built from, within the cell text.
     */
    public int getPosition() {
        return position;
    }
}
