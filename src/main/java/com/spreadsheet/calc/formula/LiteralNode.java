package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellValue;

public final class LiteralNode extends ExprNode {
    private final CellValue value;

    public LiteralNode(CellValue value, int position) {
        super(position);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LITERAL;
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
