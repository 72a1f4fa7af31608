package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;

public final class ReferenceNode extends ExprNode {
    private final CellAddress address;

    public ReferenceNode(CellAddress address, int position) {
        super(position);
        this.address = address;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.REFERENCE;
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return address.toString();
    }
}
