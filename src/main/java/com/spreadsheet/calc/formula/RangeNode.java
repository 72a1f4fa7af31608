package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;

import java.util.ArrayList;
import java.util.List;

/**
 * A rectangular block of cells such as A1:B3. Corners are normalized,
 * so B3:A1 covers the same cells.
 */
public final class RangeNode extends ExprNode {
    private final CellAddress topLeft;
    private final CellAddress bottomRight;

    public RangeNode(CellAddress first, CellAddress second, int position) {
        super(position);
        this.topLeft = CellAddress.of(Math.min(first.getColumn(), second.getColumn()),
                Math.min(first.getRow(), second.getRow()));
        this.bottomRight = CellAddress.of(Math.max(first.getColumn(), second.getColumn()),
                Math.max(first.getRow(), second.getRow()));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RANGE;
    }

    public CellAddress getTopLeft() {
        return topLeft;
    }

    public CellAddress getBottomRight() {
        return bottomRight;
    }

    public long size() {
        long columns = (long) bottomRight.getColumn() - topLeft.getColumn() + 1;
        long rows = (long) bottomRight.getRow() - topLeft.getRow() + 1;
        return columns * rows;
    }

    /**
     * Every address in the range, row by row.
     */
    public List<CellAddress> cells() {
        List<CellAddress> cells = new ArrayList<>();
        // long counters, so a range ending at Integer.MAX_VALUE terminates
        for (long row = topLeft.getRow(); row <= bottomRight.getRow(); row++) {
            for (long column = topLeft.getColumn(); column <= bottomRight.getColumn(); column++) {
                cells.add(CellAddress.of((int) column, (int) row));
            }
        }
        return cells;
    }

    @Override
    public String toString() {
        return topLeft + ":" + bottomRight;
    }
}
