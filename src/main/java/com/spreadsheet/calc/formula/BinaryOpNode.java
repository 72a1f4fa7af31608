package com.spreadsheet.calc.formula;

public final class BinaryOpNode extends ExprNode {
    private final Operator operator;
    private final ExprNode left;
    private final ExprNode right;

    public BinaryOpNode(Operator operator, ExprNode left, ExprNode right, int position) {
        super(position);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY_OP;
    }

    public Operator getOperator() {
        return operator;
    }

    public ExprNode getLeft() {
        return left;
    }

    public ExprNode getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
