package com.spreadsheet.calc.formula;

public final class UnaryOpNode extends ExprNode {
    private final Operator operator;
    private final ExprNode operand;

    public UnaryOpNode(Operator operator, ExprNode operand, int position) {
        super(position);
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY_OP;
    }

    public Operator getOperator() {
        return operator;
    }

    public ExprNode getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return "(" + operator.getSymbol() + operand + ")";
    }
}
