package com.pricematrix.app.formula.ast;

public class UnaryOpNode extends FormulaNode {

    public enum Operator {
        NEGATE,
        PLUS
    }

    private final Operator operator;
    private final FormulaNode operand;

    public UnaryOpNode(Operator operator, FormulaNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public FormulaNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
