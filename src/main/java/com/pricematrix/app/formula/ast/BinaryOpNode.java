package com.pricematrix.app.formula.ast;

public class BinaryOpNode extends FormulaNode {

    private final BinaryOperator operator;
    private final FormulaNode left;
    private final FormulaNode right;

    public BinaryOpNode(BinaryOperator operator, FormulaNode left, FormulaNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public FormulaNode getLeft() {
        return left;
    }

    public FormulaNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
