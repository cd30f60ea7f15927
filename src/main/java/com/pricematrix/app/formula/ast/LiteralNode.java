package com.pricematrix.app.formula.ast;

import com.pricematrix.app.models.Value;

public class LiteralNode extends FormulaNode {

    private final Value value;

    public LiteralNode(Value value) {
        this.value = value;
    }

    public Value getValue() {
        return value;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
