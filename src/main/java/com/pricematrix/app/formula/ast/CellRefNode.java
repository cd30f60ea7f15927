package com.pricematrix.app.formula.ast;

import com.pricematrix.app.formula.CellReference;

public class CellRefNode extends FormulaNode {

    private final CellReference reference;

    public CellRefNode(CellReference reference) {
        this.reference = reference;
    }

    public CellReference getReference() {
        return reference;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }
}
