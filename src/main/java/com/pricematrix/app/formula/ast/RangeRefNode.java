package com.pricematrix.app.formula.ast;

import com.pricematrix.app.formula.CellReference;
import com.pricematrix.app.models.CellRange;

/**
 * "A1:B2" in either corner order. {@link #getRange()} is always normalized ascending.
 */
public class RangeRefNode extends FormulaNode {

    private final CellReference first;
    private final CellReference second;
    private final CellRange range;

    public RangeRefNode(CellReference first, CellReference second) {
        this.first = first;
        this.second = second;
        this.range = new CellRange(first.getAddress(), second.getAddress());
    }

    public CellReference getFirst() {
        return first;
    }

    public CellReference getSecond() {
        return second;
    }

    public CellRange getRange() {
        return range;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitRangeRef(this);
    }
}
