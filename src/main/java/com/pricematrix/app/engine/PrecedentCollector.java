package com.pricematrix.app.engine;

import com.pricematrix.app.formula.ast.BinaryOpNode;
import com.pricematrix.app.formula.ast.CellRefNode;
import com.pricematrix.app.formula.ast.FormulaNode;
import com.pricematrix.app.formula.ast.FormulaVisitor;
import com.pricematrix.app.formula.ast.FunctionCallNode;
import com.pricematrix.app.formula.ast.LiteralNode;
import com.pricematrix.app.formula.ast.RangeRefNode;
import com.pricematrix.app.formula.ast.UnaryOpNode;
import com.pricematrix.app.models.CellAddress;
import com.pricematrix.app.models.CellRange;

import java.util.HashSet;
import java.util.Set;

/**
 * Gathers every address a formula reads. Ranges expand to their cells, clipped to the
 * matrix bounds, so that writing to a still-empty cell inside a range reaches its readers.
 */
public final class PrecedentCollector implements FormulaVisitor<Void> {

    private final int maxRows;
    private final int maxColumns;
    private final Set<CellAddress> addresses = new HashSet<>();

    private PrecedentCollector(int maxRows, int maxColumns) {
        this.maxRows = maxRows;
        this.maxColumns = maxColumns;
    }

    public static Set<CellAddress> collect(FormulaNode formula, int maxRows, int maxColumns) {
        PrecedentCollector collector = new PrecedentCollector(maxRows, maxColumns);
        formula.accept(collector);
        return collector.addresses;
    }

    @Override
    public Void visitLiteral(LiteralNode node) {
        return null;
    }

    @Override
    public Void visitCellRef(CellRefNode node) {
        addresses.add(node.getReference().getAddress());
        return null;
    }

    @Override
    public Void visitRangeRef(RangeRefNode node) {
        CellRange clipped = node.getRange().clip(maxRows, maxColumns);
        if (clipped != null) {
            addresses.addAll(clipped.addresses());
        }
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCallNode node) {
        for (FormulaNode arg : node.getArguments()) {
            arg.accept(this);
        }
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOpNode node) {
        node.getLeft().accept(this);
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitUnaryOp(UnaryOpNode node) {
        node.getOperand().accept(this);
        return null;
    }
}
