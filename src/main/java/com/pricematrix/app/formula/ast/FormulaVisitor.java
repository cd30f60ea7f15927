package com.pricematrix.app.formula.ast;

public interface FormulaVisitor<R> {

    R visitLiteral(LiteralNode node);

    R visitCellRef(CellRefNode node);

    R visitRangeRef(RangeRefNode node);

    R visitFunctionCall(FunctionCallNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitUnaryOp(UnaryOpNode node);
}
