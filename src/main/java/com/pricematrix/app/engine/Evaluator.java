package com.pricematrix.app.engine;

import com.pricematrix.app.formula.ast.BinaryOpNode;
import com.pricematrix.app.formula.ast.BinaryOperator;
import com.pricematrix.app.formula.ast.CellRefNode;
import com.pricematrix.app.formula.ast.FormulaNode;
import com.pricematrix.app.formula.ast.FormulaVisitor;
import com.pricematrix.app.formula.ast.FunctionCallNode;
import com.pricematrix.app.formula.ast.LiteralNode;
import com.pricematrix.app.formula.ast.RangeRefNode;
import com.pricematrix.app.formula.ast.UnaryOpNode;
import com.pricematrix.app.functions.Coercion;
import com.pricematrix.app.functions.FunctionArgument;
import com.pricematrix.app.functions.FunctionLibrary;
import com.pricematrix.app.models.Cell;
import com.pricematrix.app.models.CellAddress;
import com.pricematrix.app.models.CellRange;
import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Matrix;
import com.pricematrix.app.models.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a formula tree against a matrix and produces a value. Errors come back as
 * error values; nothing is thrown across {@link #evaluate}.
 * <p>
 * A reference to a dirty formula cell is evaluated on demand and cached. The
 * 'visiting' set holds the cells whose evaluation is in progress; meeting one of
 * them again yields #CIRC! instead of recursing.
 */
@Component
public class Evaluator {

    private final FunctionLibrary functions;

    public Evaluator(FunctionLibrary functions) {
        this.functions = functions;
    }

    public Value evaluate(FormulaNode formula, Matrix matrix, Set<CellAddress> visiting) {
        return formula.accept(new Walker(matrix, visiting));
    }

    /**
     * Re-evaluates one cell if it holds an accepted formula and stores the result.
     * Literal, unparseable and circular cells keep the value set when they were written.
     *
     * @return true if a formula was evaluated
     */
    public boolean refresh(Matrix matrix, CellAddress address) {
        return refresh(matrix, address, new LinkedHashSet<>());
    }

    private boolean refresh(Matrix matrix, CellAddress address, Set<CellAddress> visiting) {
        Cell cell = matrix.getCell(address);
        if (cell == null) {
            return false;
        }
        if (cell.getFormula() == null) {
            cell.setDirty(false);
            return false;
        }
        if (matrix.getGraph().isRejected(address)) {
            cell.setValue(Value.error(ErrorType.CIRCULAR_REFERENCE));
            return false;
        }
        visiting.add(address);
        try {
            cell.setValue(evaluate(cell.getFormula(), matrix, visiting));
        } finally {
            visiting.remove(address);
        }
        return true;
    }

    private final class Walker implements FormulaVisitor<Value> {

        private final Matrix matrix;
        private final Set<CellAddress> visiting;

        Walker(Matrix matrix, Set<CellAddress> visiting) {
            this.matrix = matrix;
            this.visiting = visiting;
        }

        private Value resolve(CellAddress address) {
            Cell cell = matrix.getCell(address);
            if (cell == null) {
                return Value.BLANK;
            }
            if (visiting.contains(address)) {
                return Value.error(ErrorType.CIRCULAR_REFERENCE);
            }
            if (cell.isDirty()) {
                refresh(matrix, address, visiting);
            }
            return cell.getValue();
        }

        private FunctionArgument resolveRange(CellRange range) {
            CellRange clipped = range.clip(matrix.getMaxRows(), matrix.getMaxColumns());
            if (clipped == null) {
                return FunctionArgument.scalar(Value.error(ErrorType.BROKEN_REFERENCE));
            }
            List<Value> values = new ArrayList<>(clipped.getRowCount() * clipped.getColumnCount());
            for (CellAddress address : clipped.addresses()) {
                values.add(resolve(address));
            }
            return FunctionArgument.range(values, clipped.getRowCount(), clipped.getColumnCount());
        }

        @Override
        public Value visitLiteral(LiteralNode node) {
            return node.getValue();
        }

        @Override
        public Value visitCellRef(CellRefNode node) {
            return resolve(node.getReference().getAddress());
        }

        // A multi-cell range outside a function call has no single value
        @Override
        public Value visitRangeRef(RangeRefNode node) {
            return resolveRange(node.getRange()).asScalar();
        }

        /**
         * Cell references reach functions as 1x1 ranges so aggregates treat them like range
         * cells; any other expression is passed as a scalar.
         */
        @Override
        public Value visitFunctionCall(FunctionCallNode node) {
            List<FunctionArgument> args = new ArrayList<>(node.getArguments().size());
            for (FormulaNode arg : node.getArguments()) {
                if (arg instanceof RangeRefNode) {
                    args.add(resolveRange(((RangeRefNode) arg).getRange()));
                } else if (arg instanceof CellRefNode) {
                    Value value = resolve(((CellRefNode) arg).getReference().getAddress());
                    args.add(FunctionArgument.range(Collections.singletonList(value), 1, 1));
                } else {
                    args.add(FunctionArgument.scalar(arg.accept(this)));
                }
            }
            return functions.invoke(node.getFunction(), args);
        }

        @Override
        public Value visitBinaryOp(BinaryOpNode node) {
            Value left = node.getLeft().accept(this);
            Value right = node.getRight().accept(this);
            BinaryOperator op = node.getOperator();
            if (op == BinaryOperator.CONCAT) {
                return concat(left, right);
            }
            if (op.isComparison()) {
                return compare(op, left, right);
            }
            return arithmetic(op, left, right);
        }

        @Override
        public Value visitUnaryOp(UnaryOpNode node) {
            Value operand = node.getOperand().accept(this);
            switch (node.getOperator()) {
                case NEGATE:
                    Value number = Coercion.toNumber(operand);
                    return number.isError() ? number : Value.number(-number.getNumber());
                case PLUS:
                    return operand;
                default:
                    throw new IllegalStateException("Unhandled unary operator " + node.getOperator());
            }
        }
    }

    private static Value arithmetic(BinaryOperator op, Value leftValue, Value rightValue) {
        Value left = Coercion.toNumber(leftValue);
        if (left.isError()) {
            return left;
        }
        Value right = Coercion.toNumber(rightValue);
        if (right.isError()) {
            return right;
        }
        double a = left.getNumber();
        double b = right.getNumber();
        switch (op) {
            case ADD:
                return Value.number(a + b);
            case SUBTRACT:
                return Value.number(a - b);
            case MULTIPLY:
                return Value.number(a * b);
            case DIVIDE:
                if (b == 0) {
                    return Value.error(ErrorType.DIVIDE_BY_ZERO);
                }
                return Value.number(a / b);
            case POWER:
                if (a == 0 && b < 0) {
                    return Value.error(ErrorType.DIVIDE_BY_ZERO);
                }
                return Value.number(Math.pow(a, b));
            default:
                throw new IllegalStateException("Not an arithmetic operator: " + op);
        }
    }

    private static Value concat(Value leftValue, Value rightValue) {
        Value left = Coercion.toText(leftValue);
        if (left.isError()) {
            return left;
        }
        Value right = Coercion.toText(rightValue);
        if (right.isError()) {
            return right;
        }
        return Value.text(left.getText() + right.getText());
    }

    private static Value compare(BinaryOperator op, Value left, Value right) {
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }
        int cmp = Coercion.compare(left, right);
        switch (op) {
            case EQUAL:
                return Value.bool(cmp == 0);
            case NOT_EQUAL:
                return Value.bool(cmp != 0);
            case LESS:
                return Value.bool(cmp < 0);
            case GREATER:
                return Value.bool(cmp > 0);
            case LESS_EQUAL:
                return Value.bool(cmp <= 0);
            case GREATER_EQUAL:
                return Value.bool(cmp >= 0);
            default:
                throw new IllegalStateException("Not a comparison operator: " + op);
        }
    }
}
