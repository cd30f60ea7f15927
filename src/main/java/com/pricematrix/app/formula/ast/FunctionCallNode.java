package com.pricematrix.app.formula.ast;

import com.pricematrix.app.functions.SpreadsheetFunction;

import java.util.Collections;
import java.util.List;

public class FunctionCallNode extends FormulaNode {

    private final SpreadsheetFunction function;
    private final List<FormulaNode> arguments;

    public FunctionCallNode(SpreadsheetFunction function, List<FormulaNode> arguments) {
        this.function = function;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public SpreadsheetFunction getFunction() {
        return function;
    }

    public String getName() {
        return function.getName();
    }

    public List<FormulaNode> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
