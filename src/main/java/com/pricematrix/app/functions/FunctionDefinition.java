package com.pricematrix.app.functions;

import com.pricematrix.app.models.Value;

import java.util.List;
import java.util.function.Function;

/**
 * A {@link SpreadsheetFunction} assembled from a name, an arity window, an error policy
 * and a body. The library groups register their functions through this class.
 */
public class FunctionDefinition implements SpreadsheetFunction {

    private final String name;
    private final int minArgs;
    private final int maxArgs;
    private final ErrorPolicy errorPolicy;
    private final Function<List<FunctionArgument>, Value> body;

    public FunctionDefinition(String name, int minArgs, int maxArgs, ErrorPolicy errorPolicy,
                              Function<List<FunctionArgument>, Value> body) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.errorPolicy = errorPolicy;
        this.body = body;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getMinArgs() {
        return minArgs;
    }

    @Override
    public int getMaxArgs() {
        return maxArgs;
    }

    @Override
    public ErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    @Override
    public Value apply(List<FunctionArgument> args) {
        return body.apply(args);
    }

    @Override
    public String toString() {
        return name;
    }
}
