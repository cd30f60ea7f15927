package com.pricematrix.app.functions;

import com.pricematrix.app.models.Value;
import com.pricematrix.app.models.ValueType;

import java.util.List;

/**
 * IF, AND, OR, NOT, IFERROR.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register(new FunctionDefinition("IF", 2, 3, ErrorPolicy.HANDLED_BY_FUNCTION, LogicalFunctions::ifThenElse));
        library.register(new FunctionDefinition("AND", 1, Integer.MAX_VALUE, ErrorPolicy.PROPAGATE_ALL, args -> combine(args, true)));
        library.register(new FunctionDefinition("OR", 1, Integer.MAX_VALUE, ErrorPolicy.PROPAGATE_ALL, args -> combine(args, false)));
        library.register(new FunctionDefinition("NOT", 1, 1, ErrorPolicy.PROPAGATE_ALL, LogicalFunctions::not));
        library.register(new FunctionDefinition("IFERROR", 2, 2, ErrorPolicy.HANDLED_BY_FUNCTION, LogicalFunctions::ifError));
    }

    /**
     * Only the condition's error propagates; the branch not taken is ignored
     * even when it holds an error.
     */
    private static Value ifThenElse(List<FunctionArgument> args) {
        Value condition = ArgumentReader.bool(args.get(0));
        if (condition.isError()) {
            return condition;
        }
        if (condition.getBoolean()) {
            return args.get(1).asScalar();
        }
        return ArgumentReader.optional(args, 2, Value.FALSE);
    }

    /**
     * Range cells take part only when they hold a number or boolean; no such value at all
     * is a type mismatch.
     */
    private static Value combine(List<FunctionArgument> args, boolean all) {
        boolean seen = false;
        boolean result = all;
        for (FunctionArgument arg : args) {
            if (arg.isRange()) {
                for (Value value : arg.values()) {
                    if (value.isNumber() || value.getType() == ValueType.BOOLEAN) {
                        seen = true;
                        boolean truth = Coercion.toBoolean(value).getBoolean();
                        result = all ? result && truth : result || truth;
                    }
                }
            } else {
                Value truth = ArgumentReader.bool(arg);
                if (truth.isError()) {
                    return truth;
                }
                seen = true;
                result = all ? result && truth.getBoolean() : result || truth.getBoolean();
            }
        }
        return seen ? Value.bool(result) : ArgumentReader.typeMismatch();
    }

    private static Value not(List<FunctionArgument> args) {
        Value truth = ArgumentReader.bool(args.get(0));
        return truth.isError() ? truth : Value.bool(!truth.getBoolean());
    }

    // Falsy non-error values such as 0 or "" pass through untouched
    private static Value ifError(List<FunctionArgument> args) {
        Value value = args.get(0).asScalar();
        return value.isError() ? args.get(1).asScalar() : value;
    }
}
