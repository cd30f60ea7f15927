package com.pricematrix.app.functions;

import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared argument conversions for the function groups.
 */
final class ArgumentReader {

    private ArgumentReader() {
    }

    /**
     * Scalar numeric value of an argument, or an error value.
     */
    static Value number(FunctionArgument arg) {
        return Coercion.toNumber(arg.asScalar());
    }

    static Value text(FunctionArgument arg) {
        return Coercion.toText(arg.asScalar());
    }

    static Value bool(FunctionArgument arg) {
        return Coercion.toBoolean(arg.asScalar());
    }

    /**
     * Optional argument at index, or the fallback when absent.
     */
    static Value optional(List<FunctionArgument> args, int index, Value fallback) {
        return args.size() > index ? args.get(index).asScalar() : fallback;
    }

    /**
     * Numbers for aggregation: range cells contribute only numeric values,
     * scalar arguments are coerced and fail with their coercion error.
     */
    static NumberList numbers(List<FunctionArgument> args) {
        List<Double> result = new ArrayList<>();
        for (FunctionArgument arg : args) {
            if (arg.isRange()) {
                for (Value value : arg.values()) {
                    if (value.isNumber()) {
                        result.add(value.getNumber());
                    }
                }
            } else {
                Value coerced = Coercion.toNumber(arg.asScalar());
                if (coerced.isError()) {
                    return new NumberList(null, coerced);
                }
                result.add(coerced.getNumber());
            }
        }
        return new NumberList(result, null);
    }

    /**
     * Truncates a numeric value toward zero; callers check isError first.
     */
    static int toInt(Value number) {
        return (int) number.getNumber();
    }

    static Value typeMismatch() {
        return Value.error(ErrorType.TYPE_MISMATCH);
    }

    /**
     * Either the collected numbers or the error that stopped the collection.
     */
    static final class NumberList {
        final List<Double> numbers;
        final Value error;

        NumberList(List<Double> numbers, Value error) {
            this.numbers = numbers;
            this.error = error;
        }
    }
}
