package com.pricematrix.app.functions;

import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static com.pricematrix.app.functions.ArgumentReader.NumberList;
import static com.pricematrix.app.functions.ArgumentReader.numbers;

/**
 * SUM, AVERAGE, MIN, MAX, COUNT, ROUND, ABS.
 */
final class AggregateFunctions {

    private static final int VARIADIC = Integer.MAX_VALUE;

    private static final int MIN_ROUND_SCALE = -309;

    private AggregateFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register(new FunctionDefinition("SUM", 1, VARIADIC, ErrorPolicy.PROPAGATE_ALL, AggregateFunctions::sum));
        library.register(new FunctionDefinition("AVERAGE", 1, VARIADIC, ErrorPolicy.PROPAGATE_ALL, AggregateFunctions::average));
        library.register(new FunctionDefinition("MIN", 1, VARIADIC, ErrorPolicy.PROPAGATE_ALL, args -> extreme(args, false)));
        library.register(new FunctionDefinition("MAX", 1, VARIADIC, ErrorPolicy.PROPAGATE_ALL, args -> extreme(args, true)));
        library.register(new FunctionDefinition("COUNT", 1, VARIADIC, ErrorPolicy.HANDLED_BY_FUNCTION, AggregateFunctions::count));
        library.register(new FunctionDefinition("ROUND", 2, 2, ErrorPolicy.PROPAGATE_ALL, AggregateFunctions::round));
        library.register(new FunctionDefinition("ABS", 1, 1, ErrorPolicy.PROPAGATE_ALL, AggregateFunctions::abs));
    }

    private static Value sum(List<FunctionArgument> args) {
        NumberList list = numbers(args);
        if (list.error != null) {
            return list.error;
        }
        double total = 0;
        for (double d : list.numbers) {
            total += d;
        }
        return Value.number(total);
    }

    private static Value average(List<FunctionArgument> args) {
        NumberList list = numbers(args);
        if (list.error != null) {
            return list.error;
        }
        if (list.numbers.isEmpty()) {
            return Value.error(ErrorType.DIVIDE_BY_ZERO);
        }
        double total = 0;
        for (double d : list.numbers) {
            total += d;
        }
        return Value.number(total / list.numbers.size());
    }

    // No numbers at all gives 0
    private static Value extreme(List<FunctionArgument> args, boolean max) {
        NumberList list = numbers(args);
        if (list.error != null) {
            return list.error;
        }
        if (list.numbers.isEmpty()) {
            return Value.number(0);
        }
        double result = list.numbers.get(0);
        for (double d : list.numbers) {
            result = max ? Math.max(result, d) : Math.min(result, d);
        }
        return Value.number(result);
    }

    /**
     * Counts numeric entries. Range cells count only when they hold a number;
     * scalar arguments count when they coerce to a number. Errors are skipped.
     */
    private static Value count(List<FunctionArgument> args) {
        int count = 0;
        for (FunctionArgument arg : args) {
            if (arg.isRange()) {
                for (Value value : arg.values()) {
                    if (value.isNumber()) {
                        count++;
                    }
                }
            } else {
                Value value = arg.asScalar();
                if (!value.isBlank() && !Coercion.toNumber(value).isError()) {
                    count++;
                }
            }
        }
        return Value.number(count);
    }

    /**
     * Half-up (away from zero on ties); negative digits round left of the decimal point.
     */
    private static Value round(List<FunctionArgument> args) {
        Value number = ArgumentReader.number(args.get(0));
        if (number.isError()) {
            return number;
        }
        Value digits = ArgumentReader.number(args.get(1));
        if (digits.isError()) {
            return digits;
        }
        BigDecimal exact = BigDecimal.valueOf(number.getNumber());
        int scale = ArgumentReader.toInt(digits);
        if (scale >= exact.scale()) {
            return number;
        }
        // No double reaches 10^309, so rounding further left always gives zero
        BigDecimal rounded = exact.setScale(Math.max(scale, MIN_ROUND_SCALE), RoundingMode.HALF_UP);
        return Value.number(rounded.doubleValue());
    }

    private static Value abs(List<FunctionArgument> args) {
        Value number = ArgumentReader.number(args.get(0));
        return number.isError() ? number : Value.number(Math.abs(number.getNumber()));
    }
}
