package com.pricematrix.app.functions;

import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The closed set of built-in functions, looked up by name at parse time.
 * Names are case-insensitive.
 */
@Component
public class FunctionLibrary {

    private static final Logger logger = LoggerFactory.getLogger(FunctionLibrary.class);

    private final Map<String, SpreadsheetFunction> functions = new TreeMap<>();

    public FunctionLibrary() {
        AggregateFunctions.registerAll(this);
        LogicalFunctions.registerAll(this);
        LookupFunctions.registerAll(this);
        DateTextFunctions.registerAll(this);
        logger.debug("Registered {} formula functions: {}", functions.size(), functions.keySet());
    }

    void register(SpreadsheetFunction function) {
        if (functions.putIfAbsent(function.getName(), function) != null) {
            throw new IllegalStateException("Duplicate function " + function.getName());
        }
    }

    /**
     * Returns the function with this name, or null if the library has none.
     */
    public SpreadsheetFunction find(String name) {
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    /**
     * Applies the function's error policy, then its body. Arithmetic or date overflow
     * inside a body becomes #NUM!.
     */
    public Value invoke(SpreadsheetFunction function, List<FunctionArgument> args) {
        switch (function.getErrorPolicy()) {
            case PROPAGATE_ALL:
                for (FunctionArgument arg : args) {
                    Value error = arg.firstError();
                    if (error != null) {
                        return error;
                    }
                }
                break;
            case PROPAGATE_SCALARS:
                for (FunctionArgument arg : args) {
                    if (arg.values().size() == 1 && arg.values().get(0).isError()) {
                        return arg.values().get(0);
                    }
                }
                break;
            case HANDLED_BY_FUNCTION:
                break;
        }
        try {
            return function.apply(args);
        } catch (ArithmeticException | DateTimeException e) {
            logger.debug("{} overflowed: {}", function.getName(), e.getMessage());
            return Value.error(ErrorType.NUMBER_ERROR);
        }
    }
}
