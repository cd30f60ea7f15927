package com.pricematrix.app.functions;

import com.pricematrix.app.models.Value;

import java.util.List;

/**
 * One built-in function of the closed formula library.
 */
public interface SpreadsheetFunction {

    /**
     * Upper-case name as used in formulas, e.g. "VLOOKUP".
     */
    String getName();

    int getMinArgs();

    /**
     * Maximum argument count; Integer.MAX_VALUE for variadic functions.
     */
    int getMaxArgs();

    ErrorPolicy getErrorPolicy();

    /**
     * Computes the result. Argument errors have already been propagated according to
     * {@link #getErrorPolicy()}; implementations must return error values, never throw.
     */
    Value apply(List<FunctionArgument> args);
}
