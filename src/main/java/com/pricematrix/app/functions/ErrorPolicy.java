package com.pricematrix.app.functions;

/**
 * How error values in the arguments are handled before a function body runs.
 */
public enum ErrorPolicy {
    /** The first error in any argument, ranges included, becomes the result. */
    PROPAGATE_ALL,
    /** The first error in a scalar argument becomes the result; ranges are inspected by the function. */
    PROPAGATE_SCALARS,
    /** The function sees every error and decides (IF, IFERROR, COUNT). */
    HANDLED_BY_FUNCTION
}
