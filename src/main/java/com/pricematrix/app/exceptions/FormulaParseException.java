package com.pricematrix.app.exceptions;

import com.pricematrix.app.models.ErrorType;

/**
 * Raised by the formula parser for malformed text or an unknown function name.
 * Never escapes the engine: the cell write catches it and stores the cell
 * as an error cell with {@link #getMessage()} as its diagnostic.
 */
public class FormulaParseException extends Exception {

    private final ErrorType errorType;
    private final int position;

    public FormulaParseException(String message, int position) {
        this(ErrorType.PARSE, message, position);
    }

    public FormulaParseException(ErrorType errorType, String message, int position) {
        super(message);
        this.errorType = errorType;
        this.position = position;
    }

    /**
     * PARSE for syntax problems, UNKNOWN_FUNCTION for names outside the function library.
     */
    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * 0-based offset into the formula body (the text after '='), or -1 when unknown.
     */
    public int getPosition() {
        return position;
    }
}
