package com.pricematrix.app.models;

/**
 * Error markers a cell can hold instead of a value.
 * Each carries the code the grid shows, e.g. "#DIV/0!".
 */
public enum ErrorType {
    PARSE("#ERROR"),
    DIVIDE_BY_ZERO("#DIV/0!"),
    CIRCULAR_REFERENCE("#CIRC!"),
    BROKEN_REFERENCE("#REF!"),
    TYPE_MISMATCH("#VALUE!"),
    UNKNOWN_FUNCTION("#NAME?"),
    NOT_AVAILABLE("#N/A"),
    NUMBER_ERROR("#NUM!");

    private final String code;

    ErrorType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Looks up an error by its grid code (case-insensitive), or null if unknown.
     */
    public static ErrorType fromCode(String code) {
        for (ErrorType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        return null;
    }
}
