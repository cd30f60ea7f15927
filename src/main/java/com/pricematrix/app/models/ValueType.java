package com.pricematrix.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Enumerates the dynamic type of a computed cell value:
 * NUMBER, STRING, BOOLEAN, ERROR, and BLANK for an empty cell.
 */
public enum ValueType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    BLANK;

    /**
     * Allows case-insensitive JSON input.
     */
    @JsonCreator
    public static ValueType fromValue(String value) {
        return ValueType.valueOf(value.toUpperCase());
    }
}
