package com.pricematrix.app.exceptions;

/**
 * Thrown when a caller passes a negative row/column coordinate or index,
 * or a malformed A1 address. This is a contract violation, not a cell error.
 */
public class InvalidCoordinateException extends RuntimeException {
    public InvalidCoordinateException(String message) {
        super(message);
    }
}
