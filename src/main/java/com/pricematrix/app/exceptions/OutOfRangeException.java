package com.pricematrix.app.exceptions;

/**
 * Raised by the REST layer only, to turn an OUT_OF_RANGE status returned by the
 * service into a 400 response. The service itself never throws it.
 */
public class OutOfRangeException extends RuntimeException {
    public OutOfRangeException(String message) {
        super(message);
    }
}
