package com.pricematrix.app.exceptions;

/**
 * Thrown when attempting to access a matrix ID
 * that doesn't exist in the in-memory registry.
 */
public class MatrixNotFoundException extends RuntimeException {
    public MatrixNotFoundException(String message) {
        super(message);
    }
}
