package com.pricematrix.app.models;

/**
 * Result of a row/column insertion or deletion.
 */
public enum EditStatus {
    APPLIED,
    OUT_OF_RANGE
}
