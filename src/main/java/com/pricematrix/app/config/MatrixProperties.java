package com.pricematrix.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables bound from the "price-matrix.*" keys:
 * - maxRows / maxColumns: writes at or beyond these bounds are rejected as OUT_OF_RANGE
 * - undoLimit: how many undo steps each matrix keeps
 */
@ConfigurationProperties(prefix = "price-matrix")
public class MatrixProperties {

    private int maxRows = 5000;
    private int maxColumns = 500;
    private int undoLimit = 100;

    public MatrixProperties() {
    }

    public MatrixProperties(int maxRows, int maxColumns, int undoLimit) {
        this.maxRows = maxRows;
        this.maxColumns = maxColumns;
        this.undoLimit = undoLimit;
    }

    public int getMaxRows() {
        return maxRows;
    }
    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }
    public void setMaxColumns(int maxColumns) {
        this.maxColumns = maxColumns;
    }

    public int getUndoLimit() {
        return undoLimit;
    }
    public void setUndoLimit(int undoLimit) {
        this.undoLimit = undoLimit;
    }
}
