package com.pricematrix.app.models;

/**
 * One line of the matrix registry listing.
 */
public class MatrixSummary {
    private final long id;
    private final String name;
    private final int rows;
    private final int columns;
    private final int cellCount;
    private final boolean canUndo;
    private final boolean canRedo;

    public MatrixSummary(long id, String name, int rows, int columns, int cellCount,
                         boolean canUndo, boolean canRedo) {
        this.id = id;
        this.name = name;
        this.rows = rows;
        this.columns = columns;
        this.cellCount = cellCount;
        this.canUndo = canUndo;
        this.canRedo = canRedo;
    }

    public long getId() {
        return id;
    }
    public String getName() {
        return name;
    }
    public int getRows() {
        return rows;
    }
    public int getColumns() {
        return columns;
    }
    public int getCellCount() {
        return cellCount;
    }
    public boolean isCanUndo() {
        return canUndo;
    }
    public boolean isCanRedo() {
        return canRedo;
    }
}
