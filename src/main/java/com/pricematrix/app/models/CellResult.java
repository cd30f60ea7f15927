package com.pricematrix.app.models;

/**
 * Outcome of writing one cell.
 * OK and PARSE_ERROR both store the raw text (a parse error shows as #ERROR / #NAME?);
 * OUT_OF_RANGE stores nothing.
 */
public class CellResult {

    public enum Status {
        OK,
        PARSE_ERROR,
        OUT_OF_RANGE
    }

    private final Status status;
    private final CellView cell;
    private final String message;

    public CellResult(Status status, CellView cell, String message) {
        this.status = status;
        this.cell = cell;
        this.message = message;
    }

    public static CellResult ok(CellView cell) {
        return new CellResult(Status.OK, cell, null);
    }

    public static CellResult parseError(CellView cell) {
        return new CellResult(Status.PARSE_ERROR, cell, cell.getDiagnostic());
    }

    public static CellResult outOfRange(CellAddress address, int maxRows, int maxColumns) {
        return new CellResult(Status.OUT_OF_RANGE, null,
                address.toA1() + " is outside the " + maxRows + "x" + maxColumns + " matrix bounds");
    }

    public Status getStatus() {
        return status;
    }

    public boolean isStored() {
        return status != Status.OUT_OF_RANGE;
    }

    // Null for OUT_OF_RANGE
    public CellView getCell() {
        return cell;
    }

    public String getMessage() {
        return message;
    }
}
