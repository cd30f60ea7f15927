package com.pricematrix.app.models;

/**
 * Read-only picture of one cell for the grid and other collaborators.
 * An address that was never written yields an empty view (blank value, empty raw text).
 */
public class CellView {
    private final String address;
    private final int row;
    private final int column;
    private final String rawText;
    private final String displayValue;
    private final Object value;
    private final ValueType valueType;
    private final ErrorType error;
    private final String diagnostic;

    public CellView(CellAddress address, String rawText, Value value, String diagnostic) {
        this.address = address.toA1();
        this.row = address.getRow();
        this.column = address.getColumn();
        this.rawText = rawText;
        this.displayValue = value.toDisplayText();
        this.value = value.toJsonValue();
        this.valueType = value.getType();
        this.error = value.isError() ? value.getError() : null;
        this.diagnostic = diagnostic;
    }

    public static CellView empty(CellAddress address) {
        return new CellView(address, "", Value.BLANK, null);
    }

    public String getAddress() {
        return address;
    }
    public int getRow() {
        return row;
    }
    public int getColumn() {
        return column;
    }
    public String getRawText() {
        return rawText;
    }
    public String getDisplayValue() {
        return displayValue;
    }
    public Object getValue() {
        return value;
    }
    public ValueType getValueType() {
        return valueType;
    }

    // Null unless the cell holds an error marker
    public ErrorType getError() {
        return error;
    }

    // Parser message for #ERROR / #NAME? cells, null otherwise
    public String getDiagnostic() {
        return diagnostic;
    }
}
