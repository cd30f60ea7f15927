package com.pricematrix.app.formula;

import com.pricematrix.app.models.CellAddress;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A cell reference as written in a formula: a coordinate plus the '$' markers.
 * The markers are preserved when the reference is rewritten but do not change
 * how structural edits shift it.
 */
public final class CellReference {

    static final Pattern REFERENCE_PATTERN = Pattern.compile("^(\\$?)([A-Za-z]{1,3})(\\$?)([0-9]{1,7})$");

    private final CellAddress address;
    private final boolean absoluteColumn;
    private final boolean absoluteRow;

    public CellReference(CellAddress address, boolean absoluteColumn, boolean absoluteRow) {
        this.address = address;
        this.absoluteColumn = absoluteColumn;
        this.absoluteRow = absoluteRow;
    }

    /**
     * Parses "B2", "$B2", "B$2" or "$B$2"; returns null for anything else, including row 0.
     */
    public static CellReference parse(String text) {
        Matcher matcher = REFERENCE_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return null;
        }
        int row = Integer.parseInt(matcher.group(4)) - 1;
        if (row < 0) {
            return null;
        }
        int column = CellAddress.columnIndex(matcher.group(2));
        return new CellReference(new CellAddress(row, column),
                !matcher.group(1).isEmpty(), !matcher.group(3).isEmpty());
    }

    public CellAddress getAddress() {
        return address;
    }

    public boolean isAbsoluteColumn() {
        return absoluteColumn;
    }

    public boolean isAbsoluteRow() {
        return absoluteRow;
    }

    public CellReference moveTo(int row, int column) {
        return new CellReference(new CellAddress(row, column), absoluteColumn, absoluteRow);
    }

    public String toText() {
        return (absoluteColumn ? "$" : "") + CellAddress.columnName(address.getColumn())
                + (absoluteRow ? "$" : "") + (address.getRow() + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellReference)) {
            return false;
        }
        CellReference that = (CellReference) o;
        return absoluteColumn == that.absoluteColumn && absoluteRow == that.absoluteRow
                && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, absoluteColumn, absoluteRow);
    }

    @Override
    public String toString() {
        return toText();
    }
}
