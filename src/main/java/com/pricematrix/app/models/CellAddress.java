package com.pricematrix.app.models;

import com.pricematrix.app.exceptions.InvalidCoordinateException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable 0-based (row, column) coordinate of a cell.
 * Converts to and from A1 notation: column letters A..Z, AA.. (base 26 without a zero digit)
 * followed by a 1-based row number.
 */
public final class CellAddress implements Comparable<CellAddress> {

    private static final Pattern A1_PATTERN = Pattern.compile("^\\$?([A-Za-z]{1,3})\\$?([0-9]{1,7})$");

    private final int row;
    private final int column;

    public CellAddress(int row, int column) {
        if (row < 0 || column < 0) {
            throw new InvalidCoordinateException("Negative coordinate: (" + row + ", " + column + ")");
        }
        this.row = row;
        this.column = column;
    }

    public static CellAddress of(int row, int column) {
        return new CellAddress(row, column);
    }

    /**
     * Parses "B7" or "$B$7" into (6, 1). '$' markers are accepted and ignored.
     */
    public static CellAddress fromA1(String text) {
        Matcher matcher = A1_PATTERN.matcher(text == null ? "" : text.trim());
        if (!matcher.matches()) {
            throw new InvalidCoordinateException("Not an A1 address: " + text);
        }
        int row = Integer.parseInt(matcher.group(2)) - 1;
        if (row < 0) {
            throw new InvalidCoordinateException("Row numbers start at 1: " + text);
        }
        return new CellAddress(row, columnIndex(matcher.group(1)));
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26.
     */
    public static int columnIndex(String letters) {
        int result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new InvalidCoordinateException("Not a column name: " + letters);
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result - 1;
    }

    /**
     * 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnName(int column) {
        if (column < 0) {
            throw new InvalidCoordinateException("Negative column: " + column);
        }
        StringBuilder sb = new StringBuilder();
        int n = column + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public CellAddress withRow(int newRow) {
        return new CellAddress(newRow, column);
    }

    public CellAddress withColumn(int newColumn) {
        return new CellAddress(row, newColumn);
    }

    public String toA1() {
        return columnName(column) + (row + 1);
    }

    // Row-major ordering
    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
