package com.pricematrix.app.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular block of cells. Built from two corners in any order and
 * always stored normalized: top <= bottom, left <= right.
 */
public final class CellRange {

    private final int top;
    private final int left;
    private final int bottom;
    private final int right;

    public CellRange(CellAddress first, CellAddress second) {
        this.top = Math.min(first.getRow(), second.getRow());
        this.bottom = Math.max(first.getRow(), second.getRow());
        this.left = Math.min(first.getColumn(), second.getColumn());
        this.right = Math.max(first.getColumn(), second.getColumn());
    }

    public int getTop() {
        return top;
    }
    public int getLeft() {
        return left;
    }
    public int getBottom() {
        return bottom;
    }
    public int getRight() {
        return right;
    }

    public int getRowCount() {
        return bottom - top + 1;
    }

    public int getColumnCount() {
        return right - left + 1;
    }

    public CellAddress getTopLeft() {
        return new CellAddress(top, left);
    }

    public CellAddress getBottomRight() {
        return new CellAddress(bottom, right);
    }

    public boolean contains(CellAddress address) {
        return address.getRow() >= top && address.getRow() <= bottom
                && address.getColumn() >= left && address.getColumn() <= right;
    }

    /**
     * Returns a copy clipped to the given bounds (exclusive), or null when nothing remains.
     */
    public CellRange clip(int maxRows, int maxColumns) {
        if (top >= maxRows || left >= maxColumns) {
            return null;
        }
        return new CellRange(new CellAddress(top, left),
                new CellAddress(Math.min(bottom, maxRows - 1), Math.min(right, maxColumns - 1)));
    }

    /**
     * Addresses in row-major order.
     */
    public List<CellAddress> addresses() {
        List<CellAddress> result = new ArrayList<>(getRowCount() * getColumnCount());
        for (int r = top; r <= bottom; r++) {
            for (int c = left; c <= right; c++) {
                result.add(new CellAddress(r, c));
            }
        }
        return result;
    }

    public String toA1() {
        return getTopLeft().toA1() + ":" + getBottomRight().toA1();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return top == that.top && left == that.left && bottom == that.bottom && right == that.right;
    }

    @Override
    public int hashCode() {
        return Objects.hash(top, left, bottom, right);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
