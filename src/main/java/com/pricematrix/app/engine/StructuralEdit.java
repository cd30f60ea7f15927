package com.pricematrix.app.engine;

import com.pricematrix.app.models.CellAddress;

import java.util.Locale;

/**
 * One row or column insertion/deletion at a 0-based index.
 */
public final class StructuralEdit {

    public enum Axis {
        ROW,
        COLUMN
    }

    public enum Kind {
        INSERT,
        DELETE
    }

    /** Returned by {@link #shift(int)} for a coordinate that was deleted. */
    public static final int DELETED = -1;

    private final Axis axis;
    private final Kind kind;
    private final int index;

    public StructuralEdit(Axis axis, Kind kind, int index) {
        this.axis = axis;
        this.kind = kind;
        this.index = index;
    }

    public static StructuralEdit insertRow(int index) {
        return new StructuralEdit(Axis.ROW, Kind.INSERT, index);
    }

    public static StructuralEdit deleteRow(int index) {
        return new StructuralEdit(Axis.ROW, Kind.DELETE, index);
    }

    public static StructuralEdit insertColumn(int index) {
        return new StructuralEdit(Axis.COLUMN, Kind.INSERT, index);
    }

    public static StructuralEdit deleteColumn(int index) {
        return new StructuralEdit(Axis.COLUMN, Kind.DELETE, index);
    }

    public Axis getAxis() {
        return axis;
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Insert at K: coordinates >= K move up by one.
     * Delete at K: K itself is gone, coordinates > K move down by one.
     */
    public int shift(int coordinate) {
        if (kind == Kind.INSERT) {
            return coordinate >= index ? coordinate + 1 : coordinate;
        }
        if (coordinate == index) {
            return DELETED;
        }
        return coordinate > index ? coordinate - 1 : coordinate;
    }

    /**
     * New address of a cell, or null if the edit deletes it.
     */
    public CellAddress shift(CellAddress address) {
        if (axis == Axis.ROW) {
            int row = shift(address.getRow());
            return row == DELETED ? null : address.withRow(row);
        }
        int column = shift(address.getColumn());
        return column == DELETED ? null : address.withColumn(column);
    }

    public String describe() {
        return (kind == Kind.INSERT ? "insert " : "delete ") + axis.name().toLowerCase(Locale.ROOT) + " " + index;
    }

    @Override
    public String toString() {
        return describe();
    }
}
