package com.pricematrix.app.functions;

import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Value;

import java.util.Collections;
import java.util.List;

/**
 * A resolved function argument: either a single value or a rectangular range of values
 * stored row-major.
 */
public final class FunctionArgument {

    private final List<Value> values;
    private final int rows;
    private final int columns;
    private final boolean range;

    private FunctionArgument(List<Value> values, int rows, int columns, boolean range) {
        this.values = values;
        this.rows = rows;
        this.columns = columns;
        this.range = range;
    }

    public static FunctionArgument scalar(Value value) {
        return new FunctionArgument(Collections.singletonList(value), 1, 1, false);
    }

    public static FunctionArgument range(List<Value> rowMajorValues, int rows, int columns) {
        if (rowMajorValues.size() != rows * columns) {
            throw new IllegalArgumentException("Expected " + rows * columns + " values, got " + rowMajorValues.size());
        }
        return new FunctionArgument(Collections.unmodifiableList(rowMajorValues), rows, columns, true);
    }

    public boolean isRange() {
        return range;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * Row-major flattened values; a singleton list for scalars.
     */
    public List<Value> values() {
        return values;
    }

    /**
     * 0-based access into the range.
     */
    public Value get(int row, int column) {
        return values.get(row * columns + column);
    }

    /**
     * The single value of a scalar or 1x1 range; TYPE_MISMATCH for a larger range.
     */
    public Value asScalar() {
        if (values.size() == 1) {
            return values.get(0);
        }
        return Value.error(ErrorType.TYPE_MISMATCH);
    }

    /**
     * First error value in row-major order, or null.
     */
    public Value firstError() {
        for (Value value : values) {
            if (value.isError()) {
                return value;
            }
        }
        return null;
    }
}
