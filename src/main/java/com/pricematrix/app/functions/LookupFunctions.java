package com.pricematrix.app.functions;

import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * VLOOKUP, HLOOKUP, INDEX, MATCH. Positions are 1-based; a miss is #N/A and an index
 * outside the table is #REF!.
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register(new FunctionDefinition("VLOOKUP", 3, 4, ErrorPolicy.PROPAGATE_SCALARS, args -> lookup(args, true)));
        library.register(new FunctionDefinition("HLOOKUP", 3, 4, ErrorPolicy.PROPAGATE_SCALARS, args -> lookup(args, false)));
        library.register(new FunctionDefinition("INDEX", 2, 3, ErrorPolicy.PROPAGATE_SCALARS, LookupFunctions::index));
        library.register(new FunctionDefinition("MATCH", 2, 3, ErrorPolicy.PROPAGATE_SCALARS, LookupFunctions::match));
    }

    /**
     * VLOOKUP searches the first column and returns from column col_index of the matched row;
     * HLOOKUP is the same over the first row. approx=TRUE expects the keys sorted ascending
     * and picks the largest key not greater than the search key.
     */
    private static Value lookup(List<FunctionArgument> args, boolean vertical) {
        Value key = args.get(0).asScalar();
        if (key.isError()) {
            return key;
        }
        FunctionArgument table = args.get(1);
        Value offset = ArgumentReader.number(args.get(2));
        if (offset.isError()) {
            return offset;
        }
        Value approx = Coercion.toBoolean(ArgumentReader.optional(args, 3, Value.FALSE));
        if (approx.isError()) {
            return approx;
        }
        int index = ArgumentReader.toInt(offset);
        int span = vertical ? table.getColumns() : table.getRows();
        if (index < 1) {
            return ArgumentReader.typeMismatch();
        }
        if (index > span) {
            return Value.error(ErrorType.BROKEN_REFERENCE);
        }

        List<Value> keys = new ArrayList<>();
        int length = vertical ? table.getRows() : table.getColumns();
        for (int i = 0; i < length; i++) {
            keys.add(vertical ? table.get(i, 0) : table.get(0, i));
        }
        int hit = approx.getBoolean() ? lastNotAfter(keys, key, 1) : firstMatch(keys, key);
        if (hit < 0) {
            return Value.error(ErrorType.NOT_AVAILABLE);
        }
        return vertical ? table.get(hit, index - 1) : table.get(index - 1, hit);
    }

    /**
     * INDEX(range, row, [col]). On a single-row range a lone index selects the column.
     */
    private static Value index(List<FunctionArgument> args) {
        FunctionArgument table = args.get(0);
        Value rowArg = ArgumentReader.number(args.get(1));
        if (rowArg.isError()) {
            return rowArg;
        }
        int row = ArgumentReader.toInt(rowArg);
        int column = 1;
        if (args.size() > 2) {
            Value columnArg = ArgumentReader.number(args.get(2));
            if (columnArg.isError()) {
                return columnArg;
            }
            column = ArgumentReader.toInt(columnArg);
        } else if (table.getRows() == 1) {
            column = row;
            row = 1;
        }
        if (row < 1 || column < 1) {
            return ArgumentReader.typeMismatch();
        }
        if (row > table.getRows() || column > table.getColumns()) {
            return Value.error(ErrorType.BROKEN_REFERENCE);
        }
        return table.get(row - 1, column - 1);
    }

    /**
     * MATCH(value, range, [type]); type 1 (default) = largest value <= key on ascending data,
     * 0 = exact, -1 = smallest value >= key on descending data.
     */
    private static Value match(List<FunctionArgument> args) {
        Value key = args.get(0).asScalar();
        if (key.isError()) {
            return key;
        }
        FunctionArgument range = args.get(1);
        if (range.getRows() != 1 && range.getColumns() != 1) {
            return Value.error(ErrorType.NOT_AVAILABLE);
        }
        Value typeArg = Coercion.toNumber(ArgumentReader.optional(args, 2, Value.number(1)));
        if (typeArg.isError()) {
            return typeArg;
        }
        double type = typeArg.getNumber();
        int hit;
        if (type == 0) {
            hit = firstMatch(range.values(), key);
        } else {
            hit = lastNotAfter(range.values(), key, type > 0 ? 1 : -1);
        }
        return hit < 0 ? Value.error(ErrorType.NOT_AVAILABLE) : Value.number(hit + 1);
    }

    private static int firstMatch(List<Value> values, Value key) {
        for (int i = 0; i < values.size(); i++) {
            if (Coercion.matches(key, values.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Scans sorted data (ascending for direction 1, descending for -1) and returns the last
     * position whose value has not passed the key. Values of another type than the key are skipped.
     */
    private static int lastNotAfter(List<Value> values, Value key, int direction) {
        int found = -1;
        for (int i = 0; i < values.size(); i++) {
            Value candidate = values.get(i);
            if (candidate.isError() || candidate.isBlank() || candidate.getType() != key.getType()) {
                continue;
            }
            int cmp = Coercion.compare(candidate, key) * direction;
            if (cmp > 0) {
                break;
            }
            found = i;
            if (cmp == 0 && direction < 0) {
                break;
            }
        }
        return found;
    }
}
