package com.pricematrix.app.functions;

import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Calls the built-in functions directly with resolved arguments (no parser, no matrix).
 */
class FunctionLibraryTest {

    private FunctionLibrary library;

    @BeforeEach
    void setUp() {
        library = new FunctionLibrary();
    }

    private Value call(String name, FunctionArgument... args) {
        SpreadsheetFunction function = library.find(name);
        assertNotNull(function, name);
        return library.invoke(function, Arrays.asList(args));
    }

    private static FunctionArgument scalar(Value value) {
        return FunctionArgument.scalar(value);
    }

    private static FunctionArgument num(double d) {
        return FunctionArgument.scalar(Value.number(d));
    }

    private static FunctionArgument str(String s) {
        return FunctionArgument.scalar(Value.text(s));
    }

    private static FunctionArgument column(Value... values) {
        return FunctionArgument.range(Arrays.asList(values), values.length, 1);
    }

    private static FunctionArgument row(Value... values) {
        return FunctionArgument.range(Arrays.asList(values), 1, values.length);
    }

    private static FunctionArgument table(int columns, Object... cells) {
        List<Value> values = new ArrayList<>();
        for (Object cell : cells) {
            if (cell instanceof Number) {
                values.add(Value.number(((Number) cell).doubleValue()));
            } else {
                values.add(Value.text((String) cell));
            }
        }
        return FunctionArgument.range(values, values.size() / columns, columns);
    }

    private static Value n(double d) {
        return Value.number(d);
    }

    private static Value err(ErrorType type) {
        return Value.error(type);
    }

    @Test
    void testNamesAreCaseInsensitive() {
        assertSame(library.find("SUM"), library.find("sum"));
        assertNull(library.find("PRICE"));
        assertTrue(library.getNames().containsAll(Arrays.asList(
                "SUM", "AVERAGE", "MIN", "MAX", "COUNT", "IF", "AND", "OR", "ROUND",
                "VLOOKUP", "HLOOKUP", "INDEX", "MATCH", "IFERROR", "CONCAT", "LEFT", "RIGHT",
                "LEN", "UPPER", "LOWER", "DATE", "YEAR", "MONTH", "DAY")));
    }

    /**
     * COUNT over [1, "x", blank, 2] counts only the numeric, non-blank entries.
     */
    @Test
    void testCountOnlyCountsNumbersInRanges() {
        assertEquals(n(2), call("COUNT", column(n(1), Value.text("x"), Value.BLANK, n(2))));
        assertEquals(n(1), call("COUNT", str("5"), str("x"), scalar(Value.BLANK)));
        assertEquals(n(1), call("COUNT", column(err(ErrorType.DIVIDE_BY_ZERO), n(3))));
    }

    @Test
    void testAggregatesSkipNonNumbersInRanges() {
        FunctionArgument mixed = column(n(4), Value.text("x"), Value.TRUE, Value.BLANK, n(6));
        assertEquals(n(10), call("SUM", mixed));
        assertEquals(n(5), call("AVERAGE", mixed));
        assertEquals(n(4), call("MIN", mixed));
        assertEquals(n(6), call("MAX", mixed));
        assertEquals(n(0), call("MAX", column(Value.text("x"))));
        assertEquals(err(ErrorType.DIVIDE_BY_ZERO), call("AVERAGE", column(Value.BLANK)));
    }

    @Test
    void testAggregatesCoerceScalarsAndPropagateErrors() {
        assertEquals(n(6), call("SUM", str("2"), scalar(Value.TRUE), num(3)));
        assertEquals(err(ErrorType.TYPE_MISMATCH), call("SUM", str("abc")));
        assertEquals(err(ErrorType.BROKEN_REFERENCE), call("SUM", column(n(1), err(ErrorType.BROKEN_REFERENCE))));
    }

    @Test
    void testRoundIsHalfUp() {
        assertEquals(n(2.35), call("ROUND", num(2.345), num(2)));
        assertEquals(n(-3), call("ROUND", num(-2.5), num(0)));
        assertEquals(n(1200), call("ROUND", num(1234), num(-2)));
        assertEquals(n(7.5), call("ABS", num(-7.5)));
    }

    @Test
    void testIfOnlyPropagatesTheConditionError() {
        assertEquals(Value.text("a"), call("IF", scalar(Value.TRUE), str("a"), scalar(err(ErrorType.DIVIDE_BY_ZERO))));
        assertEquals(Value.FALSE, call("IF", num(0), str("a")));
        assertEquals(Value.text("b"), call("IF", str(""), str("a"), str("b")));
        assertEquals(err(ErrorType.NOT_AVAILABLE), call("IF", scalar(err(ErrorType.NOT_AVAILABLE)), str("a"), str("b")));
    }

    @Test
    void testIfErrorReplacesOnlyErrors() {
        assertEquals(n(99), call("IFERROR", scalar(err(ErrorType.DIVIDE_BY_ZERO)), num(99)));
        assertEquals(n(0), call("IFERROR", num(0), num(99)));
        assertEquals(n(99), call("IFERROR", column(err(ErrorType.CIRCULAR_REFERENCE)), num(99)));
    }

    @Test
    void testAndOrNot() {
        assertEquals(Value.TRUE, call("AND", column(n(1), Value.TRUE, Value.text("ignored"))));
        assertEquals(Value.FALSE, call("AND", num(1), num(0)));
        assertEquals(Value.TRUE, call("OR", num(0), scalar(Value.TRUE)));
        assertEquals(err(ErrorType.TYPE_MISMATCH), call("OR", column(Value.text("x"))));
        assertEquals(Value.TRUE, call("NOT", str("")));
    }

    @Test
    void testVlookupExact() {
        FunctionArgument prices = table(2, "apple", 1.5, "pear", 2, "plum", 3);
        assertEquals(n(2), call("VLOOKUP", str("PEAR"), prices, num(2)));
        assertEquals(Value.text("plum"), call("VLOOKUP", str("plum"), prices, num(1), scalar(Value.FALSE)));
        assertEquals(err(ErrorType.NOT_AVAILABLE), call("VLOOKUP", str("kiwi"), prices, num(2)));
        assertEquals(err(ErrorType.BROKEN_REFERENCE), call("VLOOKUP", str("pear"), prices, num(3)));
        assertEquals(err(ErrorType.TYPE_MISMATCH), call("VLOOKUP", str("pear"), prices, num(0)));
    }

    @Test
    void testVlookupApproximateTakesLargestKeyNotAbove() {
        FunctionArgument tiers = table(2, 0, "small", 100, "medium", 1000, "large");
        assertEquals(Value.text("medium"), call("VLOOKUP", num(250), tiers, num(2), scalar(Value.TRUE)));
        assertEquals(Value.text("large"), call("VLOOKUP", num(1000), tiers, num(2), scalar(Value.TRUE)));
        assertEquals(err(ErrorType.NOT_AVAILABLE), call("VLOOKUP", num(-1), tiers, num(2), scalar(Value.TRUE)));
    }

    @Test
    void testHlookup() {
        FunctionArgument grid = table(3, "S", "M", "L", 10, 20, 30);
        assertEquals(n(20), call("HLOOKUP", str("m"), grid, num(2)));
        assertEquals(err(ErrorType.BROKEN_REFERENCE), call("HLOOKUP", str("m"), grid, num(3)));
    }

    @Test
    void testIndex() {
        FunctionArgument grid = table(2, "a", 1, "b", 2);
        assertEquals(n(2), call("INDEX", grid, num(2), num(2)));
        assertEquals(Value.text("b"), call("INDEX", grid, num(2)));
        assertEquals(Value.text("c"), call("INDEX", row(Value.text("a"), Value.text("b"), Value.text("c")), num(3)));
        assertEquals(err(ErrorType.BROKEN_REFERENCE), call("INDEX", grid, num(3), num(1)));
    }

    @Test
    void testMatch() {
        FunctionArgument ascending = column(n(10), n(20), n(30));
        assertEquals(n(2), call("MATCH", num(20), ascending, num(0)));
        assertEquals(n(2), call("MATCH", num(25), ascending));
        assertEquals(err(ErrorType.NOT_AVAILABLE), call("MATCH", num(5), ascending));
        assertEquals(n(2), call("MATCH", num(15), column(n(30), n(20), n(10)), num(-1)));
        assertEquals(err(ErrorType.NOT_AVAILABLE), call("MATCH", num(1), table(2, 1, 2, 3, 4), num(0)));
    }

    @Test
    void testDates() {
        assertEquals(n(2), call("DATE", num(1900), num(1), num(1)));
        Value leapDay = call("DATE", num(2024), num(2), num(29));
        assertEquals(n(2024), call("YEAR", scalar(leapDay)));
        assertEquals(n(2), call("MONTH", scalar(leapDay)));
        assertEquals(n(29), call("DAY", scalar(leapDay)));

        // Overflowing month and day roll forward / backward
        assertEquals(n(1), call("MONTH", scalar(call("DATE", num(2024), num(13), num(1)))));
        assertEquals(n(29), call("DAY", scalar(call("DATE", num(2024), num(3), num(0)))));

        Value march = call("DATE", num(2024), num(3), num(1));
        Value february = call("DATE", num(2024), num(2), num(1));
        assertEquals(n(29), call("DAYS", scalar(march), scalar(february)));
        assertEquals(err(ErrorType.NUMBER_ERROR), call("DATE", num(10000), num(1), num(1)));
    }

    @Test
    void testText() {
        assertEquals(Value.text("a1TRUE"), call("CONCAT", str("a"), row(n(1), Value.TRUE)));
        assertEquals(Value.text("pr"), call("LEFT", str("price"), num(2)));
        assertEquals(Value.text("e"), call("RIGHT", str("price")));
        assertEquals(Value.text("price"), call("RIGHT", str("price"), num(50)));
        assertEquals(err(ErrorType.TYPE_MISMATCH), call("LEFT", str("price"), num(-1)));
        assertEquals(n(5), call("LEN", str("price")));
        assertEquals(Value.text("EUR"), call("UPPER", str("eur")));
        assertEquals(Value.text("2.5"), call("LOWER", num(2.5)));
    }

    @Test
    void testRoundWithExtremeDigits() {
        assertEquals(n(1.5), call("ROUND", num(1.5), num(1E9)));
        assertEquals(n(0.1234567890123), call("ROUND", num(0.1234567890123), num(40)));
        assertEquals(n(0), call("ROUND", num(1.5), num(-1E9)));
        assertEquals(n(0), call("ROUND", num(123456), num(-400)));
        assertEquals(n(123500), call("ROUND", num(123456), num(-2)));
    }

    @Test
    void testDatesOutsideTheCalendarAreNumErrors() {
        assertEquals(err(ErrorType.NUMBER_ERROR), call("YEAR", num(1E15)));
        assertEquals(err(ErrorType.NUMBER_ERROR), call("MONTH", num(3000000)));
        assertEquals(err(ErrorType.NUMBER_ERROR), call("DAY", num(-1)));
        assertEquals(err(ErrorType.NUMBER_ERROR), call("DATE", num(9999), num(13), num(1)));
        assertEquals(err(ErrorType.NUMBER_ERROR), call("DATE", num(1E15), num(1), num(1)));
        assertEquals(err(ErrorType.NUMBER_ERROR), call("DATE", num(2024), num(1E15), num(1)));
        assertEquals(n(9999), call("YEAR", scalar(call("DATE", num(9999), num(12), num(31)))));
    }

    @Test
    void testTextWithHugeCounts() {
        assertEquals(Value.text("price"), call("LEFT", str("price"), num(1E10)));
        assertEquals(Value.text("price"), call("RIGHT", str("price"), num(1E300)));
        assertEquals(err(ErrorType.TYPE_MISMATCH), call("LEFT", str("price"), num(-1E10)));
    }
}
