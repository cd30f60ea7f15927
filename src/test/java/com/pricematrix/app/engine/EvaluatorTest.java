package com.pricematrix.app.engine;

import com.pricematrix.app.exceptions.FormulaParseException;
import com.pricematrix.app.formula.FormulaParser;
import com.pricematrix.app.functions.FunctionLibrary;
import com.pricematrix.app.models.Cell;
import com.pricematrix.app.models.CellAddress;
import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Matrix;
import com.pricematrix.app.models.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Operator semantics and coercions, evaluated against a small matrix of literals.
 */
class EvaluatorTest {

    private FormulaParser parser;
    private Evaluator evaluator;
    private Matrix matrix;

    @BeforeEach
    void setUp() {
        FunctionLibrary library = new FunctionLibrary();
        parser = new FormulaParser(library);
        evaluator = new Evaluator(library);
        matrix = new Matrix("eval", 100, 26, 10);
        literal("A1", Value.number(5));
        literal("A2", Value.text("12"));
        literal("A3", Value.text("abc"));
        literal("A4", Value.TRUE);
        literal("A5", Value.error(ErrorType.DIVIDE_BY_ZERO));
    }

    private void literal(String a1, Value value) {
        Cell cell = new Cell(value.toDisplayText());
        cell.setValue(value);
        matrix.putCell(CellAddress.fromA1(a1), cell);
    }

    private Value eval(String formula) throws FormulaParseException {
        return evaluator.evaluate(parser.parse(formula), matrix, new HashSet<>());
    }

    private static Value n(double d) {
        return Value.number(d);
    }

    @Test
    void testArithmetic() throws FormulaParseException {
        assertEquals(n(7), eval("=1+2*3"));
        assertEquals(n(64), eval("=2^3^2"));
        assertEquals(n(-5), eval("=-A1"));
        assertEquals(n(2.5), eval("=A1/2"));
        assertEquals(Value.error(ErrorType.DIVIDE_BY_ZERO), eval("=1/0"));
        assertEquals(Value.error(ErrorType.DIVIDE_BY_ZERO), eval("=0^-1"));
        assertEquals(Value.error(ErrorType.NUMBER_ERROR), eval("=(0-8)^0.5"));
    }

    @Test
    void testCoercionInArithmetic() throws FormulaParseException {
        assertEquals(n(17), eval("=A1+A2"));
        assertEquals(n(6), eval("=A4+A1"));
        assertEquals(n(1), eval("=Z99+1"));
        assertEquals(Value.error(ErrorType.TYPE_MISMATCH), eval("=A3*2"));
    }

    @Test
    void testErrorsPropagateLeftFirst() throws FormulaParseException {
        assertEquals(Value.error(ErrorType.DIVIDE_BY_ZERO), eval("=A5+A3"));
        assertEquals(Value.error(ErrorType.TYPE_MISMATCH), eval("=A3+A5"));
        assertEquals(Value.error(ErrorType.BROKEN_REFERENCE), eval("=#REF!+1"));
        assertEquals(Value.error(ErrorType.DIVIDE_BY_ZERO), eval("=A5=1"));
    }

    @Test
    void testConcatenation() throws FormulaParseException {
        assertEquals(Value.text("5 units"), eval("=A1&\" units\""));
        assertEquals(Value.text("TRUE"), eval("=A4&Z99"));
    }

    @Test
    void testComparisons() throws FormulaParseException {
        assertEquals(Value.TRUE, eval("=\"abc\"=A3"));
        assertEquals(Value.TRUE, eval("=\"ABC\"=A3"));
        assertEquals(Value.TRUE, eval("=A1<>4"));
        assertEquals(Value.TRUE, eval("=A1<\"a\""));
        assertEquals(Value.TRUE, eval("=Z99=0"));
        assertEquals(Value.TRUE, eval("=Z99=\"\""));
        assertEquals(Value.FALSE, eval("=A1>=6"));
    }

    @Test
    void testRanges() throws FormulaParseException {
        assertEquals(n(5), eval("=SUM(A1:A4)"));
        assertEquals(Value.error(ErrorType.TYPE_MISMATCH), eval("=A1:A2"));
        // The part of a range past the bounds is ignored; a range fully outside is #REF!
        assertEquals(n(5), eval("=SUM(A1:ZZ1)"));
        assertEquals(Value.error(ErrorType.BROKEN_REFERENCE), eval("=SUM(A200:A300)"));
    }

    @Test
    void testCellInVisitingSetIsCircular() throws FormulaParseException {
        HashSet<CellAddress> visiting = new HashSet<>();
        visiting.add(CellAddress.fromA1("A1"));
        assertEquals(Value.error(ErrorType.CIRCULAR_REFERENCE),
                evaluator.evaluate(parser.parse("=A1+1"), matrix, visiting));
    }
}
