package com.pricematrix.app.formula;

import com.pricematrix.app.exceptions.FormulaParseException;
import com.pricematrix.app.formula.ast.BinaryOpNode;
import com.pricematrix.app.formula.ast.BinaryOperator;
import com.pricematrix.app.formula.ast.CellRefNode;
import com.pricematrix.app.formula.ast.FormulaNode;
import com.pricematrix.app.formula.ast.FunctionCallNode;
import com.pricematrix.app.formula.ast.LiteralNode;
import com.pricematrix.app.formula.ast.RangeRefNode;
import com.pricematrix.app.formula.ast.UnaryOpNode;
import com.pricematrix.app.functions.FunctionLibrary;
import com.pricematrix.app.models.CellAddress;
import com.pricematrix.app.models.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tree shape checks for the recursive-descent parser.
 */
class FormulaParserTest {

    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        parser = new FormulaParser(new FunctionLibrary());
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() throws FormulaParseException {
        BinaryOpNode root = (BinaryOpNode) parser.parse("=1+2*3");
        assertEquals(BinaryOperator.ADD, root.getOperator());
        assertInstanceOf(LiteralNode.class, root.getLeft());
        assertEquals(BinaryOperator.MULTIPLY, ((BinaryOpNode) root.getRight()).getOperator());
    }

    @Test
    void testSubtractionIsLeftAssociative() throws FormulaParseException {
        BinaryOpNode root = (BinaryOpNode) parser.parse("=A1-B1-C1");
        assertEquals(BinaryOperator.SUBTRACT, root.getOperator());
        assertInstanceOf(BinaryOpNode.class, root.getLeft());
        assertEquals(CellAddress.fromA1("C1"), ((CellRefNode) root.getRight()).getReference().getAddress());
    }

    @Test
    void testComparisonIsLowestAndConcatSitsAboveIt() throws FormulaParseException {
        BinaryOpNode root = (BinaryOpNode) parser.parse("=A1&\"x\"=B1+1");
        assertEquals(BinaryOperator.EQUAL, root.getOperator());
        assertEquals(BinaryOperator.CONCAT, ((BinaryOpNode) root.getLeft()).getOperator());
        assertEquals(BinaryOperator.ADD, ((BinaryOpNode) root.getRight()).getOperator());
    }

    @Test
    void testUnaryMinusOnReference() throws FormulaParseException {
        FormulaNode node = parser.parse("=-A1");
        assertInstanceOf(UnaryOpNode.class, node);
        assertEquals(UnaryOpNode.Operator.NEGATE, ((UnaryOpNode) node).getOperator());
    }

    @Test
    void testFunctionCallWithRange() throws FormulaParseException {
        FunctionCallNode call = (FunctionCallNode) parser.parse("=sum(B2:A1, 4)");
        assertEquals("SUM", call.getName());
        assertEquals(2, call.getArguments().size());
        RangeRefNode range = (RangeRefNode) call.getArguments().get(0);
        assertEquals("A1:B2", range.getRange().toA1());
    }

    @Test
    void testNestedFunctions() throws FormulaParseException {
        FunctionCallNode call = (FunctionCallNode) parser.parse("=IF(AND(A1>0,B1>0),ROUND(A1/B1,2),0)");
        assertEquals("IF", call.getName());
        assertEquals("AND", ((FunctionCallNode) call.getArguments().get(0)).getName());
    }

    @Test
    void testUnknownFunctionIsNameError() {
        FormulaParseException e = assertThrows(FormulaParseException.class, () -> parser.parse("=PRICE(A1)"));
        assertEquals(ErrorType.UNKNOWN_FUNCTION, e.getErrorType());
        assertEquals(0, e.getPosition());
    }

    @Test
    void testArgumentCountIsChecked() {
        FormulaParseException e = assertThrows(FormulaParseException.class, () -> parser.parse("=ROUND(1)"));
        assertEquals(ErrorType.PARSE, e.getErrorType());
        assertTrue(e.getMessage().contains("ROUND"));
    }

    @Test
    void testMalformedFormulas() {
        FormulaParseException empty = assertThrows(FormulaParseException.class, () -> parser.parse("="));
        assertEquals("Empty formula", empty.getMessage());

        FormulaParseException extra = assertThrows(FormulaParseException.class, () -> parser.parse("=(1+2))"));
        assertEquals("Unbalanced ')'", extra.getMessage());

        FormulaParseException missing = assertThrows(FormulaParseException.class, () -> parser.parse("=(1+2"));
        assertEquals("Missing ')'", missing.getMessage());

        assertThrows(FormulaParseException.class, () -> parser.parse("=1+"));
        assertThrows(FormulaParseException.class, () -> parser.parse("=A1:5"));
        assertThrows(FormulaParseException.class, () -> parser.parse("=1 2"));
    }
}
