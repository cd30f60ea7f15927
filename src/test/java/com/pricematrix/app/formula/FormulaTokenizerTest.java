package com.pricematrix.app.formula;

import com.pricematrix.app.exceptions.FormulaParseException;
import com.pricematrix.app.models.ErrorType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaTokenizerTest {

    private static List<TokenType> types(String body) throws FormulaParseException {
        List<TokenType> types = new ArrayList<>();
        for (Token token : FormulaTokenizer.tokenize(body)) {
            types.add(token.getType());
        }
        return types;
    }

    @Test
    void testMinusIsOperatorAfterAnOperand() throws FormulaParseException {
        assertEquals(List.of(TokenType.CELL_REF, TokenType.MINUS, TokenType.NUMBER, TokenType.EOF),
                types("A1-1"));
        assertEquals(List.of(TokenType.NUMBER, TokenType.MINUS, TokenType.NUMBER, TokenType.EOF),
                types("2-1"));
        assertEquals(List.of(TokenType.RPAREN, TokenType.MINUS, TokenType.NUMBER, TokenType.EOF),
                types(")-1"));
    }

    @Test
    void testNegativeLiteralWhereOperandExpected() throws FormulaParseException {
        List<Token> tokens = FormulaTokenizer.tokenize("2*-3");
        assertEquals(TokenType.NUMBER, tokens.get(2).getType());
        assertEquals("-3", tokens.get(2).getText());

        List<Token> leading = FormulaTokenizer.tokenize("-1.5");
        assertEquals("-1.5", leading.get(0).getText());
    }

    @Test
    void testOffsetsPointIntoTheBody() throws FormulaParseException {
        List<Token> tokens = FormulaTokenizer.tokenize("SUM( $B$2 : C3 )");
        Token first = tokens.get(2);
        assertEquals(TokenType.CELL_REF, first.getType());
        assertEquals("$B$2", first.getText());
        assertEquals(5, first.getStart());
        assertEquals(9, first.getEnd());
    }

    @Test
    void testStringsWithEscapedQuotes() throws FormulaParseException {
        List<Token> tokens = FormulaTokenizer.tokenize("\"say \"\"hi\"\"\"&A1");
        assertEquals(TokenType.STRING, tokens.get(0).getType());
        assertEquals("say \"hi\"", tokens.get(0).getText());
        assertEquals(TokenType.AMPERSAND, tokens.get(1).getType());
    }

    @Test
    void testComparisonOperators() throws FormulaParseException {
        assertEquals(List.of(TokenType.CELL_REF, TokenType.NE, TokenType.NUMBER, TokenType.EOF), types("A1<>0"));
        assertEquals(List.of(TokenType.CELL_REF, TokenType.LE, TokenType.NUMBER, TokenType.EOF), types("A1<=0"));
        assertEquals(List.of(TokenType.CELL_REF, TokenType.GE, TokenType.NUMBER, TokenType.EOF), types("A1>=0"));
    }

    @Test
    void testErrorAndBooleanLiterals() throws FormulaParseException {
        assertEquals(List.of(TokenType.ERROR, TokenType.PLUS, TokenType.BOOLEAN, TokenType.EOF), types("#REF!+true"));
    }

    @Test
    void testBadInput() {
        FormulaParseException unterminated = assertThrows(FormulaParseException.class,
                () -> FormulaTokenizer.tokenize("\"open"));
        assertEquals(ErrorType.PARSE, unterminated.getErrorType());
        assertEquals(0, unterminated.getPosition());

        FormulaParseException name = assertThrows(FormulaParseException.class,
                () -> FormulaTokenizer.tokenize("1+price"));
        assertEquals(ErrorType.UNKNOWN_FUNCTION, name.getErrorType());
        assertEquals(2, name.getPosition());

        assertThrows(FormulaParseException.class, () -> FormulaTokenizer.tokenize("1 ; 2"));
        assertThrows(FormulaParseException.class, () -> FormulaTokenizer.tokenize("#WHAT"));
    }

    @Test
    void testLenientTokenizationKeepsGoingPastBadText() {
        List<Token> tokens = FormulaTokenizer.tokenizeLenient("foo+A1");
        assertEquals(TokenType.UNKNOWN, tokens.get(0).getType());
        assertEquals("foo", tokens.get(0).getText());
        assertEquals(TokenType.CELL_REF, tokens.get(2).getType());
        assertEquals(4, tokens.get(2).getStart());

        List<TokenType> types = new ArrayList<>();
        for (Token token : FormulaTokenizer.tokenizeLenient("2A1 ; B2")) {
            types.add(token.getType());
        }
        assertEquals(List.of(TokenType.UNKNOWN, TokenType.UNKNOWN, TokenType.CELL_REF, TokenType.EOF), types);
    }
}
