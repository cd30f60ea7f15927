package com.pricematrix.app.engine;

import com.pricematrix.app.models.Cell;
import com.pricematrix.app.models.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StructuralEditTranslatorTest {

    private StructuralEditTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new StructuralEditTranslator();
    }

    @Test
    void testInsertColumnShiftsReferencesAtOrAfterIndex() {
        StructuralEdit edit = StructuralEdit.insertColumn(1);
        assertEquals("=C1+1", translator.rewriteFormula("=B1+1", edit));
        assertEquals("=A1+1", translator.rewriteFormula("=A1+1", edit));
        assertEquals("=SUM(A1:C3)", translator.rewriteFormula("=SUM(A1:B3)", edit));
    }

    @Test
    void testAbsoluteMarkersAreKeptButDoNotPin() {
        StructuralEdit edit = StructuralEdit.insertRow(0);
        assertEquals("=$B$2*2+B$3", translator.rewriteFormula("=$B$1*2+B$2", edit));
    }

    @Test
    void testDeletedReferenceBecomesRefError() {
        StructuralEdit edit = StructuralEdit.deleteRow(0);
        assertEquals("=#REF!+A1", translator.rewriteFormula("=A1+A2", edit));
        assertEquals("=SUM(#REF!)", translator.rewriteFormula("=SUM(A1:A3)", edit));
        assertEquals("=SUM(A1:A4)", translator.rewriteFormula("=SUM(A2:A5)", edit));
    }

    @Test
    void testDeletingInsideARangeShrinksIt() {
        assertEquals("=SUM(A1:A4)", translator.rewriteFormula("=SUM(A1:A5)", StructuralEdit.deleteRow(2)));
        assertEquals("=SUM(A1:C1)", translator.rewriteFormula("=SUM(A1:D1)", StructuralEdit.deleteColumn(1)));
    }

    @Test
    void testSpacingStringsAndLiteralsSurvive() {
        StructuralEdit edit = StructuralEdit.insertRow(0);
        assertEquals("= A2  +  1", translator.rewriteFormula("= A1  +  1", edit));
        assertEquals("=\"A1\"&A2", translator.rewriteFormula("=\"A1\"&A1", edit));
        assertEquals("A1", translator.rewriteFormula("A1", edit));
        assertEquals("=\"open", translator.rewriteFormula("=\"open", edit));
    }

    @Test
    void testReferencesAroundUnknownNamesAreStillShifted() {
        assertEquals("=foo+A2", translator.rewriteFormula("=foo+A1", StructuralEdit.insertRow(0)));
        assertEquals("=price*C1 ; 2x", translator.rewriteFormula("=price*B1 ; 2x", StructuralEdit.insertColumn(1)));
    }

    @Test
    void testTranslateMovesCellsAndDropsDeletedOnes() {
        Map<CellAddress, Cell> cells = new HashMap<>();
        cells.put(CellAddress.fromA1("A1"), new Cell("5"));
        cells.put(CellAddress.fromA1("A2"), new Cell("7"));
        cells.put(CellAddress.fromA1("B2"), new Cell("=A2*2"));

        Map<CellAddress, Cell> moved = translator.translate(cells, StructuralEdit.deleteRow(0));
        assertEquals(2, moved.size());
        assertEquals("7", moved.get(CellAddress.fromA1("A1")).getRawText());
        assertEquals("=A1*2", moved.get(CellAddress.fromA1("B1")).getRawText());
    }

    @Test
    void testShiftArithmetic() {
        StructuralEdit insert = StructuralEdit.insertRow(3);
        assertEquals(2, insert.shift(2));
        assertEquals(4, insert.shift(3));

        StructuralEdit delete = StructuralEdit.deleteColumn(3);
        assertEquals(StructuralEdit.DELETED, delete.shift(3));
        assertEquals(3, delete.shift(4));
        assertNull(delete.shift(CellAddress.fromA1("D1")));
        assertEquals("delete column 3", delete.describe());
    }
}
