package com.pricematrix.app.models;

import com.pricematrix.app.exceptions.InvalidCoordinateException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void testColumnNamesAreBijectiveBase26() {
        assertEquals("A", CellAddress.columnName(0));
        assertEquals("Z", CellAddress.columnName(25));
        assertEquals("AA", CellAddress.columnName(26));
        assertEquals("AZ", CellAddress.columnName(51));
        assertEquals("BA", CellAddress.columnName(52));
        assertEquals("ZZ", CellAddress.columnName(701));
        assertEquals("AAA", CellAddress.columnName(702));

        assertEquals(0, CellAddress.columnIndex("a"));
        assertEquals(27, CellAddress.columnIndex("AB"));
        assertEquals(702, CellAddress.columnIndex("AAA"));
    }

    @Test
    void testFromA1() {
        assertEquals(new CellAddress(6, 1), CellAddress.fromA1("B7"));
        assertEquals(new CellAddress(6, 1), CellAddress.fromA1("$B$7"));
        assertEquals("AA10", new CellAddress(9, 26).toA1());

        assertThrows(InvalidCoordinateException.class, () -> CellAddress.fromA1("A0"));
        assertThrows(InvalidCoordinateException.class, () -> CellAddress.fromA1("7B"));
        assertThrows(InvalidCoordinateException.class, () -> CellAddress.fromA1(""));
    }

    @Test
    void testNegativeCoordinatesAreRejected() {
        assertThrows(InvalidCoordinateException.class, () -> new CellAddress(-1, 0));
        assertThrows(InvalidCoordinateException.class, () -> new CellAddress(0, -1));
    }

    @Test
    void testRowMajorOrdering() {
        TreeSet<CellAddress> sorted = new TreeSet<>(Arrays.asList(
                CellAddress.fromA1("B2"), CellAddress.fromA1("A2"), CellAddress.fromA1("C1")));
        List<CellAddress> expected = Arrays.asList(
                CellAddress.fromA1("C1"), CellAddress.fromA1("A2"), CellAddress.fromA1("B2"));
        assertEquals(expected, Arrays.asList(sorted.toArray(new CellAddress[0])));
    }

    /**
     * Ranges normalize ascending whatever corner comes first, and clip to the bounds.
     */
    @Test
    void testRangeNormalizationAndClipping() {
        CellRange range = new CellRange(CellAddress.fromA1("C3"), CellAddress.fromA1("A1"));
        assertEquals("A1:C3", range.toA1());
        assertEquals(9, range.addresses().size());
        assertEquals(CellAddress.fromA1("A1"), range.addresses().get(0));
        assertTrue(range.contains(CellAddress.fromA1("B2")));

        CellRange clipped = range.clip(2, 2);
        assertEquals("A1:B2", clipped.toA1());
        assertNull(new CellRange(CellAddress.fromA1("E5"), CellAddress.fromA1("F6")).clip(2, 2));
    }
}
