package com.pricematrix.app.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    @Test
    void testDisplayText() {
        assertEquals("5", Value.number(5).toDisplayText());
        assertEquals("-2.5", Value.number(-2.5).toDisplayText());
        assertEquals("0.1", Value.number(0.1).toDisplayText());
        assertEquals("1000000000000000", Value.number(1e15).toDisplayText());
        assertEquals("TRUE", Value.TRUE.toDisplayText());
        assertEquals("", Value.BLANK.toDisplayText());
        assertEquals("#DIV/0!", Value.error(ErrorType.DIVIDE_BY_ZERO).toDisplayText());
        assertEquals("price", Value.text("price").toDisplayText());
    }

    @Test
    void testNonFiniteNumbersBecomeNumberErrors() {
        assertEquals(Value.error(ErrorType.NUMBER_ERROR), Value.number(Double.NaN));
        assertEquals(Value.error(ErrorType.NUMBER_ERROR), Value.number(Double.POSITIVE_INFINITY));
    }

    @Test
    void testAccessorsCheckTheType() {
        assertThrows(IllegalStateException.class, () -> Value.text("x").getNumber());
        assertThrows(IllegalStateException.class, () -> Value.BLANK.getError());
        assertEquals(ErrorType.CIRCULAR_REFERENCE, ErrorType.fromCode("#CIRC!"));
        assertNull(ErrorType.fromCode("#NOPE"));
    }
}
