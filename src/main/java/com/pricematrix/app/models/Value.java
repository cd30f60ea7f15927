package com.pricematrix.app.models;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable, dynamically typed result of evaluating a cell or sub-expression.
 * Exactly one payload is meaningful, selected by {@link #getType()}.
 * Callers switch on the type; there is no implicit coercion here.
 */
public final class Value {

    public static final Value BLANK = new Value(ValueType.BLANK, 0d, null, false, null);
    public static final Value TRUE = new Value(ValueType.BOOLEAN, 0d, null, true, null);
    public static final Value FALSE = new Value(ValueType.BOOLEAN, 0d, null, false, null);
    public static final Value EMPTY_TEXT = new Value(ValueType.STRING, 0d, "", false, null);

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final ErrorType error;

    private Value(ValueType type, double number, String text, boolean bool, ErrorType error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
    }

    public static Value number(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return error(ErrorType.NUMBER_ERROR);
        }
        return new Value(ValueType.NUMBER, number, null, false, null);
    }

    public static Value text(String text) {
        return text.isEmpty() ? EMPTY_TEXT : new Value(ValueType.STRING, 0d, text, false, null);
    }

    public static Value bool(boolean bool) {
        return bool ? TRUE : FALSE;
    }

    public static Value error(ErrorType error) {
        return new Value(ValueType.ERROR, 0d, null, false, Objects.requireNonNull(error));
    }

    public ValueType getType() {
        return type;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public boolean isBlank() {
        return type == ValueType.BLANK;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public double getNumber() {
        requireType(ValueType.NUMBER);
        return number;
    }

    public String getText() {
        requireType(ValueType.STRING);
        return text;
    }

    public boolean getBoolean() {
        requireType(ValueType.BOOLEAN);
        return bool;
    }

    public ErrorType getError() {
        requireType(ValueType.ERROR);
        return error;
    }

    private void requireType(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Value is " + type + ", not " + expected);
        }
    }

    /**
     * Text shown in the grid for this value.
     */
    public String toDisplayText() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case STRING:
                return text;
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return error.getCode();
            case BLANK:
                return "";
            default:
                throw new IllegalStateException("Unhandled value type " + type);
        }
    }

    /**
     * Plain Java object for JSON responses: Double, String, Boolean, the error code, or null.
     */
    public Object toJsonValue() {
        switch (type) {
            case NUMBER:
                return number;
            case STRING:
                return text;
            case BOOLEAN:
                return bool;
            case ERROR:
                return error.getCode();
            case BLANK:
                return null;
            default:
                throw new IllegalStateException("Unhandled value type " + type);
        }
    }

    /**
     * Integral values print without a fraction; others in plain decimal notation.
     */
    public static String formatNumber(double number) {
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value that = (Value) o;
        return type == that.type
                && Double.compare(number, that.number) == 0
                && bool == that.bool
                && Objects.equals(text, that.text)
                && error == that.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error);
    }

    @Override
    public String toString() {
        return type + "(" + toDisplayText() + ")";
    }
}
