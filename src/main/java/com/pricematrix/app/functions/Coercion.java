package com.pricematrix.app.functions;

import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Value;

import java.math.BigDecimal;

/**
 * Every implicit conversion the engine performs, in one place.
 * Each method either returns a value of the requested type or an error value.
 */
public final class Coercion {

    private Coercion() {
    }

    /**
     * Parses plain decimal text ("12", "-3.5", "1e3"); null if the text is not a number.
     */
    public static Double parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(trimmed).doubleValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Value toNumber(Value value) {
        switch (value.getType()) {
            case NUMBER:
            case ERROR:
                return value;
            case BLANK:
                return Value.number(0);
            case BOOLEAN:
                return Value.number(value.getBoolean() ? 1 : 0);
            case STRING:
                Double parsed = parseNumber(value.getText());
                return parsed == null ? Value.error(ErrorType.TYPE_MISMATCH) : Value.number(parsed);
            default:
                throw new IllegalStateException("Unhandled value type " + value.getType());
        }
    }

    public static Value toText(Value value) {
        switch (value.getType()) {
            case STRING:
            case ERROR:
                return value;
            case NUMBER:
            case BOOLEAN:
                return Value.text(value.toDisplayText());
            case BLANK:
                return Value.EMPTY_TEXT;
            default:
                throw new IllegalStateException("Unhandled value type " + value.getType());
        }
    }

    /**
     * Truthiness: 0, "", FALSE and blank are false; every other non-error value is true.
     */
    public static Value toBoolean(Value value) {
        switch (value.getType()) {
            case BOOLEAN:
            case ERROR:
                return value;
            case NUMBER:
                return Value.bool(value.getNumber() != 0);
            case BLANK:
                return Value.FALSE;
            case STRING:
                return Value.bool(!value.getText().isEmpty());
            default:
                throw new IllegalStateException("Unhandled value type " + value.getType());
        }
    }

    /**
     * Orders two non-error values: numbers numerically, text case-insensitively,
     * FALSE before TRUE, and across types NUMBER < STRING < BOOLEAN.
     * A blank takes the neutral value of the other side's type.
     */
    public static int compare(Value left, Value right) {
        if (left.isError() || right.isError()) {
            throw new IllegalArgumentException("Errors are not comparable");
        }
        Value a = left.isBlank() ? blankAs(right) : left;
        Value b = right.isBlank() ? blankAs(left) : right;
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        switch (a.getType()) {
            case NUMBER:
                return Double.compare(a.getNumber(), b.getNumber());
            case STRING:
                return a.getText().compareToIgnoreCase(b.getText());
            case BOOLEAN:
                return Boolean.compare(a.getBoolean(), b.getBoolean());
            case BLANK:
                return 0;
            default:
                throw new IllegalStateException("Unhandled value type " + a.getType());
        }
    }

    /**
     * Equality used by lookups: numbers exactly, text case-insensitively, blanks only match blanks.
     */
    public static boolean matches(Value key, Value candidate) {
        if (key.isError() || candidate.isError()) {
            return false;
        }
        if (key.isBlank() || candidate.isBlank()) {
            return key.isBlank() && candidate.isBlank();
        }
        return rank(key) == rank(candidate) && compare(key, candidate) == 0;
    }

    private static Value blankAs(Value other) {
        switch (other.getType()) {
            case NUMBER:
                return Value.number(0);
            case STRING:
                return Value.EMPTY_TEXT;
            case BOOLEAN:
                return Value.FALSE;
            default:
                return Value.BLANK;
        }
    }

    private static int rank(Value value) {
        switch (value.getType()) {
            case NUMBER:
                return 0;
            case STRING:
                return 1;
            case BOOLEAN:
                return 2;
            default:
                return 3;
        }
    }
}
