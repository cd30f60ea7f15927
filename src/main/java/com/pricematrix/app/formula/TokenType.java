package com.pricematrix.app.formula;

public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    CELL_REF,
    FUNCTION,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    AMPERSAND,
    EQ,
    NE,
    LT,
    GT,
    LE,
    GE,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    // Only produced by lenient tokenization
    UNKNOWN,
    EOF
}
