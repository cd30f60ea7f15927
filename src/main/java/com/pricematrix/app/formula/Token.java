package com.pricematrix.app.formula;

/**
 * A lexical token with its [start, end) offsets in the formula body,
 * so reference rewriting can splice the original text.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int start;
    private final int end;

    public Token(TokenType type, String text, int start, int end) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public TokenType getType() {
        return type;
    }

    /**
     * Lexeme as written, except STRING tokens which hold the unescaped content.
     */
    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "'" + text + "'@" + start;
    }
}
