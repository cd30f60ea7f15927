package com.pricematrix.app.formula;

import com.pricematrix.app.exceptions.FormulaParseException;
import com.pricematrix.app.models.ErrorType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits a formula body (the text after the leading '=') into tokens.
 * A '-' directly followed by a digit lexes as part of a negative number literal
 * only where an operand is expected; elsewhere it is the subtraction operator.
 */
public final class FormulaTokenizer {

    // After these tokens (or at the start) the next token must be an operand
    private static final Set<TokenType> OPERAND_EXPECTED = EnumSet.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.CARET,
            TokenType.AMPERSAND, TokenType.EQ, TokenType.NE, TokenType.LT, TokenType.GT,
            TokenType.LE, TokenType.GE, TokenType.LPAREN, TokenType.COMMA);

    private final String input;
    private final boolean lenient;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private FormulaTokenizer(String input, boolean lenient) {
        this.input = input;
        this.lenient = lenient;
    }

    public static List<Token> tokenize(String body) throws FormulaParseException {
        FormulaTokenizer tokenizer = new FormulaTokenizer(body, false);
        tokenizer.run();
        return tokenizer.tokens;
    }

    /**
     * Never fails: text that does not lex becomes UNKNOWN tokens, so the cell
     * references around it can still be found.
     */
    public static List<Token> tokenizeLenient(String body) {
        FormulaTokenizer tokenizer = new FormulaTokenizer(body, true);
        try {
            tokenizer.run();
        } catch (FormulaParseException e) {
            throw new IllegalStateException("Lenient tokenization failed", e);
        }
        return tokenizer.tokens;
    }

    private void run() throws FormulaParseException {
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos, pos));
                return;
            }
            int start = pos;
            try {
                readToken();
            } catch (FormulaParseException e) {
                if (!lenient) {
                    throw e;
                }
                skipUnknown(start);
            }
        }
    }

    private void readToken() throws FormulaParseException {
        char c = input.charAt(pos);
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            readNumber(pos);
        } else if (c == '-' && operandExpected() && (isDigit(peek(1)) || (peek(1) == '.' && isDigit(peek(2))))) {
            int start = pos;
            pos++;
            readNumber(start);
        } else if (c == '"') {
            readString();
        } else if (c == '#') {
            readErrorLiteral();
        } else if (Character.isLetter(c) || c == '$' || c == '_') {
            readIdentifier();
        } else {
            readOperator(c);
        }
    }

    /**
     * Consumes at least one character; a malformed number also takes the letters and
     * digits glued to it.
     */
    private void skipUnknown(int start) {
        char first = input.charAt(start);
        pos = Math.max(pos, start + 1);
        if (isDigit(first) || first == '.' || first == '-') {
            while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
                pos++;
            }
        }
        tokens.add(new Token(TokenType.UNKNOWN, input.substring(start, pos), start, pos));
    }

    private boolean operandExpected() {
        return tokens.isEmpty() || OPERAND_EXPECTED.contains(tokens.get(tokens.size() - 1).getType());
    }

    private void readNumber(int start) throws FormulaParseException {
        while (isDigit(peek(0))) {
            pos++;
        }
        if (peek(0) == '.') {
            pos++;
            while (isDigit(peek(0))) {
                pos++;
            }
        }
        if (peek(0) == 'e' || peek(0) == 'E') {
            int mark = pos;
            pos++;
            if (peek(0) == '+' || peek(0) == '-') {
                pos++;
            }
            if (!isDigit(peek(0))) {
                // "2E" is not an exponent; let the identifier rules reject it
                pos = mark;
            } else {
                while (isDigit(peek(0))) {
                    pos++;
                }
            }
        }
        if (Character.isLetter(peek(0))) {
            throw new FormulaParseException("Malformed number near '" + input.substring(start, pos + 1) + "'", start);
        }
        tokens.add(new Token(TokenType.NUMBER, input.substring(start, pos), start, pos));
    }

    private void readString() throws FormulaParseException {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= input.length()) {
                throw new FormulaParseException("Unterminated string literal", start);
            }
            char c = input.charAt(pos);
            if (c == '"') {
                if (peek(1) == '"') {
                    sb.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                break;
            }
            sb.append(c);
            pos++;
        }
        tokens.add(new Token(TokenType.STRING, sb.toString(), start, pos));
    }

    private void readErrorLiteral() throws FormulaParseException {
        int start = pos;
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '/' || c == '!' || c == '?') {
                pos++;
            } else {
                break;
            }
        }
        String text = input.substring(start, pos);
        if (ErrorType.fromCode(text) == null) {
            throw new FormulaParseException("Unknown error literal '" + text + "'", start);
        }
        tokens.add(new Token(TokenType.ERROR, text, start, pos));
    }

    private void readIdentifier() throws FormulaParseException {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '$' || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        String text = input.substring(start, pos);
        if (nextNonSpace() == '(') {
            tokens.add(new Token(TokenType.FUNCTION, text, start, pos));
        } else if (CellReference.parse(text) != null) {
            tokens.add(new Token(TokenType.CELL_REF, text, start, pos));
        } else {
            String upper = text.toUpperCase(Locale.ROOT);
            if (upper.equals("TRUE") || upper.equals("FALSE")) {
                tokens.add(new Token(TokenType.BOOLEAN, upper, start, pos));
            } else {
                throw new FormulaParseException(ErrorType.UNKNOWN_FUNCTION, "Unknown name '" + text + "'", start);
            }
        }
    }

    private void readOperator(char c) throws FormulaParseException {
        int start = pos;
        TokenType type;
        switch (c) {
            case '+': type = TokenType.PLUS; break;
            case '-': type = TokenType.MINUS; break;
            case '*': type = TokenType.STAR; break;
            case '/': type = TokenType.SLASH; break;
            case '^': type = TokenType.CARET; break;
            case '&': type = TokenType.AMPERSAND; break;
            case '=': type = TokenType.EQ; break;
            case '(': type = TokenType.LPAREN; break;
            case ')': type = TokenType.RPAREN; break;
            case ',': type = TokenType.COMMA; break;
            case ':': type = TokenType.COLON; break;
            case '<':
                if (peek(1) == '>') {
                    type = TokenType.NE;
                    pos++;
                } else if (peek(1) == '=') {
                    type = TokenType.LE;
                    pos++;
                } else {
                    type = TokenType.LT;
                }
                break;
            case '>':
                if (peek(1) == '=') {
                    type = TokenType.GE;
                    pos++;
                } else {
                    type = TokenType.GT;
                }
                break;
            default:
                throw new FormulaParseException("Unexpected character '" + c + "'", start);
        }
        pos++;
        tokens.add(new Token(type, input.substring(start, pos), start, pos));
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private char nextNonSpace() {
        int i = pos;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
