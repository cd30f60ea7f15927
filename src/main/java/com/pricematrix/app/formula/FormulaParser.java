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
import com.pricematrix.app.functions.SpreadsheetFunction;
import com.pricematrix.app.models.ErrorType;
import com.pricematrix.app.models.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for formula text. Precedence, lowest first:
 * comparison, concatenation, '+ -', '* /', '^', unary sign, primary.
 * Every binary level is left associative.
 * Unknown function names, wrong argument counts and unbalanced parentheses
 * are rejected here rather than at evaluation time.
 */
@Component
public class FormulaParser {

    private final FunctionLibrary functions;

    public FormulaParser(FunctionLibrary functions) {
        this.functions = functions;
    }

    /**
     * Parses a formula; a leading '=' is optional.
     */
    public FormulaNode parse(String text) throws FormulaParseException {
        String body = text.startsWith("=") ? text.substring(1) : text;
        return new Cursor(FormulaTokenizer.tokenize(body)).parseFormula();
    }

    private final class Cursor {

        private final List<Token> tokens;
        private int index;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        FormulaNode parseFormula() throws FormulaParseException {
            if (peek().is(TokenType.EOF)) {
                throw new FormulaParseException("Empty formula", 0);
            }
            FormulaNode node = parseComparison();
            Token trailing = peek();
            if (trailing.is(TokenType.RPAREN)) {
                throw new FormulaParseException("Unbalanced ')'", trailing.getStart());
            }
            if (!trailing.is(TokenType.EOF)) {
                throw new FormulaParseException("Unexpected '" + trailing.getText() + "'", trailing.getStart());
            }
            return node;
        }

        private FormulaNode parseComparison() throws FormulaParseException {
            FormulaNode left = parseConcat();
            while (true) {
                BinaryOperator op = comparisonOperator(peek().getType());
                if (op == null) {
                    return left;
                }
                advance();
                left = new BinaryOpNode(op, left, parseConcat());
            }
        }

        private FormulaNode parseConcat() throws FormulaParseException {
            FormulaNode left = parseAdditive();
            while (peek().is(TokenType.AMPERSAND)) {
                advance();
                left = new BinaryOpNode(BinaryOperator.CONCAT, left, parseAdditive());
            }
            return left;
        }

        private FormulaNode parseAdditive() throws FormulaParseException {
            FormulaNode left = parseMultiplicative();
            while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
                BinaryOperator op = advance().is(TokenType.PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
                left = new BinaryOpNode(op, left, parseMultiplicative());
            }
            return left;
        }

        private FormulaNode parseMultiplicative() throws FormulaParseException {
            FormulaNode left = parsePower();
            while (peek().is(TokenType.STAR) || peek().is(TokenType.SLASH)) {
                BinaryOperator op = advance().is(TokenType.STAR) ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
                left = new BinaryOpNode(op, left, parsePower());
            }
            return left;
        }

        private FormulaNode parsePower() throws FormulaParseException {
            FormulaNode left = parseUnary();
            while (peek().is(TokenType.CARET)) {
                advance();
                left = new BinaryOpNode(BinaryOperator.POWER, left, parseUnary());
            }
            return left;
        }

        private FormulaNode parseUnary() throws FormulaParseException {
            if (peek().is(TokenType.MINUS)) {
                advance();
                return new UnaryOpNode(UnaryOpNode.Operator.NEGATE, parseUnary());
            }
            if (peek().is(TokenType.PLUS)) {
                advance();
                return new UnaryOpNode(UnaryOpNode.Operator.PLUS, parseUnary());
            }
            return parsePrimary();
        }

        private FormulaNode parsePrimary() throws FormulaParseException {
            Token token = advance();
            switch (token.getType()) {
                case NUMBER:
                    return new LiteralNode(Value.number(Double.parseDouble(token.getText())));
                case STRING:
                    return new LiteralNode(Value.text(token.getText()));
                case BOOLEAN:
                    return new LiteralNode(Value.bool("TRUE".equals(token.getText())));
                case ERROR:
                    return new LiteralNode(Value.error(ErrorType.fromCode(token.getText())));
                case CELL_REF:
                    return parseReference(token);
                case FUNCTION:
                    return parseFunctionCall(token);
                case LPAREN:
                    FormulaNode inner = parseComparison();
                    expect(TokenType.RPAREN, "Missing ')'", token);
                    return inner;
                case EOF:
                    throw new FormulaParseException("Unexpected end of formula", token.getStart());
                default:
                    throw new FormulaParseException("Unexpected '" + token.getText() + "'", token.getStart());
            }
        }

        private FormulaNode parseReference(Token first) throws FormulaParseException {
            CellReference start = CellReference.parse(first.getText());
            if (!peek().is(TokenType.COLON)) {
                return new CellRefNode(start);
            }
            advance();
            Token second = advance();
            if (!second.is(TokenType.CELL_REF)) {
                throw new FormulaParseException("Range needs a cell reference after ':'", second.getStart());
            }
            return new RangeRefNode(start, CellReference.parse(second.getText()));
        }

        private FormulaNode parseFunctionCall(Token nameToken) throws FormulaParseException {
            String name = nameToken.getText().toUpperCase(Locale.ROOT);
            SpreadsheetFunction function = functions.find(name);
            if (function == null) {
                throw new FormulaParseException(ErrorType.UNKNOWN_FUNCTION,
                        "Unknown function '" + nameToken.getText() + "'", nameToken.getStart());
            }
            expect(TokenType.LPAREN, "Expected '(' after " + name, nameToken);
            List<FormulaNode> args = new ArrayList<>();
            if (!peek().is(TokenType.RPAREN)) {
                do {
                    args.add(parseComparison());
                } while (acceptComma());
            }
            expect(TokenType.RPAREN, "Missing ')' after arguments of " + name, nameToken);
            if (args.size() < function.getMinArgs() || args.size() > function.getMaxArgs()) {
                throw new FormulaParseException(name + " " + arityText(function) + ", got " + args.size(),
                        nameToken.getStart());
            }
            return new FunctionCallNode(function, args);
        }

        private boolean acceptComma() {
            if (peek().is(TokenType.COMMA)) {
                advance();
                return true;
            }
            return false;
        }

        private void expect(TokenType type, String message, Token opener) throws FormulaParseException {
            Token token = peek();
            if (!token.is(type)) {
                throw new FormulaParseException(message, token.is(TokenType.EOF) ? opener.getStart() : token.getStart());
            }
            advance();
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token advance() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }
    }

    private static BinaryOperator comparisonOperator(TokenType type) {
        switch (type) {
            case EQ: return BinaryOperator.EQUAL;
            case NE: return BinaryOperator.NOT_EQUAL;
            case LT: return BinaryOperator.LESS;
            case GT: return BinaryOperator.GREATER;
            case LE: return BinaryOperator.LESS_EQUAL;
            case GE: return BinaryOperator.GREATER_EQUAL;
            default: return null;
        }
    }

    private static String arityText(SpreadsheetFunction function) {
        if (function.getMinArgs() == function.getMaxArgs()) {
            return "expects " + function.getMinArgs() + " argument(s)";
        }
        if (function.getMaxArgs() == Integer.MAX_VALUE) {
            return "expects at least " + function.getMinArgs() + " argument(s)";
        }
        return "expects " + function.getMinArgs() + " to " + function.getMaxArgs() + " arguments";
    }
}
