package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.FormulaParseException;
import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.formula.ast.BinaryOp;
import com.formulagrid.app.formula.ast.BinaryOperator;
import com.formulagrid.app.formula.ast.BooleanLiteral;
import com.formulagrid.app.formula.ast.CellRef;
import com.formulagrid.app.formula.ast.FormulaAst;
import com.formulagrid.app.formula.ast.FunctionCall;
import com.formulagrid.app.formula.ast.NumberLiteral;
import com.formulagrid.app.formula.ast.RangeRef;
import com.formulagrid.app.formula.ast.StringLiteral;
import com.formulagrid.app.formula.ast.UnaryNegation;
import com.formulagrid.app.grid.AddressCodec;
import com.formulagrid.app.grid.ParsedAddress;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser with precedence climbing.
 * <p>
 * Binding strength, loosest first: {@code = <>}, {@code < <= > >=}, {@code + -},
 * {@code * /}, {@code ^}. Operators of equal strength associate to the left.
 * A parser instance is good for one formula.
 * <p>
 * Nesting (parentheses, unary minus, function calls and operator chains)
 * is capped at {@link #MAX_DEPTH} levels; deeper formulas are rejected as
 * parse errors.
 */
public class Parser {

    public static final int MAX_DEPTH = 256;

    private final Lexer lexer;
    private Token current;
    private int depth;

    public Parser(String formula) {
        this.lexer = new Lexer(formula);
        this.current = lexer.nextToken();
    }

    /**
     * Parses the whole formula; anything left over after a complete expression is an error.
     */
    public FormulaAst parse() {
        FormulaAst result = parseExpression(0);
        if (!current.is(TokenType.EOF)) {
            throw new FormulaParseException("Unexpected token: " + current.getValue(), current);
        }
        if (!current.getValue().isEmpty()) {
            throw new FormulaParseException("Unexpected character: " + current.getValue(), current);
        }
        return result;
    }

    private FormulaAst parseExpression(int minPrecedence) {
        descend();
        // Each operator folded into the left operand deepens the tree by one
        int chained = 0;
        try {
            FormulaAst left = parsePrimary();

            while (current.is(TokenType.OPERATOR)) {
                BinaryOperator op = BinaryOperator.fromSymbol(current.getValue());
                if (op == null) {
                    throw new FormulaParseException("Unknown operator: " + current.getValue(), current);
                }
                if (op.getPrecedence() < minPrecedence) {
                    break;
                }
                descend();
                chained++;
                advance();
                FormulaAst right = parseExpression(op.getPrecedence() + 1);
                left = new BinaryOp(op, left, right);
            }

            return left;
        } finally {
            depth -= 1 + chained;
        }
    }

    private FormulaAst parsePrimary() {
        descend();
        try {
            return parsePrimaryNode();
        } finally {
            depth--;
        }
    }

    private FormulaAst parsePrimaryNode() {
        Token token = current;

        switch (token.getType()) {
            case NUMBER:
                advance();
                return new NumberLiteral(parseNumber(token));
            case STRING:
                advance();
                return new StringLiteral(token.getValue());
            case CELL_REF:
                return parseReference();
            case FUNCTION:
                return parseFunctionCall();
            case LPAREN: {
                advance();
                FormulaAst inner = parseExpression(0);
                expect(TokenType.RPAREN);
                return inner;
            }
            case OPERATOR:
                if ("-".equals(token.getValue())) {
                    advance();
                    return new UnaryNegation(parsePrimary());
                }
                break;
            default:
                break;
        }

        if (token.is(TokenType.EOF) && token.getValue().isEmpty()) {
            throw new FormulaParseException("Unexpected end of formula", token);
        }
        throw new FormulaParseException("Unexpected token: " + token.getValue(), token);
    }

    private FormulaAst parseReference() {
        Token startToken = current;
        advance();

        if ("TRUE".equals(startToken.getValue()) || "FALSE".equals(startToken.getValue())) {
            return new BooleanLiteral("TRUE".equals(startToken.getValue()));
        }

        ParsedAddress start = toAddress(startToken);

        if (current.is(TokenType.COLON)) {
            advance();
            Token endToken = current;
            if (!endToken.is(TokenType.CELL_REF)) {
                throw new FormulaParseException("Expected cell reference after ':'", endToken);
            }
            advance();
            return new RangeRef(start.toCellAddress(), toAddress(endToken).toCellAddress());
        }

        return new CellRef(start.toCellAddress(), start.isFixedCol(), start.isFixedRow());
    }

    private FormulaAst parseFunctionCall() {
        String name = current.getValue();
        advance();
        expect(TokenType.LPAREN);

        List<FormulaAst> args = new ArrayList<>();
        if (!current.is(TokenType.RPAREN)) {
            args.add(parseExpression(0));
            while (current.is(TokenType.COMMA)) {
                advance();
                args.add(parseExpression(0));
            }
        }
        expect(TokenType.RPAREN);

        return new FunctionCall(name, args);
    }

    private ParsedAddress toAddress(Token token) {
        try {
            return AddressCodec.parseAddress(token.getValue());
        } catch (InvalidAddressException e) {
            throw new FormulaParseException("Invalid cell reference: " + token.getValue(), token);
        }
    }

    private double parseNumber(Token token) {
        try {
            return Double.parseDouble(token.getValue());
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Invalid number: " + token.getValue(), token);
        }
    }

    private void descend() {
        if (depth >= MAX_DEPTH) {
            throw new FormulaParseException("Formula nested too deeply", current);
        }
        depth++;
    }

    private void advance() {
        current = lexer.nextToken();
    }

    private void expect(TokenType type) {
        if (!current.is(type)) {
            throw new FormulaParseException("Expected " + type + " but got " + current.getType(), current);
        }
        advance();
    }
}
