package com.formulagrid.app.formula;

/**
 * Single-pass scanner producing formula tokens on demand.
 * <p>
 * A letter run followed by digits is a cell reference, a letter run followed
 * by '(' is a function name, and any other letter run is reported as an
 * (incomplete) cell reference for the parser to reject or reinterpret.
 * Characters the grammar doesn't know end the stream: they come back as an
 * EOF token whose value is the offending character.
 */
public class Lexer {

    private static final String OPERATOR_CHARS = "+-*/^<>=";

    private final String input;
    private int pos;

    public Lexer(String formula) {
        this.input = formula.startsWith("=") ? formula.substring(1) : formula;
    }

    public Token nextToken() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }

        if (pos >= input.length()) {
            return new Token(TokenType.EOF, "", pos);
        }

        int start = pos;
        char c = input.charAt(pos);

        if (OPERATOR_CHARS.indexOf(c) >= 0) {
            pos++;
            if (pos < input.length()) {
                char next = input.charAt(pos);
                if ((c == '<' && (next == '=' || next == '>')) || (c == '>' && next == '=')) {
                    pos++;
                    return new Token(TokenType.OPERATOR, "" + c + next, start);
                }
            }
            return new Token(TokenType.OPERATOR, String.valueOf(c), start);
        }

        switch (c) {
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", start);
            case ',':
                pos++;
                return new Token(TokenType.COMMA, ",", start);
            case ':':
                pos++;
                return new Token(TokenType.COLON, ":", start);
            case '"':
                return readString(start);
            default:
                break;
        }

        if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
            return readNumber(start);
        }

        if (isLetter(c) || c == '$') {
            return readReferenceOrFunction(start);
        }

        pos++;
        return new Token(TokenType.EOF, String.valueOf(c), start);
    }

    /**
     * Looks at the next token without consuming it.
     */
    public Token peek() {
        int saved = pos;
        Token token = nextToken();
        pos = saved;
        return token;
    }

    private Token readString(int start) {
        pos++; // opening quote
        StringBuilder value = new StringBuilder();
        while (pos < input.length() && input.charAt(pos) != '"') {
            value.append(input.charAt(pos));
            pos++;
        }
        if (pos < input.length()) {
            pos++; // closing quote
        }
        return new Token(TokenType.STRING, value.toString(), start);
    }

    private Token readNumber(int start) {
        while (pos < input.length() && (isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
            pos++;
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private Token readReferenceOrFunction(int start) {
        StringBuilder value = new StringBuilder();
        boolean fixedMarker = false;

        if (input.charAt(pos) == '$') {
            value.append('$');
            fixedMarker = true;
            pos++;
        }
        while (pos < input.length() && isLetter(input.charAt(pos))) {
            value.append(Character.toUpperCase(input.charAt(pos)));
            pos++;
        }

        if (!fixedMarker && pos < input.length() && input.charAt(pos) == '(') {
            return new Token(TokenType.FUNCTION, value.toString(), start);
        }

        if (pos + 1 < input.length() && input.charAt(pos) == '$' && isDigit(input.charAt(pos + 1))) {
            value.append('$');
            pos++;
        }
        while (pos < input.length() && isDigit(input.charAt(pos))) {
            value.append(input.charAt(pos));
            pos++;
        }
        return new Token(TokenType.CELL_REF, value.toString(), start);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
