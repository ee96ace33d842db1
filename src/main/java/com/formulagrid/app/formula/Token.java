package com.formulagrid.app.formula;

/**
 * One lexical unit of formula text, with its offset in the
 * formula body (after the leading '=' is removed).
 */
public final class Token {

    private final TokenType type;
    private final String value;
    private final int position;

    public Token(TokenType type, String value, int position) {
        this.type = type;
        this.value = value;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + position;
    }
}
