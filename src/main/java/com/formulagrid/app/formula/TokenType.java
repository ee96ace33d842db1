package com.formulagrid.app.formula;

public enum TokenType {
    NUMBER,
    STRING,
    CELL_REF,
    FUNCTION,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    EOF
}
