package com.formulagrid.app.exceptions;

import com.formulagrid.app.formula.Token;
import com.formulagrid.app.models.ErrorCode;

/**
 * Thrown when formula text does not match the formula grammar.
 * Carries the token at which parsing gave up.
 */
public class FormulaParseException extends FormulaException {

    private final Token token;

    public FormulaParseException(String message, Token token) {
        super(ErrorCode.PARSE, message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
