package com.formulagrid.app.exceptions;

import com.formulagrid.app.models.ErrorCode;

/**
 * Base for every failure raised while parsing or evaluating a formula.
 * The evaluator turns these into error results carrying {@link #getCode()}.
 */
public class FormulaException extends RuntimeException {

    private final ErrorCode code;

    public FormulaException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
