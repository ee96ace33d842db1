package com.formulagrid.app.exceptions;

import com.formulagrid.app.models.ErrorCode;

/**
 * Thrown when the right operand of a division evaluates to 0.
 */
public class DivisionByZeroException extends FormulaException {
    public DivisionByZeroException(String message) {
        super(ErrorCode.DIV0, message);
    }
}
