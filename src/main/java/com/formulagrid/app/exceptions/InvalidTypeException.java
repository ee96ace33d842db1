package com.formulagrid.app.exceptions;

import com.formulagrid.app.models.ErrorCode;

/**
 * Thrown when an operator or function receives operands it cannot work with,
 * e.g. negating a string, a range where a single value is required,
 * a wrong argument count or an unknown function name.
 */
public class InvalidTypeException extends FormulaException {
    public InvalidTypeException(String message) {
        super(ErrorCode.EVAL, message);
    }
}
