package com.formulagrid.app.exceptions;

import com.formulagrid.app.models.ErrorCode;

/**
 * Thrown when resolving a cell reference leads back to a cell
 * already being evaluated (a cell referencing itself, or a multi-cell loop).
 */
public class CircularReferenceException extends FormulaException {
    public CircularReferenceException(String message) {
        super(ErrorCode.CYCLE, message);
    }
}
