package com.formulagrid.app.exceptions;

import com.formulagrid.app.models.ErrorCode;

/**
 * Thrown for malformed address text, or a reference that falls
 * outside the sheet's rows and columns.
 */
public class InvalidAddressException extends FormulaException {
    public InvalidAddressException(String message) {
        super(ErrorCode.REF, message);
    }
}
