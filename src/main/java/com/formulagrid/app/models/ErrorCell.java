package com.formulagrid.app.models;

/**
 * A cell whose content could not be turned into a usable formula,
 * e.g. text that failed to parse.
 */
public final class ErrorCell implements Cell {

    private final ErrorCode code;
    private final String message;

    public ErrorCell(ErrorCode code, String message) {
        this.code = code;
        this.message = message;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitError(this);
    }
}
