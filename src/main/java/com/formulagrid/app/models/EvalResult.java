package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Outcome of evaluating one cell: a scalar value (null when empty),
 * or an error with a code and message.
 */
public final class EvalResult {

    private final Object value;
    private final ErrorDetail error;

    private EvalResult(Object value, ErrorDetail error) {
        this.value = value;
        this.error = error;
    }

    public static EvalResult of(Object value) {
        return new EvalResult(Scalars.normalize(value), null);
    }

    public static EvalResult empty() {
        return new EvalResult(null, null);
    }

    public static EvalResult error(ErrorCode code, String message) {
        return new EvalResult(null, new ErrorDetail(code, message));
    }

    public Object getValue() {
        return value;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public ErrorDetail getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * The value as shown to API clients: the scalar itself, or "#CODE!".
     */
    public Object displayValue() {
        return error != null ? error.getCode().token() : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvalResult)) {
            return false;
        }
        EvalResult that = (EvalResult) o;
        return Objects.equals(value, that.value) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error != null ? error.toString() : String.valueOf(value);
    }

    public static final class ErrorDetail {
        private final ErrorCode code;
        private final String message;

        public ErrorDetail(ErrorCode code, String message) {
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
        public boolean equals(Object o) {
            if (!(o instanceof ErrorDetail)) {
                return false;
            }
            ErrorDetail that = (ErrorDetail) o;
            return code == that.code && Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(code, message);
        }

        @Override
        public String toString() {
            return code.token() + " " + message;
        }
    }
}
