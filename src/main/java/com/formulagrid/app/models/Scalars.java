package com.formulagrid.app.models;

/**
 * Helpers for the scalar values cells hold and formulas produce:
 * Double, String, Boolean, or null for an empty cell.
 */
public final class Scalars {

    private Scalars() {
    }

    /**
     * Coerces any incoming number (e.g. an Integer from JSON) to Double.
     * Rejects anything that is not a scalar.
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Double) {
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("Not a scalar value: " + value.getClass().getSimpleName());
    }

    public static boolean isNumber(Object value) {
        return value instanceof Double;
    }

    /**
     * Falsy values are null, false, 0 and the empty string.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Double) {
            return (Double) value != 0.0;
        }
        return !"".equals(value);
    }

    /**
     * Text form used for string concatenation: whole numbers print
     * without a fraction, booleans as TRUE/FALSE, empty as "".
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "TRUE" : "FALSE";
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        return value.toString();
    }
}
