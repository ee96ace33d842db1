package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * What a single cell edit does: set a literal, set a formula, or clear the cell.
 */
public enum EditKind {
    LITERAL,
    FORMULA,
    CLEAR;

    /**
     * Allows case-insensitive JSON input.
     * For example, "literal" -> LITERAL, "Clear" -> CLEAR.
     */
    @JsonCreator
    public static EditKind fromValue(String value) {
        return EditKind.valueOf(value.toUpperCase());
    }
}
