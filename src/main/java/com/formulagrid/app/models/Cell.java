package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Content of a single spreadsheet cell: exactly one of
 * a literal scalar, a parsed formula, or a stored error.
 * Cells are immutable; editing a cell replaces it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LiteralCell.class, name = "literal"),
        @JsonSubTypes.Type(value = FormulaCell.class, name = "formula"),
        @JsonSubTypes.Type(value = ErrorCell.class, name = "error")
})
public interface Cell {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLiteral(LiteralCell cell);

        R visitFormula(FormulaCell cell);

        R visitError(ErrorCell cell);
    }
}
