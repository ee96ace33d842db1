package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.formulagrid.app.formula.ast.FormulaAst;

/**
 * A cell holding formula source text together with its parsed tree.
 */
public final class FormulaCell implements Cell {

    private final String source;
    private final FormulaAst ast;

    public FormulaCell(String source, FormulaAst ast) {
        this.source = source;
        this.ast = ast;
    }

    @JsonProperty("src")
    public String getSource() {
        return source;
    }

    @JsonIgnore
    public FormulaAst getAst() {
        return ast;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFormula(this);
    }
}
