package com.formulagrid.app.formula.ast;

public final class BooleanLiteral implements FormulaAst {

    private final boolean value;

    public BooleanLiteral(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BooleanLiteral && ((BooleanLiteral) o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return value ? "TRUE" : "FALSE";
    }
}
