package com.formulagrid.app.formula.ast;

public final class UnaryNegation implements FormulaAst {

    private final FormulaAst operand;

    public UnaryNegation(FormulaAst operand) {
        this.operand = operand;
    }

    public FormulaAst getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNegation(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnaryNegation && ((UnaryNegation) o).operand.equals(operand);
    }

    @Override
    public int hashCode() {
        return operand.hashCode() * 31 + 1;
    }

    @Override
    public String toString() {
        return "-" + operand;
    }
}
