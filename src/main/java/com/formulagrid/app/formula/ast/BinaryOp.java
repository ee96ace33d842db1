package com.formulagrid.app.formula.ast;

import java.util.Objects;

public final class BinaryOp implements FormulaAst {

    private final BinaryOperator op;
    private final FormulaAst left;
    private final FormulaAst right;

    public BinaryOp(BinaryOperator op, FormulaAst left, FormulaAst right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOp() {
        return op;
    }

    public FormulaAst getLeft() {
        return left;
    }

    public FormulaAst getRight() {
        return right;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryOp)) {
            return false;
        }
        BinaryOp that = (BinaryOp) o;
        return op == that.op && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + op.getSymbol() + " " + right + ")";
    }
}
