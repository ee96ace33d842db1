package com.formulagrid.app.formula.ast;

public interface AstVisitor<R> {

    R visitNumber(NumberLiteral node);

    R visitString(StringLiteral node);

    R visitBoolean(BooleanLiteral node);

    R visitCellRef(CellRef node);

    R visitRange(RangeRef node);

    R visitFunctionCall(FunctionCall node);

    R visitBinary(BinaryOp node);

    R visitNegation(UnaryNegation node);
}
