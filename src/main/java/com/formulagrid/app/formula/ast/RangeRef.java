package com.formulagrid.app.formula.ast;

import com.formulagrid.app.models.CellAddress;

import java.util.Objects;

/**
 * An inclusive rectangle of cells given by two corners ("A1:B3").
 * Only meaningful as a function argument.
 */
public final class RangeRef implements FormulaAst {

    private final CellAddress start;
    private final CellAddress end;

    public RangeRef(CellAddress start, CellAddress end) {
        this.start = start;
        this.end = end;
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RangeRef)) {
            return false;
        }
        RangeRef that = (RangeRef) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
