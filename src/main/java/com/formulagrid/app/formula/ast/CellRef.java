package com.formulagrid.app.formula.ast;

import com.formulagrid.app.grid.AddressCodec;
import com.formulagrid.app.models.CellAddress;

import java.util.Objects;

/**
 * A single-cell reference. Column and row are independently fixed ($) or relative.
 */
public final class CellRef implements FormulaAst {

    private final CellAddress address;
    private final boolean fixedCol;
    private final boolean fixedRow;

    public CellRef(CellAddress address, boolean fixedCol, boolean fixedRow) {
        this.address = address;
        this.fixedCol = fixedCol;
        this.fixedRow = fixedRow;
    }

    public CellAddress getAddress() {
        return address;
    }

    public boolean isFixedCol() {
        return fixedCol;
    }

    public boolean isFixedRow() {
        return fixedRow;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CellRef)) {
            return false;
        }
        CellRef that = (CellRef) o;
        return address.equals(that.address) && fixedCol == that.fixedCol && fixedRow == that.fixedRow;
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, fixedCol, fixedRow);
    }

    @Override
    public String toString() {
        return AddressCodec.formatAddress(address.getCol(), address.getRow(), fixedCol, fixedRow);
    }
}
