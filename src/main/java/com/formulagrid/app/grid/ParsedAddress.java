package com.formulagrid.app.grid;

import com.formulagrid.app.models.CellAddress;

/**
 * Result of decoding an address token: 0-based indices plus the
 * per-axis fixed ($) markers.
 */
public final class ParsedAddress {

    private final int col;
    private final int row;
    private final boolean fixedCol;
    private final boolean fixedRow;

    public ParsedAddress(int col, int row, boolean fixedCol, boolean fixedRow) {
        this.col = col;
        this.row = row;
        this.fixedCol = fixedCol;
        this.fixedRow = fixedRow;
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    public boolean isFixedCol() {
        return fixedCol;
    }

    public boolean isFixedRow() {
        return fixedRow;
    }

    public CellAddress toCellAddress() {
        return new CellAddress(col, row);
    }

    @Override
    public String toString() {
        return AddressCodec.formatAddress(col, row, fixedCol, fixedRow);
    }
}
