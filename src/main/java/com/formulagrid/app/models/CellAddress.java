package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.grid.AddressCodec;

import java.util.Objects;

/**
 * A single cell location in a sheet.
 * Column and row are 0-based; the canonical text form is "A1".
 * Fixed-reference markers ($) are a property of a formula reference,
 * not of the location, so they are dropped when parsing.
 */
public final class CellAddress implements Comparable<CellAddress> {

    private final int col;
    private final int row;

    public CellAddress(int col, int row) {
        if (col < 0 || row < 0) {
            throw new InvalidAddressException("Cell indices must be non-negative: col=" + col + ", row=" + row);
        }
        this.col = col;
        this.row = row;
    }

    /**
     * Parses "A1", "$B$2", etc. Throws InvalidAddressException on malformed text.
     */
    @JsonCreator
    public static CellAddress parse(String text) {
        return AddressCodec.parseAddress(text).toCellAddress();
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    @JsonValue
    @Override
    public String toString() {
        return AddressCodec.formatAddress(col, row);
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return col == that.col && row == that.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(col, row);
    }
}
