package com.formulagrid.app.grid;

/**
 * The position of a row and/or column insertion or deletion.
 * Either index may be absent (null).
 */
public final class GridShift {

    private final Integer row;
    private final Integer col;

    private GridShift(Integer row, Integer col) {
        this.row = row;
        this.col = col;
    }

    public static GridShift atRow(int row) {
        return new GridShift(row, null);
    }

    public static GridShift atColumn(int col) {
        return new GridShift(null, col);
    }

    public static GridShift at(int row, int col) {
        return new GridShift(row, col);
    }

    public Integer getRow() {
        return row;
    }

    public Integer getCol() {
        return col;
    }
}
