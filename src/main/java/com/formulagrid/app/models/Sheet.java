package com.formulagrid.app.models;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents an entire spreadsheet:
 * - An identifier and display name
 * - A fixed extent (rows x cols)
 * - A sparse map of address -> Cell (absent key = empty cell)
 * <p>
 * A Sheet is never modified in place. Edits build a new Sheet
 * which replaces the stored one.
 */
public final class Sheet {

    private final String id;
    private final String name;
    private final int rows;
    private final int cols;
    private final Map<CellAddress, Cell> cells;
    private final Instant updatedAt;

    public Sheet(String id, String name, int rows, int cols, Map<CellAddress, Cell> cells, Instant updatedAt) {
        this.id = id;
        this.name = name;
        this.rows = rows;
        this.cols = cols;
        this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
        this.updatedAt = updatedAt;
    }

    public static Sheet empty(String id, String name, int rows, int cols) {
        return new Sheet(id, name, rows, cols, Collections.emptyMap(), Instant.now());
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public Map<CellAddress, Cell> getCells() {
        return cells;
    }

    /**
     * @return the cell at the address, or null when empty
     */
    public Cell getCell(CellAddress address) {
        return cells.get(address);
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * A copy of this sheet holding the given cells, stamped with the current time.
     */
    public Sheet withCells(Map<CellAddress, Cell> newCells) {
        return new Sheet(id, name, rows, cols, newCells, Instant.now());
    }
}
