package com.formulagrid.app.models;

import java.time.Instant;
import java.util.Map;

/**
 * What the API returns for a sheet: its stored cells plus the value
 * every cell currently shows ("computedValues"), where errors appear
 * as "#CODE!" tokens.
 */
public class SheetSnapshot {
    private final String id;
    private final String name;
    private final int rows;
    private final int cols;
    private final Map<String, Cell> cells;
    private final Map<String, Object> computedValues;
    private final Instant updatedAt;

    public SheetSnapshot(Sheet sheet, Map<String, Cell> cells, Map<String, Object> computedValues) {
        this.id = sheet.getId();
        this.name = sheet.getName();
        this.rows = sheet.getRows();
        this.cols = sheet.getCols();
        this.cells = cells;
        this.computedValues = computedValues;
        this.updatedAt = sheet.getUpdatedAt();
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

    public Map<String, Cell> getCells() {
        return cells;
    }

    public Map<String, Object> getComputedValues() {
        return computedValues;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
