package com.formulagrid.app.models;

/**
 * Body of POST /sheets. Rows and cols fall back to configured defaults when absent.
 */
public class SheetCreateRequest {
    private String name;
    private Integer rows;
    private Integer cols;

    public SheetCreateRequest() {
    }

    public SheetCreateRequest(String name, Integer rows, Integer cols) {
        this.name = name;
        this.rows = rows;
        this.cols = cols;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Integer getRows() {
        return rows;
    }

    public void setRows(Integer rows) {
        this.rows = rows;
    }

    public Integer getCols() {
        return cols;
    }

    public void setCols(Integer cols) {
        this.cols = cols;
    }
}
