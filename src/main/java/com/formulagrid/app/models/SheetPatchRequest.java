package com.formulagrid.app.models;

import java.util.ArrayList;
import java.util.List;

public class SheetPatchRequest {
    private List<CellEdit> edits = new ArrayList<>();

    public SheetPatchRequest() {
    }

    public SheetPatchRequest(List<CellEdit> edits) {
        this.edits = edits;
    }

    public List<CellEdit> getEdits() {
        return edits;
    }

    public void setEdits(List<CellEdit> edits) {
        this.edits = edits;
    }
}
