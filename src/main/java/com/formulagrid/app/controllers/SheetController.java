package com.formulagrid.app.controllers;

import com.formulagrid.app.models.CellExplanation;
import com.formulagrid.app.models.PasteRequest;
import com.formulagrid.app.models.SheetCreateRequest;
import com.formulagrid.app.models.SheetPatchRequest;
import com.formulagrid.app.models.SheetSnapshot;
import com.formulagrid.app.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheets" is the base path.
 */
@RestController
@RequestMapping("/sheets")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheets
     * Body: { "name": "Budget", "rows": 20, "cols": 10 } (rows/cols optional).
     * Creates an empty sheet and returns its snapshot.
     */
    @PostMapping
    public ResponseEntity<SheetSnapshot> createSheet(@RequestBody SheetCreateRequest request) {
        return ResponseEntity.ok(sheetService.createSheet(request));
    }

    /**
     * GET /sheets/{sheetId}
     * Returns the stored cells plus "computedValues", e.g.
     * { "A1": 10.0, "B1": 20.0, "C1": "#DIV0!" }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<SheetSnapshot> getSheet(@PathVariable String sheetId) {
        return ResponseEntity.ok(sheetService.getSnapshot(sheetId));
    }

    /**
     * PATCH /sheets/{sheetId}
     * Body: { "edits": [ { "addr": "A1", "kind": "literal", "value": 5 },
     *                    { "addr": "B1", "kind": "formula", "formula": "=A1*2" },
     *                    { "addr": "C1", "kind": "clear" } ] }
     * Applies the batch and returns the re-evaluated snapshot.
     * A formula that doesn't parse is stored as a #PARSE! cell, not rejected.
     */
    @PatchMapping("/{sheetId}")
    public ResponseEntity<SheetSnapshot> applyEdits(@PathVariable String sheetId,
                                                    @RequestBody SheetPatchRequest request) {
        return ResponseEntity.ok(sheetService.applyEdits(sheetId, request.getEdits()));
    }

    /**
     * POST /sheets/{sheetId}/paste
     * Body: { "from": "C3", "to": "C4" }.
     */
    @PostMapping("/{sheetId}/paste")
    public ResponseEntity<SheetSnapshot> paste(@PathVariable String sheetId, @RequestBody PasteRequest request) {
        return ResponseEntity.ok(sheetService.pasteCell(sheetId, request.getFrom(), request.getTo()));
    }

    /**
     * GET /sheets/{sheetId}/cells/{address}/explain
     * Returns the cell's result and the formula cells evaluated to produce it.
     */
    @GetMapping("/{sheetId}/cells/{address}/explain")
    public ResponseEntity<CellExplanation> explainCell(@PathVariable String sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.explainCell(sheetId, address));
    }

    /**
     * GET /sheets/{sheetId}/forwardDependencies
     * For each formula cell => the set of cells it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, List<String>>> getForwardDependencyGraph(@PathVariable String sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheets/{sheetId}/reverseDependencies
     * For each referenced cell => the set of formula cells that reference it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, List<String>>> getReverseDependencyGraph(@PathVariable String sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }
}
