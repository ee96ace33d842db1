package com.formulagrid.app.engine;

import com.formulagrid.app.exceptions.FormulaException;
import com.formulagrid.app.models.CellAddress;
import com.formulagrid.app.models.ErrorCode;
import com.formulagrid.app.models.EvalResult;
import com.formulagrid.app.models.Sheet;
import com.formulagrid.app.models.TraceEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State for evaluating one top-level cell: the sheet, the cell itself,
 * the cells currently on the reference path (the cycle guard) and, when
 * explaining, the trace being built. Never shared between cells.
 * <p>
 * During a whole-sheet pass, {@code computed} holds the results of formula
 * cells already evaluated, so a reference to one of them is not walked again.
 */
class EvalContext {

    // Nested operators plus references followed; keeps evaluation well within the thread stack
    static final int MAX_DEPTH = 512;

    private final Sheet sheet;
    private final CellAddress currentCell;
    private final Set<CellAddress> visited = new LinkedHashSet<>();
    private final List<TraceEntry> trace;
    private final Map<CellAddress, EvalResult> computed;
    private int depth;

    EvalContext(Sheet sheet, CellAddress currentCell, boolean tracing) {
        this(sheet, currentCell, tracing, Collections.emptyMap());
    }

    EvalContext(Sheet sheet, CellAddress currentCell, boolean tracing, Map<CellAddress, EvalResult> computed) {
        this.sheet = sheet;
        this.currentCell = currentCell;
        this.trace = tracing ? new ArrayList<>() : null;
        this.computed = computed;
        visited.add(currentCell);
    }

    Sheet getSheet() {
        return sheet;
    }

    CellAddress getCurrentCell() {
        return currentCell;
    }

    Set<CellAddress> getVisited() {
        return visited;
    }

    /**
     * @return the result already computed for a formula cell in this pass, or null
     */
    EvalResult getComputed(CellAddress address) {
        return computed.get(address);
    }

    void descend() {
        if (++depth > MAX_DEPTH) {
            depth--;
            throw new FormulaException(ErrorCode.EVAL, "Reference chain too deep");
        }
    }

    void ascend() {
        depth--;
    }

    boolean isTracing() {
        return trace != null;
    }

    void record(TraceEntry entry) {
        if (trace != null) {
            trace.add(entry);
        }
    }

    List<TraceEntry> getTrace() {
        return trace;
    }
}
