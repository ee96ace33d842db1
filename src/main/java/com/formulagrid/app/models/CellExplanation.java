package com.formulagrid.app.models;

import java.util.List;

/**
 * The result of evaluating one cell together with the trace of
 * formula cells that were evaluated to produce it, innermost first.
 */
public class CellExplanation {
    private final String address;
    private final EvalResult result;
    private final List<TraceEntry> trace;

    public CellExplanation(String address, EvalResult result, List<TraceEntry> trace) {
        this.address = address;
        this.result = result;
        this.trace = trace;
    }

    public String getAddress() {
        return address;
    }

    public EvalResult getResult() {
        return result;
    }

    public List<TraceEntry> getTrace() {
        return trace;
    }
}
