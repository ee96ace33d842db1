package com.formulagrid.app.models;

import java.util.List;

/**
 * One formula cell visited while explaining an evaluation:
 * its source, what it reads, and the value it produced.
 */
public class TraceEntry {
    private final String cell;
    private final String formula;
    private final List<String> dependencies;
    private final List<String> ranges;
    private final Object value;

    public TraceEntry(String cell, String formula, List<String> dependencies, List<String> ranges, Object value) {
        this.cell = cell;
        this.formula = formula;
        this.dependencies = dependencies;
        this.ranges = ranges;
        this.value = value;
    }

    public String getCell() {
        return cell;
    }

    public String getFormula() {
        return formula;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public List<String> getRanges() {
        return ranges;
    }

    public Object getValue() {
        return value;
    }
}
