package com.formulagrid.app.grid;

/**
 * Formula text after a paste translation, plus whether any reference
 * was pushed off the grid (and so rewritten to #REF!).
 */
public final class FormulaTranslation {

    private final String formula;
    private final boolean offGrid;

    public FormulaTranslation(String formula, boolean offGrid) {
        this.formula = formula;
        this.offGrid = offGrid;
    }

    public String getFormula() {
        return formula;
    }

    public boolean hasOffGridReference() {
        return offGrid;
    }

    @Override
    public String toString() {
        return formula;
    }
}
