package com.formulagrid.app.engine;

import com.formulagrid.app.formula.ast.AstVisitor;
import com.formulagrid.app.formula.ast.BinaryOp;
import com.formulagrid.app.formula.ast.BooleanLiteral;
import com.formulagrid.app.formula.ast.CellRef;
import com.formulagrid.app.formula.ast.FormulaAst;
import com.formulagrid.app.formula.ast.FunctionCall;
import com.formulagrid.app.formula.ast.NumberLiteral;
import com.formulagrid.app.formula.ast.RangeRef;
import com.formulagrid.app.formula.ast.StringLiteral;
import com.formulagrid.app.formula.ast.UnaryNegation;
import com.formulagrid.app.grid.AddressCodec;
import com.formulagrid.app.models.CellAddress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a formula tree once and gathers every cell it reads:
 * single references as written, and ranges as written.
 */
public class ReferenceCollector implements AstVisitor<Void> {

    private final Set<CellAddress> references = new LinkedHashSet<>();
    private final List<RangeRef> ranges = new ArrayList<>();

    public static ReferenceCollector collect(FormulaAst ast) {
        ReferenceCollector collector = new ReferenceCollector();
        ast.accept(collector);
        return collector;
    }

    /**
     * Cells referenced directly, in order of first appearance.
     */
    public Set<CellAddress> getReferences() {
        return Collections.unmodifiableSet(references);
    }

    public List<RangeRef> getRanges() {
        return Collections.unmodifiableList(ranges);
    }

    /**
     * Direct references plus every cell of every range, limited to a
     * rows x cols sheet. Cells outside the sheet can never hold a value.
     */
    public Set<CellAddress> allReadCells(int rows, int cols) {
        Set<CellAddress> cells = new LinkedHashSet<>();
        for (CellAddress ref : references) {
            if (AddressCodec.isWithinBounds(ref, rows, cols)) {
                cells.add(ref);
            }
        }
        for (RangeRef range : ranges) {
            int maxCol = Math.min(Math.max(range.getStart().getCol(), range.getEnd().getCol()), cols - 1);
            int maxRow = Math.min(Math.max(range.getStart().getRow(), range.getEnd().getRow()), rows - 1);
            int minCol = Math.min(range.getStart().getCol(), range.getEnd().getCol());
            int minRow = Math.min(range.getStart().getRow(), range.getEnd().getRow());
            if (minCol > maxCol || minRow > maxRow) {
                continue;
            }
            cells.addAll(AddressCodec.expandRange(new CellAddress(minCol, minRow), new CellAddress(maxCol, maxRow)));
        }
        return cells;
    }

    @Override
    public Void visitNumber(NumberLiteral node) {
        return null;
    }

    @Override
    public Void visitString(StringLiteral node) {
        return null;
    }

    @Override
    public Void visitBoolean(BooleanLiteral node) {
        return null;
    }

    @Override
    public Void visitCellRef(CellRef node) {
        references.add(node.getAddress());
        return null;
    }

    @Override
    public Void visitRange(RangeRef node) {
        ranges.add(node);
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        for (FormulaAst arg : node.getArgs()) {
            arg.accept(this);
        }
        return null;
    }

    @Override
    public Void visitBinary(BinaryOp node) {
        node.getLeft().accept(this);
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitNegation(UnaryNegation node) {
        node.getOperand().accept(this);
        return null;
    }
}
