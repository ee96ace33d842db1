package com.formulagrid.app.engine;

import com.formulagrid.app.exceptions.CircularReferenceException;
import com.formulagrid.app.exceptions.DivisionByZeroException;
import com.formulagrid.app.exceptions.FormulaException;
import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.exceptions.InvalidTypeException;
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
import com.formulagrid.app.models.Cell;
import com.formulagrid.app.models.CellAddress;
import com.formulagrid.app.models.CellExplanation;
import com.formulagrid.app.models.ErrorCell;
import com.formulagrid.app.models.ErrorCode;
import com.formulagrid.app.models.EvalResult;
import com.formulagrid.app.models.FormulaCell;
import com.formulagrid.app.models.LiteralCell;
import com.formulagrid.app.models.Scalars;
import com.formulagrid.app.models.Sheet;
import com.formulagrid.app.models.TraceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Evaluates the formulas of a sheet.
 * <p>
 * Each engine owns a {@link DependencyGraph} and is meant for one evaluation
 * session; two sheets evaluated concurrently need two engines.
 * Every failure inside a formula is caught at the cell boundary and turned
 * into an error {@link EvalResult}, so one broken cell never stops the rest.
 * <p>
 * During evaluation a range is represented as a {@code List<Object>} of its
 * values. It is only accepted as a function argument.
 */
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    private final DependencyGraph graph = new DependencyGraph();

    public DependencyGraph getDependencyGraph() {
        return graph;
    }

    /**
     * Replaces the edges sourced from {@code address} with those of its new content.
     * Cleared (null) and non-formula cells end up with no outgoing edges.
     */
    public void registerCell(Sheet sheet, CellAddress address, Cell cell) {
        graph.removeDependencies(address);
        if (!(cell instanceof FormulaCell)) {
            return;
        }
        ReferenceCollector refs = ReferenceCollector.collect(((FormulaCell) cell).getAst());
        for (CellAddress target : refs.allReadCells(sheet.getRows(), sheet.getCols())) {
            if (log.isDebugEnabled() && graph.hasCycle(address, target)) {
                log.debug("Reference {} -> {} closes a cycle in sheet {}", address, target, sheet.getId());
            }
            graph.addDependency(address, target);
        }
    }

    /**
     * Rebuilds the whole graph from the formula cells of the sheet.
     */
    public void rebuildDependencies(Sheet sheet) {
        graph.clear();
        for (Map.Entry<CellAddress, Cell> entry : sheet.getCells().entrySet()) {
            registerCell(sheet, entry.getKey(), entry.getValue());
        }
    }

    /**
     * Evaluates every formula cell, dependencies first. A reference to a
     * formula cell that was already evaluated reuses its result, so long
     * chains of formulas cost one step per cell.
     *
     * @return formula cell address -> result, in evaluation order
     */
    public Map<CellAddress, EvalResult> evaluateSheet(Sheet sheet) {
        rebuildDependencies(sheet);

        Set<CellAddress> formulaCells = new LinkedHashSet<>();
        for (Map.Entry<CellAddress, Cell> entry : sheet.getCells().entrySet()) {
            if (entry.getValue() instanceof FormulaCell) {
                formulaCells.add(entry.getKey());
            }
        }

        Map<CellAddress, EvalResult> results = new LinkedHashMap<>();
        for (CellAddress address : graph.getEvaluationOrder(formulaCells)) {
            if (formulaCells.contains(address)) {
                results.put(address, evaluate(new EvalContext(sheet, address, false, results)));
            }
        }
        log.debug("Evaluated {} formula cells in sheet {}", results.size(), sheet.getId());
        return results;
    }

    public EvalResult evaluateCell(Sheet sheet, CellAddress address) {
        return evaluate(new EvalContext(sheet, address, false));
    }

    /**
     * Evaluates one cell and reports every formula cell that took part.
     */
    public CellExplanation explainCell(Sheet sheet, CellAddress address) {
        EvalContext ctx = new EvalContext(sheet, address, true);
        EvalResult result = evaluate(ctx);
        return new CellExplanation(address.toString(), result, Collections.unmodifiableList(ctx.getTrace()));
    }

    private EvalResult evaluate(EvalContext ctx) {
        Cell cell = ctx.getSheet().getCell(ctx.getCurrentCell());
        if (cell == null) {
            return EvalResult.empty();
        }
        return cell.accept(new Cell.Visitor<EvalResult>() {
            @Override
            public EvalResult visitLiteral(LiteralCell literal) {
                return EvalResult.of(literal.getValue());
            }

            @Override
            public EvalResult visitFormula(FormulaCell formula) {
                try {
                    Object value = evaluateFormula(formula, ctx.getCurrentCell(), ctx);
                    if (value instanceof List) {
                        throw new InvalidTypeException("A range cannot be a cell value");
                    }
                    return EvalResult.of(value);
                } catch (FormulaException e) {
                    log.debug("Cell {} failed with {}: {}", ctx.getCurrentCell(), e.getCode(), e.getMessage());
                    return EvalResult.error(e.getCode(), e.getMessage());
                } catch (RuntimeException e) {
                    log.warn("Unexpected failure evaluating cell {}", ctx.getCurrentCell(), e);
                    return EvalResult.error(ErrorCode.EVAL,
                            e.getMessage() != null ? e.getMessage() : "Evaluation error");
                }
            }

            @Override
            public EvalResult visitError(ErrorCell error) {
                return EvalResult.error(error.getCode(), error.getMessage());
            }
        });
    }

    private Object evaluateFormula(FormulaCell formula, CellAddress address, EvalContext ctx) {
        Object value = formula.getAst().accept(new AstEvaluator(ctx));
        if (ctx.isTracing()) {
            ReferenceCollector refs = ReferenceCollector.collect(formula.getAst());
            List<String> dependencies = new ArrayList<>();
            for (CellAddress ref : refs.getReferences()) {
                dependencies.add(ref.toString());
            }
            List<String> ranges = new ArrayList<>();
            for (RangeRef range : refs.getRanges()) {
                ranges.add(range.toString());
            }
            ctx.record(new TraceEntry(address.toString(), formula.getSource(), dependencies, ranges,
                    value instanceof List ? null : value));
        }
        return value;
    }

    /**
     * Resolves a reference to another cell, guarding against cycles.
     * The address stays on the visited path only while its content is being
     * evaluated, so a cell reachable along two paths is not mistaken for a cycle.
     */
    private Object evaluateCellRef(CellAddress address, EvalContext ctx) {
        Sheet sheet = ctx.getSheet();
        if (!AddressCodec.isWithinBounds(address, sheet.getRows(), sheet.getCols())) {
            throw new InvalidAddressException("Reference outside sheet: " + address);
        }
        if (ctx.getVisited().contains(address)) {
            throw new CircularReferenceException("Circular reference detected at " + address);
        }

        EvalResult computed = ctx.getComputed(address);
        if (computed != null) {
            if (computed.isError()) {
                throw new FormulaException(computed.getError().getCode(), computed.getError().getMessage());
            }
            return computed.getValue();
        }

        ctx.descend();
        ctx.getVisited().add(address);
        try {
            Cell cell = sheet.getCell(address);
            if (cell == null) {
                return null;
            }
            return cell.accept(new Cell.Visitor<Object>() {
                @Override
                public Object visitLiteral(LiteralCell literal) {
                    return literal.getValue();
                }

                @Override
                public Object visitFormula(FormulaCell formula) {
                    Object value = evaluateFormula(formula, address, ctx);
                    if (value instanceof List) {
                        throw new InvalidTypeException("Reference to " + address + " evaluates to a range");
                    }
                    return value;
                }

                @Override
                public Object visitError(ErrorCell error) {
                    throw new FormulaException(error.getCode(), error.getMessage());
                }
            });
        } finally {
            ctx.getVisited().remove(address);
            ctx.ascend();
        }
    }

    private static Object ensureScalar(Object value, String context) {
        if (value instanceof List) {
            throw new InvalidTypeException(context + ": ranges are not allowed here");
        }
        return value;
    }

    /**
     * Scalars and range members flattened into one list.
     */
    private static List<Object> flatten(List<Object> values) {
        List<Object> flat = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof List) {
                flat.addAll((List<?>) value);
            } else {
                flat.add(value);
            }
        }
        return flat;
    }

    private static List<Double> numbersIn(List<Object> values) {
        List<Double> numbers = new ArrayList<>();
        for (Object value : flatten(values)) {
            if (Scalars.isNumber(value)) {
                numbers.add((Double) value);
            }
        }
        return numbers;
    }

    private class AstEvaluator implements AstVisitor<Object> {

        private final EvalContext ctx;

        AstEvaluator(EvalContext ctx) {
            this.ctx = ctx;
        }

        private Object evaluateChild(FormulaAst node) {
            ctx.descend();
            try {
                return node.accept(this);
            } finally {
                ctx.ascend();
            }
        }

        @Override
        public Object visitNumber(NumberLiteral node) {
            return node.getValue();
        }

        @Override
        public Object visitString(StringLiteral node) {
            return node.getValue();
        }

        @Override
        public Object visitBoolean(BooleanLiteral node) {
            return node.getValue();
        }

        @Override
        public Object visitCellRef(CellRef node) {
            return evaluateCellRef(node.getAddress(), ctx);
        }

        @Override
        public Object visitRange(RangeRef node) {
            Sheet sheet = ctx.getSheet();
            if (!AddressCodec.isWithinBounds(node.getStart(), sheet.getRows(), sheet.getCols())
                    || !AddressCodec.isWithinBounds(node.getEnd(), sheet.getRows(), sheet.getCols())) {
                throw new InvalidAddressException("Range outside sheet: " + node);
            }
            List<Object> values = new ArrayList<>();
            for (CellAddress address : AddressCodec.expandRange(node.getStart(), node.getEnd())) {
                values.add(evaluateCellRef(address, ctx));
            }
            return values;
        }

        @Override
        public Object visitFunctionCall(FunctionCall node) {
            String name = node.getName().toUpperCase();
            List<FormulaAst> args = node.getArgs();

            if ("IF".equals(name)) {
                if (args.size() != 3) {
                    throw new InvalidTypeException("IF requires exactly 3 arguments");
                }
                Object condition = ensureScalar(evaluateChild(args.get(0)), "IF condition");
                FormulaAst branch = Scalars.isTruthy(condition) ? args.get(1) : args.get(2);
                return ensureScalar(evaluateChild(branch), "IF branch result");
            }

            switch (name) {
                case "SUM":
                case "AVG":
                case "AVERAGE":
                case "MIN":
                case "MAX":
                case "COUNT":
                    break;
                default:
                    throw new InvalidTypeException("Unknown function: " + node.getName());
            }

            List<Object> values = new ArrayList<>();
            for (FormulaAst arg : args) {
                values.add(evaluateChild(arg));
            }

            switch (name) {
                case "SUM": {
                    double sum = 0;
                    for (double n : numbersIn(values)) {
                        sum += n;
                    }
                    return sum;
                }
                case "AVG":
                case "AVERAGE": {
                    List<Double> numbers = numbersIn(values);
                    double sum = 0;
                    for (double n : numbers) {
                        sum += n;
                    }
                    return numbers.isEmpty() ? 0.0 : sum / numbers.size();
                }
                case "MIN": {
                    // No numbers at all yields 0 rather than an error
                    List<Double> numbers = numbersIn(values);
                    return numbers.isEmpty() ? 0.0 : Collections.min(numbers);
                }
                case "MAX": {
                    List<Double> numbers = numbersIn(values);
                    return numbers.isEmpty() ? 0.0 : Collections.max(numbers);
                }
                default: {
                    double count = 0;
                    for (Object value : flatten(values)) {
                        if (value != null) {
                            count++;
                        }
                    }
                    return count;
                }
            }
        }

        @Override
        public Object visitBinary(BinaryOp node) {
            Object left = ensureScalar(evaluateChild(node.getLeft()), "Operator " + node.getOp().getSymbol());
            Object right = ensureScalar(evaluateChild(node.getRight()), "Operator " + node.getOp().getSymbol());

            if (Scalars.isNumber(left) && Scalars.isNumber(right)) {
                return applyNumeric(node, (Double) left, (Double) right);
            }

            switch (node.getOp()) {
                case ADD:
                    if (left instanceof String || right instanceof String) {
                        return Scalars.toText(left) + Scalars.toText(right);
                    }
                    break;
                case EQ:
                    return Objects.equals(left, right);
                case NE:
                    return !Objects.equals(left, right);
                default:
                    break;
            }
            throw new InvalidTypeException("Invalid operation: " + Scalars.toText(left) + " "
                    + node.getOp().getSymbol() + " " + Scalars.toText(right));
        }

        private Object applyNumeric(BinaryOp node, double left, double right) {
            switch (node.getOp()) {
                case ADD:
                    return left + right;
                case SUBTRACT:
                    return left - right;
                case MULTIPLY:
                    return left * right;
                case DIVIDE:
                    if (right == 0.0) {
                        throw new DivisionByZeroException("Division by zero");
                    }
                    return left / right;
                case POWER:
                    return Math.pow(left, right);
                case LT:
                    return left < right;
                case LE:
                    return left <= right;
                case GT:
                    return left > right;
                case GE:
                    return left >= right;
                case EQ:
                    return left == right;
                case NE:
                    return left != right;
                default:
                    throw new InvalidTypeException("Unsupported operator: " + node.getOp().getSymbol());
            }
        }

        @Override
        public Object visitNegation(UnaryNegation node) {
            Object value = evaluateChild(node.getOperand());
            if (Scalars.isNumber(value)) {
                return -((Double) value);
            }
            throw new InvalidTypeException("Cannot negate non-number");
        }
    }
}
