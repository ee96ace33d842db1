package com.formulagrid.app.engine;

import com.formulagrid.app.formula.FormulaParser;
import com.formulagrid.app.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for formula evaluation: arithmetic, functions,
 * error classification and cycle handling.
 */
class FormulaEngineTest {

    private FormulaEngine engine;
    private Map<CellAddress, Cell> cells;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
        cells = new LinkedHashMap<>();
    }

    /**
     * Strings starting with '=' become formulas, everything else a literal.
     */
    private void set(String address, Object content) {
        Cell cell = content instanceof String && ((String) content).startsWith("=")
                ? FormulaParser.parseCell((String) content)
                : new LiteralCell(content);
        cells.put(CellAddress.parse(address), cell);
    }

    private Sheet sheet() {
        return new Sheet("test", "Test", 20, 10, cells, java.time.Instant.now());
    }

    private EvalResult evalAt(String address) {
        return engine.evaluateCell(sheet(), CellAddress.parse(address));
    }

    private EvalResult eval(String formula) {
        set("J20", formula);
        return evalAt("J20");
    }

    private Object value(String formula) {
        EvalResult result = eval(formula);
        assertFalse(result.isError(), () -> formula + " failed: " + result);
        return result.getValue();
    }

    private ErrorCode errorCode(String formula) {
        EvalResult result = eval(formula);
        assertTrue(result.isError(), () -> formula + " should fail but gave " + result);
        return result.getError().getCode();
    }

    @Test
    void testPrecedence() {
        assertEquals(7.0, value("=1+2*3"));
        assertEquals(9.0, value("=(1+2)*3"));
        assertEquals(32.0, value("=2^3*4"));
        assertEquals(4096.0, value("=2^(3*4)"));
        assertEquals(3.0, value("=10-4-3"));
        assertEquals(2.0, value("=8/2/2"));
        // Chained powers associate to the left like every other operator
        assertEquals(64.0, value("=2^3^2"));
        assertEquals(4.0, value("=-2^2"));
    }

    @Test
    void testFunctions() {
        assertEquals(6.0, value("=SUM(1,2,3)"));
        assertEquals(20.0, value("=AVG(10,20,30)"));
        assertEquals(20.0, value("=average(10,20,30)"));
        assertEquals(3.0, value("=MIN(5,3,7)"));
        assertEquals(7.0, value("=MAX(5,3,7)"));
        assertEquals(4.0, value("=COUNT(1,2,\"text\",3)"));
    }

    @Test
    void testAggregatesWithoutNumbers() {
        assertEquals(0.0, value("=SUM()"));
        assertEquals(0.0, value("=AVG(\"a\")"));
        assertEquals(0.0, value("=MIN(\"a\",\"b\")"));
        assertEquals(0.0, value("=MAX()"));
        assertEquals(0.0, value("=COUNT()"));
    }

    @Test
    void testConditionals() {
        assertEquals("yes", value("=IF(1>0,\"yes\",\"no\")"));
        assertEquals(10.0, value("=IF(5=5,10,20)"));
        assertEquals(2.0, value("=IF(3<>3,1,2)"));
        assertEquals("b", value("=IF(0,\"a\",\"b\")"));
        assertEquals("b", value("=IF(\"\",\"a\",\"b\")"));
        assertEquals("a", value("=IF(\"x\",\"a\",\"b\")"));
        // Empty cell is falsy
        assertEquals("b", value("=IF(A1,\"a\",\"b\")"));
    }

    @Test
    void testIfOnlyEvaluatesSelectedBranch() {
        assertEquals(1.0, value("=IF(TRUE,1,1/0)"));
        assertEquals(ErrorCode.DIV0, errorCode("=IF(FALSE,1,1/0)"));
    }

    @Test
    void testIfRequiresThreeArguments() {
        assertEquals(ErrorCode.EVAL, errorCode("=IF(1,2)"));
    }

    @Test
    void testComparisons() {
        assertEquals(true, value("=1<2"));
        assertEquals(true, value("=2<=2"));
        assertEquals(false, value("=1>2"));
        assertEquals(true, value("=3>=2"));
        assertEquals(true, value("=\"a\"=\"a\""));
        assertEquals(true, value("=\"a\"<>\"b\""));
        assertEquals(false, value("=\"1\"=1"));
        assertEquals(true, value("=1<2=TRUE"));
    }

    @Test
    void testStringConcatenation() {
        assertEquals("a1", value("=\"a\"+1"));
        assertEquals("2.5b", value("=2.5+\"b\""));
        assertEquals("xTRUE", value("=\"x\"+TRUE"));
    }

    @Test
    void testErrorClassification() {
        assertEquals(ErrorCode.DIV0, errorCode("=1/0"));
        assertEquals(ErrorCode.EVAL, errorCode("=UNKNOWN()"));
        assertEquals(ErrorCode.EVAL, errorCode("=\"a\"-1"));
        assertEquals(ErrorCode.EVAL, errorCode("=-\"a\""));
        assertEquals(ErrorCode.EVAL, errorCode("=\"a\"<\"b\""));
        assertEquals(ErrorCode.PARSE, errorCode("=(1+2"));
    }

    @Test
    void testUnknownFunctionMessage() {
        assertEquals("Unknown function: UNKNOWN", eval("=UNKNOWN(1)").getError().getMessage());
    }

    @Test
    void testLiteralEmptyAndErrorCells() {
        set("A1", 42);
        set("A2", "text");
        set("A3", "=)");

        assertEquals(EvalResult.of(42.0), evalAt("A1"));
        assertEquals(EvalResult.of("text"), evalAt("A2"));
        assertEquals(EvalResult.empty(), evalAt("B5"));
        assertEquals(ErrorCode.PARSE, evalAt("A3").getError().getCode());
    }

    @Test
    void testReferences() {
        set("A1", 3);
        set("A2", "=A1*2");
        assertEquals(9.0, value("=A2+A1"));
        assertEquals(-3.0, value("=-A1"));
        assertEquals(3.0, value("=$A$1"));
    }

    @Test
    void testReferenceToEmptyCellIsNull() {
        EvalResult result = eval("=B2");
        assertFalse(result.isError());
        assertNull(result.getValue());
        assertEquals(ErrorCode.EVAL, errorCode("=B2+1"));
    }

    @Test
    void testReferenceToErrorCellPropagatesItsCode() {
        set("A1", "=(");
        assertEquals(ErrorCode.PARSE, errorCode("=A1+1"));

        set("A2", "=1/0");
        assertEquals(ErrorCode.DIV0, errorCode("=A2*2"));
    }

    @Test
    void testReferenceOutsideSheetIsRef() {
        assertEquals(ErrorCode.REF, errorCode("=K1"));
        assertEquals(ErrorCode.REF, errorCode("=A21"));
        assertEquals(ErrorCode.REF, errorCode("=SUM(A1:A50)"));
    }

    @Test
    void testBareRangeIsNotACellValue() {
        assertEquals(ErrorCode.EVAL, errorCode("=A1:A3"));
        assertEquals(ErrorCode.EVAL, errorCode("=A1:A3+1"));
        assertEquals(ErrorCode.EVAL, errorCode("=IF(A1:A2,1,2)"));
    }

    @Test
    void testRangeAggregation() {
        set("A1", 1);
        set("A2", "x");
        set("A3", 2);
        set("A4", true);
        set("B1", "=A1*10");

        assertEquals(3.0, value("=SUM(A1:A4)"));
        assertEquals(1.5, value("=AVG(A1:A4)"));
        assertEquals(4.0, value("=COUNT(A1:A5)"));
        assertEquals(10.0, value("=MAX(A1:B3)"));
        assertEquals(1.0, value("=MIN(A1:B3, 5)"));
        assertEquals(13.0, value("=SUM(A1:B1, A3)"));
    }

    @Test
    void testTwoCellCycle() {
        set("A1", "=B1");
        set("B1", "=A1");
        set("C1", 5);
        set("D1", "=C1+1");

        Map<CellAddress, EvalResult> results = engine.evaluateSheet(sheet());

        assertEquals(ErrorCode.CYCLE, results.get(CellAddress.parse("A1")).getError().getCode());
        assertEquals(ErrorCode.CYCLE, results.get(CellAddress.parse("B1")).getError().getCode());
        // Siblings are unaffected
        assertEquals(EvalResult.of(6.0), results.get(CellAddress.parse("D1")));
    }

    @Test
    void testSelfReferenceAndRangeCycles() {
        set("A1", "=A1+1");
        set("B1", "=SUM(B2:B3)");
        set("B2", 1);
        set("B3", "=B1");

        assertEquals(ErrorCode.CYCLE, evalAt("A1").getError().getCode());
        assertEquals(ErrorCode.CYCLE, evalAt("B1").getError().getCode());
        assertEquals(ErrorCode.CYCLE, evalAt("B3").getError().getCode());
    }

    @Test
    void testDiamondIsNotACycle() {
        set("C1", 5);
        set("A1", "=C1*2");
        set("B1", "=C1+A1");
        set("D1", "=A1+B1+SUM(C1,C1)");

        assertEquals(10.0, evalAt("A1").getValue());
        assertEquals(15.0, evalAt("B1").getValue());
        assertEquals(35.0, evalAt("D1").getValue());
    }

    @Test
    void testSheetEvaluationFollowsDependencyOrder() {
        set("C1", "=B1+1");
        set("B1", "=A1+1");
        set("A1", "=1");
        set("D1", 7);

        Map<CellAddress, EvalResult> results = engine.evaluateSheet(sheet());

        List<CellAddress> order = new ArrayList<>(results.keySet());
        assertEquals(Arrays.asList(CellAddress.parse("A1"), CellAddress.parse("B1"), CellAddress.parse("C1")), order);
        assertEquals(EvalResult.of(3.0), results.get(CellAddress.parse("C1")));
        // Only formula cells are reported
        assertFalse(results.containsKey(CellAddress.parse("D1")));
    }

    @Test
    void testDependencyGraphIsBuiltFromFormulas() {
        set("A1", 1);
        set("B1", "=A1+SUM(A2:A3)");
        set("C1", "=B1");

        engine.evaluateSheet(sheet());
        DependencyGraph graph = engine.getDependencyGraph();

        assertEquals(3, graph.getDependencies(CellAddress.parse("B1")).size());
        assertTrue(graph.getDependents(CellAddress.parse("A3")).contains(CellAddress.parse("B1")));
        assertTrue(graph.getDependents(CellAddress.parse("B1")).contains(CellAddress.parse("C1")));

        // Replacing a formula with a literal drops its edges
        engine.registerCell(sheet(), CellAddress.parse("B1"), new LiteralCell(2));
        assertTrue(graph.getDependencies(CellAddress.parse("B1")).isEmpty());
        assertTrue(graph.getDependents(CellAddress.parse("A1")).isEmpty());
    }

    @Test
    void testEvaluationIsIdempotent() {
        set("A1", 2);
        set("A2", "=A1^2");
        set("A3", "=A2/0");
        set("A4", "=A5");
        set("A5", "=A4");
        set("A6", "=SUM(A1:A2)&");

        Sheet sheet = sheet();
        Map<CellAddress, EvalResult> first = engine.evaluateSheet(sheet);
        Map<CellAddress, EvalResult> second = engine.evaluateSheet(sheet);
        Map<CellAddress, EvalResult> fresh = new FormulaEngine().evaluateSheet(sheet);

        assertEquals(first, second);
        assertEquals(first, fresh);
    }

    @Test
    void testExplainTracesNestedFormulas() {
        set("A1", 1);
        set("B1", "=A1*2");
        set("C1", "=B1+SUM(A1:A2)");

        CellExplanation explanation = engine.explainCell(sheet(), CellAddress.parse("C1"));

        assertEquals("C1", explanation.getAddress());
        assertEquals(EvalResult.of(3.0), explanation.getResult());
        assertEquals(2, explanation.getTrace().size());

        TraceEntry inner = explanation.getTrace().get(0);
        assertEquals("B1", inner.getCell());
        assertEquals("=A1*2", inner.getFormula());
        assertEquals(List.of("A1"), inner.getDependencies());
        assertEquals(2.0, inner.getValue());

        TraceEntry outer = explanation.getTrace().get(1);
        assertEquals("C1", outer.getCell());
        assertEquals(List.of("B1"), outer.getDependencies());
        assertEquals(List.of("A1:A2"), outer.getRanges());
    }

    @Test
    void testDisplayValue() {
        assertEquals("#DIV0!", eval("=1/0").displayValue());
        assertEquals(5.0, eval("=5").displayValue());
    }

    /**
     * A running total down a single column: A1=1, A(n)=A(n-1)+1.
     */
    private static Sheet runningTotal(int rows) {
        Map<CellAddress, Cell> chain = new LinkedHashMap<>();
        chain.put(new CellAddress(0, 0), new LiteralCell(1));
        for (int row = 1; row < rows; row++) {
            chain.put(new CellAddress(0, row), FormulaParser.parseCell("=A" + row + "+1"));
        }
        return new Sheet("chain", "Chain", rows, 1, chain, java.time.Instant.now());
    }

    @Test
    void testLongChainEvaluatesInSheetPass() {
        Map<CellAddress, EvalResult> results = engine.evaluateSheet(runningTotal(5000));

        assertEquals(4999, results.size());
        assertEquals(EvalResult.of(2.0), results.get(CellAddress.parse("A2")));
        assertEquals(EvalResult.of(5000.0), results.get(CellAddress.parse("A5000")));
    }

    @Test
    void testTooDeepChainIsAnErrorResult() {
        Sheet sheet = runningTotal(5000);

        EvalResult result = engine.evaluateCell(sheet, CellAddress.parse("A5000"));
        assertTrue(result.isError());
        assertEquals(ErrorCode.EVAL, result.getError().getCode());
        assertEquals("Reference chain too deep", result.getError().getMessage());

        // Shorter chains still resolve on their own
        assertEquals(EvalResult.of(100.0), engine.evaluateCell(sheet, CellAddress.parse("A100")));
        assertTrue(engine.explainCell(sheet, CellAddress.parse("A5000")).getResult().isError());
    }

    @Test
    void testLongOperatorChain() {
        assertEquals(201.0, value("=1" + "+1".repeat(200)));
    }
}
