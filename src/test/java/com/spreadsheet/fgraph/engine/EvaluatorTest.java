package com.spreadsheet.fgraph.engine;

import java.util.List;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.Addresses;
import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.api.RangeValue;
import com.spreadsheet.fgraph.fn.Args;
import com.spreadsheet.fgraph.fn.FunctionRegistry;
import com.spreadsheet.fgraph.source.InMemoryWorkbook;
import com.spreadsheet.fgraph.util.EvaluationProfileListener;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class EvaluatorTest {

    private InMemoryWorkbook wb;
    private NodeStore store;
    private FunctionRegistry functions;
    private Evaluator evaluator;
    private int counted;

    @Before
    public void setUp() {
        wb = new InMemoryWorkbook("eval").addSheet("S");
        store = new NodeStore();
        functions = new FunctionRegistry().register("COUNTED", args -> {
            counted++;
            return Args.number(args, 0);
        });
        evaluator = new Evaluator(store, new NodeFactory(store, wb), functions, EvaluationConfig.DEFAULT);
    }

    private static Address a(String text) {
        return Addresses.parse(text, "S");
    }

    private Object resolve(String text) {
        return evaluator.resolve(a(text));
    }

    @Test
    public void testChainRecomputesAfterInputChange() {
        wb.set("A1", 100.0).set("B1", "=A1*2").set("C1", "=B1+50");
        assertEquals(250.0, resolve("C1"));

        evaluator.setValue(a("A1"), 150.0);
        assertTrue(store.get(a("B1")).isDirty());
        assertTrue(store.get(a("C1")).isDirty());
        assertEquals(350.0, resolve("C1"));
        assertEquals(300.0, resolve("B1"));
    }

    @Test
    public void testUnrelatedCellIsUntouchedByAnAssignment() {
        wb.set("A1", 100.0).set("B1", "=A1*2").set("E1", 4.0).set("D1", "=COUNTED(E1)");
        assertEquals(200.0, resolve("B1"));
        assertEquals(4.0, resolve("D1"));
        assertEquals(1, counted);

        evaluator.setValue(a("A1"), 150.0);
        assertFalse(store.get(a("D1")).isDirty());
        assertFalse(store.get(a("E1")).isDirty());
        assertEquals(4.0, resolve("D1"));
        assertEquals(1, counted);
        assertEquals(300.0, resolve("B1"));
    }

    @Test
    public void testWholeColumnPicksUpCellsAssignedLater() {
        wb.set("A1", 1.0).set("A2", 2.0).set("C1", "=SUM(A:A)");
        assertEquals(3.0, resolve("C1"));

        evaluator.setValue(a("A3"), 10.0);
        assertTrue(store.precedents(a("A:A")).contains(a("A3")));
        assertTrue(store.successors(a("A3")).contains(a("A:A")));
        assertEquals(13.0, resolve("C1"));

        evaluator.setValue(a("A5"), 5.0);
        assertEquals(18.0, resolve("C1"));
        assertEquals(5, store.precedents(a("A:A")).size());
    }

    @Test
    public void testWholeRowPicksUpCellsAssignedLater() {
        wb.set("A1", 1.0).set("B1", 2.0).set("A2", "=SUM(1:1)");
        assertEquals(3.0, resolve("A2"));

        evaluator.setValue(a("D1"), 4.0);
        assertEquals(7.0, resolve("A2"));
    }

    @Test
    public void testCleanNodesAreNotRecomputed() {
        wb.set("A1", 2.0).set("B1", "=COUNTED(A1)").set("C1", "=B1*10");
        assertEquals(20.0, resolve("C1"));
        assertEquals(20.0, resolve("C1"));
        assertEquals(2.0, resolve("B1"));
        assertEquals(1, counted);

        evaluator.setValue(a("A1"), 2.0);
        assertEquals(20.0, resolve("C1"));
        assertEquals(1, counted);

        evaluator.setValue(a("A1"), 3.0);
        assertEquals(30.0, resolve("C1"));
        assertEquals(2, counted);
    }

    @Test
    public void testUnknownFunctionIsNameErrorAndSiblingsStillEvaluate() {
        wb.set("A1", 100.0).set("B1", "=FOO(A1)").set("C1", "=A1+1").set("D1", "=B1+1");
        Object b1 = resolve("B1");
        assertEquals(ExcelError.NAME, b1);
        assertEquals("FOO", ((ExcelError) b1).detail());
        assertEquals(101.0, resolve("C1"));
        assertEquals(ExcelError.NAME, resolve("D1"));
    }

    @Test
    public void testBlankCellReadsAsZero() {
        wb.set("B2", "=A9+1");
        assertEquals(1.0, resolve("B2"));
        assertEquals(NodeKind.CONSTANT, store.get(a("A9")).kind());
        assertNull(store.get(a("A9")).value());
    }

    @Test
    public void testCrossSheetReference() {
        wb.addSheet("Other").set(AddressCell.parse("Other!C3"), 4.0);
        wb.set("A1", "=Other!C3*Other!C3");
        assertEquals(16.0, resolve("A1"));
    }

    @Test
    public void testDeepChainDoesNotOverflowTheStack() {
        int depth = 20_000;
        wb.set("A1", 1.0);
        for (int row = 2; row <= depth; row++)
            wb.set("A" + row, "=A" + (row - 1) + "+1");
        assertEquals((double) depth, resolve("A" + depth));

        evaluator.setValue(a("A1"), 2.0);
        assertEquals((double) depth + 1, resolve("A" + depth));
    }

    @Test
    public void testCircularReferenceThrowsWithMembers() {
        wb.set("A1", "=B1+1").set("B1", "=A1+1");
        try {
            resolve("A1");
            fail("Expected CircularReferenceException");
        } catch (CircularReferenceException e) {
            assertEquals(List.of(a("A1"), a("B1")), e.members());
            assertTrue(e.getMessage().startsWith("Circular reference: S!A1 -> S!B1"));
        }
    }

    @Test
    public void testSelfReferenceIsACycle() {
        wb.set("A1", "=A1+1");
        try {
            resolve("A1");
            fail("Expected CircularReferenceException");
        } catch (CircularReferenceException e) {
            assertEquals(List.of(a("A1")), e.members());
        }
    }

    @Test
    public void testIterativeCycleConverges() {
        wb.set("A1", "=B1*0.5+10").set("B1", "=A1+5");
        assertEquals(25.0, (Double) evaluator.resolve(a("A1"), 100, 1e-6), 1e-4);
        assertEquals(30.0, (Double) resolve("B1"), 1e-4);
    }

    @Test
    public void testCycleConfiguredOnTheSession() {
        evaluator.setConfig(EvaluationConfig.cycles(100, 1e-6));
        wb.set("A1", "=B1*0.5+10").set("B1", "=A1+5").set("C1", "=A1+B1");
        Resolution r = evaluator.resolveDetailed(a("C1"));
        assertTrue(r.converged());
        assertEquals(55.0, (Double) r.value(), 1e-4);
    }

    @Test
    public void testNonConvergingCycleWarns() {
        wb.set("A1", "=B1+1").set("B1", "=A1");
        Resolution r = evaluator.resolveDetailed(a("A1"), EvaluationConfig.cycles(10, 1e-6));
        assertFalse(r.converged());
        assertEquals(1, r.warnings().size());
        ConvergenceWarning w = r.warnings().get(0);
        assertEquals(a("A1"), w.head());
        assertEquals(10, w.iterations());
        assertEquals(1.0, w.lastDelta(), 1e-12);
        assertTrue(w.members().contains(a("A1")));
        assertTrue(w.members().contains(a("B1")));
        assertTrue(r.value() instanceof Double);
    }

    @Test
    public void testRangeInputsBroadcastAndShape() {
        wb.set("A1", 10.0).set("A2", 20.0).set("A3", 30.0).set("B1", "=SUM(A1:A3)*2");
        assertEquals(120.0, resolve("B1"));

        evaluator.setValue(a("A1:A3"), RangeValue.column(1.0, 2.0, 3.0));
        assertEquals(12.0, resolve("B1"));

        evaluator.setValue(a("A1:A3"), 5.0);
        assertEquals(30.0, resolve("B1"));
        assertEquals(5.0, resolve("A2"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRangeValueShapeMismatch() {
        wb.set("A1", 10.0).set("A2", 20.0).set("A3", 30.0);
        evaluator.setValue(a("A1:A3"), RangeValue.column(1.0, 2.0));
    }

    @Test
    public void testSettingAFormulaCellMakesItAConstant() {
        wb.set("A1", 100.0).set("B1", "=A1*2").set("C1", "=B1+50");
        assertEquals(250.0, resolve("C1"));

        evaluator.setValue(a("B1"), 7.0);
        assertEquals(NodeKind.CONSTANT, store.get(a("B1")).kind());
        assertTrue(store.precedents(a("B1")).isEmpty());
        assertFalse(store.successors(a("A1")).contains(a("B1")));
        assertEquals(57.0, resolve("C1"));
    }

    @Test
    public void testInvalidateMarksNodeAndDependents() {
        wb.set("A1", 2.0).set("B1", "=COUNTED(A1)").set("C1", "=B1+1");
        assertEquals(3.0, resolve("C1"));
        assertEquals(2, evaluator.invalidate(a("B1")));
        assertTrue(store.get(a("B1")).isDirty());
        assertTrue(store.get(a("C1")).isDirty());
        assertEquals(3.0, resolve("C1"));
        assertEquals(2, counted);
    }

    @Test
    public void testRecalculateReevaluatesEveryFormula() {
        wb.set("A1", 2.0).set("B1", "=COUNTED(A1)").set("C1", "=B1+1");
        resolve("C1");
        assertTrue(evaluator.recalculate().isEmpty());
        assertEquals(2, counted);
        assertFalse(store.get(a("C1")).isDirty());
    }

    @Test
    public void testListenerSeesEvaluations() {
        EvaluationProfileListener profile = new EvaluationProfileListener();
        evaluator.setListener(profile);
        wb.set("A1", 100.0).set("B1", "=A1*2").set("C1", "=B1+50");
        resolve("C1");
        resolve("C1");
        assertEquals(2, profile.resolves());
        assertEquals(1, profile.evaluations(a("B1")));
        assertEquals(1, profile.evaluations(a("C1")));
        assertEquals(2, profile.totalEvaluations());
    }

    @Test
    public void testListenerSeesCycleIterations() {
        EvaluationProfileListener profile = new EvaluationProfileListener();
        evaluator.setListener(profile);
        wb.set("A1", "=B1+1").set("B1", "=A1");
        evaluator.resolveDetailed(a("A1"), EvaluationConfig.cycles(5, 1e-6));
        assertEquals(4, profile.cycleIterations());
        assertEquals(1, profile.convergenceFailures());
    }
}
