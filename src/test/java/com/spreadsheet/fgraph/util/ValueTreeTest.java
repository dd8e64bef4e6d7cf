package com.spreadsheet.fgraph.util;

import java.util.ArrayList;
import java.util.List;

import com.spreadsheet.fgraph.FormulaSession;
import com.spreadsheet.fgraph.engine.EvaluationConfig;
import com.spreadsheet.fgraph.fn.FunctionRegistry;
import com.spreadsheet.fgraph.source.InMemoryWorkbook;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ValueTreeTest {

    private InMemoryWorkbook wb;

    @Before
    public void setUp() {
        wb = new InMemoryWorkbook("tree").addSheet("S");
    }

    @Test
    public void testListsPrecedentsDepthFirst() {
        wb.set("A1", 100.0).set("A2", "x").set("B1", "=A1*2").set("C1", "=B1+LEN(A2)");
        FormulaSession session = new FormulaSession(wb);

        assertEquals(List.of("S!C1 = 201", " S!B1 = 200", "  S!A1 = 100", " S!A2 = x"),
                session.valueTree("C1").lines());
    }

    @Test
    public void testRepeatedPrecedentsAreListedEachTime() {
        wb.set("A1", 1.0).set("B1", "=A1+1").set("C1", "=A1+B1");
        FormulaSession session = new FormulaSession(wb);

        assertEquals(List.of("S!C1 = 3", " S!A1 = 1", " S!B1 = 2", "  S!A1 = 1"), session.valueTree("C1").lines());
    }

    @Test
    public void testCycleMembersAreMarkedNotExpanded() {
        wb.set("A1", "=B1*0.5+10").set("B1", "=A1+5");
        FormulaSession session = new FormulaSession(wb, new FunctionRegistry(), EvaluationConfig.cycles(100, 1e-6));

        List<ValueTreeEntry> entries = new ArrayList<>();
        for (ValueTreeEntry e : session.valueTree("A1"))
            entries.add(e);

        assertEquals(3, entries.size());
        assertFalse(entries.get(0).cycle());
        assertFalse(entries.get(1).cycle());
        assertTrue(entries.get(2).cycle());
        assertEquals(2, entries.get(2).depth());
        assertEquals(entries.get(0).address(), entries.get(2).address());
        assertTrue(entries.get(2).line().endsWith("<- cycle"));
        assertEquals(25.0, (Double) entries.get(0).value(), 1e-4);
    }

    @Test
    public void testTreeCanBeWalkedAgain() {
        wb.set("A1", 1.0).set("B1", "=A1+1");
        FormulaSession session = new FormulaSession(wb);
        ValueTree tree = session.valueTree("B1");
        assertEquals(tree.lines(), tree.lines());
        assertEquals("S!B1 = 2\n S!A1 = 1", tree.toString());
    }
}
