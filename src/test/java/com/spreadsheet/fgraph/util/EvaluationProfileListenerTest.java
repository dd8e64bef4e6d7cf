package com.spreadsheet.fgraph.util;

import com.spreadsheet.fgraph.FormulaSession;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.source.InMemoryWorkbook;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class EvaluationProfileListenerTest {

    private InMemoryWorkbook wb;
    private FormulaSession session;

    @Before
    public void setUp() {
        wb = new InMemoryWorkbook("profile").addSheet("S");
        wb.set("A1", 100.0).set("B1", "=A1*2").set("C1", "=B1+50").set("D1", "=NOPE(A1)");
        session = new FormulaSession(wb);
    }

    @Test
    public void testCountsEvaluationsAndErrors() {
        EvaluationProfileListener profile = session.enableProfiling();
        session.resolve("C1");
        session.resolve("D1");
        session.setValue("A1", 150.0);
        session.resolve("C1");

        assertEquals(3, profile.resolves());
        assertEquals(2, profile.evaluations(AddressCell.parse("S!B1")));
        assertEquals(0, profile.evaluations(AddressCell.parse("S!A1")));
        assertEquals(5, profile.totalEvaluations());

        EvaluationProfileListener.NodeStats d1 = profile.stats().stream()
                .filter(s -> s.address.equals(AddressCell.parse("S!D1"))).findFirst().orElseThrow();
        assertEquals(1, d1.errorCount);

        String dump = profile.dump();
        assertTrue(dump.contains("Node"));
        assertTrue(dump.contains("S!B1"));

        profile.reset();
        assertEquals(0, profile.totalEvaluations());
        assertEquals(0, profile.resolves());
    }

    @Test
    public void testCompositeFansOutAndRemoves() {
        EvaluationProfileListener first = new EvaluationProfileListener();
        EvaluationProfileListener second = new EvaluationProfileListener();
        session.addListener(first);
        session.addListener(second);
        session.resolve("C1");
        assertEquals(2, first.totalEvaluations());
        assertEquals(2, second.totalEvaluations());

        session.removeListener(first);
        session.setValue("A1", 1.0);
        session.resolve("C1");
        assertEquals(2, first.totalEvaluations());
        assertEquals(4, second.totalEvaluations());

        session.removeListener(second);
        session.setValue("A1", 2.0);
        session.resolve("C1");
        assertEquals(4, second.totalEvaluations());
    }

    @Test
    public void testCompositeSize() {
        CompositeEvaluationListener composite = new CompositeEvaluationListener();
        EvaluationProfileListener profile = new EvaluationProfileListener();
        composite.add(profile);
        assertEquals(1, composite.size());
        assertTrue(composite.remove(profile));
        assertFalse(composite.remove(profile));
        assertEquals(0, composite.size());
    }
}
