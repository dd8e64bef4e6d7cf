package com.spreadsheet.fgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.spreadsheet.fgraph.FormulaSession;
import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.api.RangeValue;
import com.spreadsheet.fgraph.engine.EvaluationConfig;
import com.spreadsheet.fgraph.fn.FunctionRegistry;
import com.spreadsheet.fgraph.source.InMemoryWorkbook;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class JsonGraphSerializerTest {

    private FormulaSession session;

    @Before
    public void setUp() throws IOException {
        session = new FormulaSession(JsonWorkbookLoaderTest.loan());
        session.resolve("Calc!A3");
        session.resolve("Calc!A4");
    }

    private FormulaSession reload() {
        GraphSnapshot snap = JsonGraphSerializer.read(JsonGraphSerializer.write(session.snapshot()));
        return FormulaSession.fromSnapshot(snap, new FunctionRegistry(), EvaluationConfig.DEFAULT);
    }

    @Test
    public void testSnapshotDescribesEveryNode() {
        GraphSnapshot snap = session.snapshot();
        assertEquals("loan", snap.getName());
        assertEquals(GraphSnapshot.FORMAT_VERSION, snap.getVersion());
        assertEquals(List.of("Inputs", "Calc", "Data"), snap.getSheets());
        assertEquals(session.size(), snap.getNodes().size());
        assertEquals(1, snap.getTables().size());
        assertTrue(snap.getDefinedNames().containsKey("Rate"));

        GraphSnapshot.NodeEntry range = snap.getNodes().stream()
                .filter(e -> e.getKind() == NodeKind.RANGE).findFirst().orElseThrow();
        assertEquals("Data!B2:B4", range.getAddress());
        assertEquals(3, range.getRows());
        assertEquals(1, range.getColumns());
        assertEquals(SnapshotValue.Type.RANGE, range.getValue().getType());
    }

    @Test
    public void testJsonCarriesFormulasAndValues() {
        String json = JsonGraphSerializer.write(session.snapshot());
        assertTrue(json.contains("\"formula\" : \"=A1-Inputs!B1\""));
        assertTrue(json.contains("\"text\" : \"high\""));
        assertTrue(json.contains("\"version\" : \"1\""));
    }

    @Test
    public void testReloadedGraphKeepsValuesWithoutRecomputing() {
        FormulaSession restored = reload();
        assertEquals(session.size(), restored.size());
        assertFalse(restored.node("Calc!A1").isDirty());
        assertEquals(session.resolve("Calc!A1"), restored.node("Calc!A1").value());
        assertEquals("high", restored.resolve("Calc!A3"));
        assertEquals(session.precedents("Calc!A1"), restored.precedents("Calc!A1"));
        assertEquals(session.successors("Inputs!B1"), restored.successors("Inputs!B1"));
    }

    @Test
    public void testReloadedGraphRecomputesAfterInputChanges() {
        FormulaSession restored = reload();
        restored.setValue("Inputs!B1", 1000.0);
        assertEquals(157.625, (Double) restored.resolve("Calc!A2"), 1e-9);
        assertEquals("low", restored.resolve("Calc!A3"));

        restored.setValue("Data!B2:B4", RangeValue.column(1.0, 2.0, 3.0));
        assertEquals(6.0, restored.resolve("Calc!A4"));
    }

    @Test
    public void testOverlappingAreasSurviveReload() {
        InMemoryWorkbook wb = new InMemoryWorkbook("overlap").addSheet("S");
        wb.set("A1", 1.0).set("A2", 2.0).set("A3", 3.0).set("C1", "=SUM(r)");
        wb.defineName("r", "S!A1:A2,S!A2:A3");
        FormulaSession original = new FormulaSession(wb);
        assertEquals(8.0, original.resolve("S!C1"));

        GraphSnapshot snap = JsonGraphSerializer.read(JsonGraphSerializer.write(original.snapshot()));
        GraphSnapshot.NodeEntry range = snap.getNodes().stream()
                .filter(e -> e.getKind() == NodeKind.RANGE).findFirst().orElseThrow();
        assertEquals(List.of("S!A1", "S!A2", "S!A2", "S!A3"), range.getCells());
        assertEquals(3, range.getPrecedents().size());

        FormulaSession restored = FormulaSession.fromSnapshot(snap, new FunctionRegistry(), EvaluationConfig.DEFAULT);
        assertEquals(8.0, restored.resolve("S!C1"));
        restored.setValue("S!A2", 10.0);
        assertEquals(24.0, restored.resolve("S!C1"));
    }

    @Test
    public void testErrorValuesKeepTheirDetail() {
        Object a5 = session.resolve("Calc!A5");
        FormulaSession restored = reload();
        Object back = restored.node("Calc!A5").value();
        assertEquals(ExcelError.NAME, back);
        assertEquals(((ExcelError) a5).detail(), ((ExcelError) back).detail());
    }

    @Test
    public void testWriteAndReadFile() throws IOException {
        Path file = Files.createTempFile("graph", ".json");
        try {
            JsonGraphSerializer.write(session.snapshot(), file);
            GraphSnapshot snap = JsonGraphSerializer.read(file);
            assertEquals(session.size(), snap.getNodes().size());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReadRejectsMalformedJson() {
        JsonGraphSerializer.read("[1,2");
    }

    @Test
    public void testRoundTripValidation() {
        Map<Address, SerializationValidator.Mismatch> failures = SerializationValidator.validate(session,
                List.of("Calc!A1", "Calc!A2", "Calc!A3", "Calc!A4"));
        assertTrue(failures.toString(), failures.isEmpty());
    }
}
