package com.spreadsheet.fgraph.util;

import java.util.List;

import com.spreadsheet.fgraph.FormulaSession;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.source.InMemoryWorkbook;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExportTest {

    private FormulaSession session;
    private GraphExport export;

    @Before
    public void setUp() {
        InMemoryWorkbook wb = new InMemoryWorkbook("export").addSheet("S");
        wb.set("A1", 100.0).set("B1", "=A1*2").set("C1", "=B1+50");
        session = new FormulaSession(wb);
        session.resolve("C1");
        export = session.export();
    }

    private static AddressCell cell(String text) {
        return AddressCell.parse(text);
    }

    @Test
    public void testVerticesAndEdges() {
        List<GraphExport.Vertex> vertices = export.vertices();
        assertEquals(3, vertices.size());
        assertEquals(cell("S!C1"), vertices.get(0).address());
        assertEquals(NodeKind.FORMULA, vertices.get(0).kind());
        assertEquals(250.0, vertices.get(0).value());
        assertFalse(vertices.get(0).dirty());

        List<GraphExport.Edge> edges = export.edges();
        assertEquals(2, edges.size());
        assertTrue(edges.contains(new GraphExport.Edge(cell("S!A1"), cell("S!B1"))));
        assertTrue(edges.contains(new GraphExport.Edge(cell("S!B1"), cell("S!C1"))));
    }

    @Test
    public void testExplainNode() {
        String text = export.explainNode(cell("S!B1"));
        assertTrue(text.startsWith("Node: S!B1\n"));
        assertTrue(text.contains("  Kind: FORMULA\n"));
        assertTrue(text.contains("  Formula: =A1*2\n"));
        assertTrue(text.contains("  Value: 200\n"));
        assertTrue(text.contains("  Precedents (1): S!A1\n"));
        assertTrue(text.contains("  Dependents (1): S!C1\n"));

        session.setValue("A1", 1.0);
        assertTrue(export.explainNode(cell("S!B1")).contains("  Value: <dirty>\n"));
        assertEquals("Node: S!Z9 (not in graph)\n", export.explainNode(cell("S!Z9")));
    }

    @Test
    public void testDumpTopology() {
        String text = export.dumpTopology();
        assertTrue(text.startsWith("Graph (3 nodes, 2 edges):\n"));
        assertTrue(text.contains("  S!A1 [CONSTANT] -> S!B1\n"));
        assertTrue(text.contains("  S!C1 [FORMULA]\n"));
    }

    @Test
    public void testMermaid() {
        String text = export.toMermaid();
        assertTrue(text.startsWith("graph TD;\n"));
        assertTrue(text.contains("  S_A1(\"S!A1<br/>100\");\n"));
        assertTrue(text.contains("  S_B1[\"S!B1<br/>=A1*2 = 200\"];\n"));
        assertTrue(text.contains("  S_A1 --> S_B1;\n"));
        assertTrue(text.contains("  S_B1 --> S_C1;\n"));
    }

    @Test
    public void testMermaidIdsStayUniqueWhenAddressesSanitizeAlike() {
        InMemoryWorkbook wb = new InMemoryWorkbook("ids").addSheet("S_B").addSheet("S.B");
        wb.set(cell("S_B!A1"), 1.0).set(cell("S.B!A1"), "=S_B!A1+1");
        FormulaSession s = new FormulaSession(wb);
        assertEquals(2.0, s.resolve("S.B!A1"));

        String text = s.export().toMermaid();
        assertTrue(text, text.contains("  S_B_A1[\"S.B!A1<br/>=S_B!A1+1 = 2\"];\n"));
        assertTrue(text, text.contains("  S_B_A1_2(\"S_B!A1<br/>1\");\n"));
        assertTrue(text, text.contains("  S_B_A1_2 --> S_B_A1;\n"));
    }

    @Test
    public void testDot() {
        String text = export.toDot();
        assertTrue(text.startsWith("digraph formulas {\n"));
        assertTrue(text.contains("\"S!A1\" -> \"S!B1\";"));
        assertTrue(text.contains("shape=ellipse"));
        assertTrue(text.endsWith("}\n"));
    }
}
