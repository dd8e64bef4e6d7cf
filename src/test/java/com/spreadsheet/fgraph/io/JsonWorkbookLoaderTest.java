package com.spreadsheet.fgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import com.spreadsheet.fgraph.FormulaSession;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.TableDefinition;
import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.source.CellContent;
import com.spreadsheet.fgraph.source.InMemoryWorkbook;
import org.junit.Test;

import static org.junit.Assert.*;

public class JsonWorkbookLoaderTest {

    static InMemoryWorkbook loan() throws IOException {
        try (InputStream in = JsonWorkbookLoaderTest.class.getResourceAsStream("/workbooks/loan.json")) {
            assertNotNull("loan.json on the test classpath", in);
            return JsonWorkbookLoader.load(in);
        }
    }

    @Test
    public void testLoadsSheetsCellsNamesAndTables() throws IOException {
        InMemoryWorkbook wb = loan();
        assertEquals("loan", wb.name());
        assertEquals(List.of("Inputs", "Calc", "Data"), List.copyOf(wb.sheetNames()));

        assertEquals(10000.0, wb.cell(AddressCell.parse("Inputs!B1")).value());
        assertEquals("Principal", wb.cell(AddressCell.parse("Inputs!A1")).value());

        CellContent a1 = wb.cell(AddressCell.parse("Calc!A1"));
        assertTrue(a1.isFormula());
        assertEquals("=Inputs!B1*(1+Rate)^Inputs!B3", a1.formula());
        assertEquals(11576.25, a1.cachedValue());
        assertEquals("high", wb.cell(AddressCell.parse("Calc!A3")).cachedValue());

        assertNotNull(wb.definedName("Rate"));
        assertFalse(wb.definedName("rate").isFormula());

        TableDefinition sales = wb.table("Sales");
        assertEquals(List.of("Region", "Amount"), sales.columns());
        assertEquals(1, sales.headerRows());
        assertEquals(4, wb.maxRow("Data"));
    }

    @Test
    public void testLoadedWorkbookEvaluates() throws IOException {
        FormulaSession session = new FormulaSession(loan());
        assertEquals(11576.25, (Double) session.resolve("Calc!A1"), 1e-9);
        assertEquals("high", session.resolve("Calc!A3"));
        assertEquals(60.0, session.resolve("Calc!A4"));
        assertEquals(0.05, session.resolve("Rate"));
    }

    @Test
    public void testErrorCodesBecomeErrorValues() {
        InMemoryWorkbook wb = JsonWorkbookLoader.parse(
                "{\"workbook\":{\"sheets\":[{\"name\":\"S\",\"cells\":{\"A1\":\"#N/A\",\"A2\":\"=ISNA(A1)\",\"A3\":true}}]}}");
        assertEquals("workbook", wb.name());
        assertEquals(ExcelError.NA, wb.cell(AddressCell.parse("S!A1")).value());
        assertEquals(Boolean.TRUE, wb.cell(AddressCell.parse("S!A3")).value());
        assertEquals(Boolean.TRUE, new FormulaSession(wb).resolve("A2"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        JsonWorkbookLoader.parse("{\"workbook\":");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingWorkbookKey() {
        JsonWorkbookLoader.parse("{\"sheets\":[]}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCachedValueWithoutFormula() {
        JsonWorkbookLoader.parse(
                "{\"workbook\":{\"sheets\":[{\"name\":\"S\",\"cells\":{\"A1\":1},\"cached\":{\"A1\":2}}]}}");
    }
}
