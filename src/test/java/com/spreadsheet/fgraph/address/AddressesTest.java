package com.spreadsheet.fgraph.address;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class AddressesTest {

    @Test
    public void testCellParsingIgnoresAbsoluteMarkers() {
        AddressCell a = AddressCell.parse("$B$3", "Sheet1");
        AddressCell b = AddressCell.parse("Sheet1!B3");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("Sheet1!B3", a.address());
        assertEquals(2, a.column());
        assertEquals(3, a.row());
    }

    @Test
    public void testQuotedSheetNames() {
        AddressCell c = AddressCell.parse("'My Sheet'!A1");
        assertEquals("My Sheet", c.sheet());
        assertEquals("'My Sheet'!A1", c.address());
        assertEquals("'It''s'!C2", AddressCell.parse("'It''s'!C2").address());
        assertEquals("Data_2.x!A1", AddressCell.parse("Data_2.x!A1").address());
    }

    @Test
    public void testRangeIsNormalized() {
        AddressRange r = AddressRange.parse("B3:A1", "S");
        assertEquals("S!A1:B3", r.address());
        assertEquals(AddressRange.parse("S!A1:B3", null), r);
        assertEquals(6, r.cells(100, 100).size());
    }

    @Test
    public void testSingleCellRangeCollapsesToCell() {
        Address a = Addresses.parse("A1:A1", "S");
        assertTrue(a instanceof AddressCell);
        assertEquals(AddressCell.of("S", 1, 1), a);
    }

    @Test
    public void testCellsAreRowMajor() {
        List<AddressCell> cells = AddressRange.parse("S!A1:B2", null).cells(10, 10);
        assertEquals(List.of(AddressCell.parse("S!A1"), AddressCell.parse("S!B1"), AddressCell.parse("S!A2"),
                AddressCell.parse("S!B2")), cells);
    }

    @Test
    public void testWholeColumnIsClipped() {
        AddressRange col = AddressRange.parse("S!A:B", null);
        assertEquals("S!A:B", col.address());
        assertEquals(6, col.cells(3, 50).size());
        assertArrayEquals(new int[] { 3, 2 }, col.shape(3, 50));

        AddressRange rows = AddressRange.parse("S!2:3", null);
        assertEquals(8, rows.cells(100, 4).size());
    }

    @Test
    public void testMultiArea() {
        AddressRange r = AddressRange.parse("S!A1:B2,D4", null);
        assertTrue(r.isMultiArea());
        assertEquals("S!A1:B2,D4", r.address());
        assertEquals(5, r.cells(10, 10).size());
        assertArrayEquals(new int[] { 5, 1 }, r.shape(10, 10));
        assertTrue(r.contains(AddressCell.parse("S!D4")));
        assertFalse(r.contains(AddressCell.parse("S!C3")));
    }

    @Test
    public void testMalformedAddresses() {
        for (String bad : new String[] { "A0", "XFE1", "A1048577", "'Open!A1", "S!A1:T!B2", "", "1A" }) {
            try {
                Addresses.parse(bad, "S");
                fail("Expected AddressException for " + bad);
            } catch (AddressException expected) {
                // expected
            }
        }
        assertNull(Addresses.tryParse("ABCD1", "S"));
    }

    @Test(expected = AddressException.class)
    public void testMissingSheet() {
        Addresses.parse("A1", null);
    }

    @Test
    public void testColumnLetters() {
        assertEquals(1, AddressCell.columnIndex("A"));
        assertEquals(28, AddressCell.columnIndex("AB"));
        assertEquals(16384, AddressCell.columnIndex("XFD"));
        assertEquals("XFD", AddressCell.columnLetters(16384));
        assertEquals("Z", AddressCell.columnLetters(26));
    }

    @Test
    public void testTableSpecifiers() {
        TableDefinition t = new TableDefinition("Sales", AddressRange.parse("Data!A1:C4", null), 1,
                List.of("Region", "Qty", "Amount"));
        assertEquals("Data!A2:C4", t.resolve("").address());
        assertEquals("Data!A2:C4", t.resolve("#Data").address());
        assertEquals("Data!A1:C4", t.resolve("#All").address());
        assertEquals("Data!A1:C1", t.resolve("#Headers").address());
        assertEquals("Data!C2:C4", t.resolve("amount").address());
    }

    @Test(expected = AddressException.class)
    public void testUnknownTableColumn() {
        new TableDefinition("Sales", AddressRange.parse("Data!A1:B3", null), 1, List.of("a", "b")).resolve("c");
    }
}
