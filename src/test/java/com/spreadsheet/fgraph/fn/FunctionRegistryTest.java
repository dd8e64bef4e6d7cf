package com.spreadsheet.fgraph.fn;

import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.RangeValue;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class FunctionRegistryTest {

    private FunctionRegistry registry;

    @Before
    public void setUp() {
        registry = new FunctionRegistry();
    }

    private Object call(String name, Object... args) {
        return registry.invoke(name, args);
    }

    @Test
    public void testNamesAreCaseInsensitiveAndIgnoreXlfnPrefix() {
        assertTrue(registry.contains("sum"));
        assertTrue(registry.contains("_xlfn.CONCAT"));
        assertEquals(3.0, call("Sum", 1.0, 2.0));
        assertEquals("ab", call("_xlfn.concat", "a", "b"));
    }

    @Test(expected = FunctionNotImplementedException.class)
    public void testUnknownFunction() {
        call("FORECAST", 1.0);
    }

    @Test
    public void testEmptyRegistry() {
        FunctionRegistry empty = FunctionRegistry.empty();
        assertTrue(empty.names().isEmpty());
        empty.register("twice", args -> Args.number(args, 0) * 2);
        assertEquals(8.0, empty.invoke("TWICE", new Object[] { 4.0 }));
    }

    @Test
    public void testAggregatesSkipTextAndBlanksInRanges() {
        RangeValue r = RangeValue.column(1.0, "x", null, 3.0, true);
        assertEquals(4.0, call("SUM", r));
        assertEquals(2.0, call("AVERAGE", r));
        assertEquals(2.0, call("COUNT", r));
        assertEquals(4.0, call("COUNTA", r));
        assertEquals(3.0, call("MAX", r));
        assertEquals(1.0, call("MIN", r));
        assertEquals(ExcelError.DIV0, call("AVERAGE", RangeValue.column("a", "b")));
    }

    @Test
    public void testErrorsPropagateThroughAggregates() {
        assertEquals(ExcelError.NA, call("SUM", RangeValue.column(1.0, ExcelError.NA)));
        assertEquals(ExcelError.VALUE, call("SUM", "abc"));
    }

    @Test
    public void testMath() {
        assertEquals(2.35, call("ROUND", 2.345, 2.0));
        assertEquals(-2.0, call("ROUND", -1.5, 0.0));
        assertEquals(2.0, call("ROUNDDOWN", 2.9, 0.0));
        assertEquals(3.0, call("ROUNDUP", 2.1, 0.0));
        assertEquals(1.0, call("MOD", -5.0, 3.0));
        assertEquals(ExcelError.DIV0, call("MOD", 1.0, 0.0));
        assertEquals(ExcelError.NUM, call("SQRT", -1.0));
        assertEquals(-4.0, call("INT", -3.5));
        assertEquals(32.0, call("SUMPRODUCT", RangeValue.column(1.0, 2.0, 3.0), RangeValue.column(4.0, 5.0, 6.0)));
    }

    @Test
    public void testLogical() {
        assertEquals("yes", call("IF", true, "yes", "no"));
        assertEquals(0.0, call("IF", false, "yes", null));
        assertEquals(Boolean.FALSE, call("IF", 0.0, "yes"));
        assertEquals(Boolean.TRUE, call("AND", true, 1.0));
        assertEquals(Boolean.TRUE, call("OR", RangeValue.column(false, "x", true)));
        assertEquals(Boolean.TRUE, call("XOR", true, false));
        assertEquals("fallback", call("IFERROR", ExcelError.DIV0, "fallback"));
        assertEquals(5.0, call("IFERROR", 5.0, "fallback"));
        assertEquals(ExcelError.DIV0, call("IFNA", ExcelError.DIV0, 0.0));
        assertEquals(0.0, call("IFNA", ExcelError.NA, 0.0));
    }

    @Test
    public void testText() {
        assertEquals("a1TRUE", call("CONCATENATE", "a", 1.0, true));
        assertEquals(5.0, call("LEN", "hello"));
        assertEquals("HEL", call("UPPER", call("LEFT", "hello", 3.0)));
        assertEquals("lo", call("RIGHT", "hello", 2.0));
        assertEquals("ell", call("MID", "hello", 2.0, 3.0));
        assertEquals("a b", call("TRIM", "  a   b "));
        assertEquals(12.5, call("VALUE", "12.5"));
        assertEquals(Boolean.FALSE, call("EXACT", "a", "A"));
    }

    @Test
    public void testInformation() {
        assertEquals(Boolean.TRUE, call("ISBLANK", (Object) null));
        assertEquals(Boolean.TRUE, call("ISERROR", ExcelError.NA));
        assertEquals(Boolean.FALSE, call("ISERR", ExcelError.NA));
        assertEquals(Boolean.TRUE, call("ISNA", ExcelError.NA));
        assertEquals(Boolean.TRUE, call("ISNUMBER", 1.0));
        assertEquals(Boolean.FALSE, call("ISTEXT", 1.0));
        assertEquals(ExcelError.NA, call("NA"));
    }

    @Test
    public void testLookup() {
        RangeValue keys = RangeValue.column(10.0, 20.0, 30.0);
        assertEquals(2.0, call("MATCH", 20.0, keys, 0.0));
        assertEquals(2.0, call("MATCH", 25.0, keys));
        assertEquals(ExcelError.NA, call("MATCH", 5.0, keys, 0.0));
        assertEquals(30.0, call("INDEX", keys, 3.0));
        assertEquals(ExcelError.REF, call("INDEX", keys, 4.0));

        RangeValue table = RangeValue.of(new Object[][] { { "a", 1.0 }, { "b", 2.0 }, { "c", 3.0 } });
        assertEquals(2.0, call("VLOOKUP", "B", table, 2.0, false));
        assertEquals(ExcelError.NA, call("VLOOKUP", "z", table, 2.0, false));
        assertEquals(ExcelError.REF, call("VLOOKUP", "a", table, 3.0, false));
    }
}
