package com.spreadsheet.fgraph.fn.builtin;

import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.RangeValue;
import com.spreadsheet.fgraph.api.Values;
import com.spreadsheet.fgraph.fn.Args;
import com.spreadsheet.fgraph.fn.FunctionRegistry;

/**
 * INDEX, MATCH and VLOOKUP over range arguments.
 */
public final class LookupFunctions {

    private LookupFunctions() {
        // Utility class
    }

    public static void register(FunctionRegistry registry) {
        registry.register("INDEX", LookupFunctions::index);
        registry.register("MATCH", LookupFunctions::match);
        registry.register("VLOOKUP", LookupFunctions::vlookup);
    }

    private static Object index(Object[] args) {
        Args.count(args, 2, 3);
        RangeValue rv = Args.range(args[0]);
        int row = (int) Args.number(args, 1);
        int col = (int) Args.number(args, 2, 0);
        if (!Args.present(args, 2)) {
            // a single index into a one-row range selects a column
            if (rv.rows() == 1) {
                col = row;
                row = 1;
            } else {
                col = 1;
            }
        }
        if (row < 1 || col < 1 || row > rv.rows() || col > rv.columns())
            return ExcelError.REF;
        return rv.get(row - 1, col - 1);
    }

    private static Object match(Object[] args) {
        Args.count(args, 2, 3);
        Object needle = Values.scalar(args[0]);
        if (needle instanceof ExcelError e)
            return e;
        RangeValue rv = Args.range(args[1]);
        if (rv.rows() != 1 && rv.columns() != 1)
            return ExcelError.NA;
        int type = (int) Args.number(args, 2, 1);
        int pos = find(needle, rv, 0, rv.size(), type);
        return pos < 0 ? ExcelError.NA : (Object) (double) (pos + 1);
    }

    private static Object vlookup(Object[] args) {
        Args.count(args, 3, 4);
        Object needle = Values.scalar(args[0]);
        if (needle instanceof ExcelError e)
            return e;
        RangeValue table = Args.range(args[1]);
        int col = (int) Args.number(args, 2);
        boolean approximate = Args.bool(args, 3, true);
        if (col < 1)
            return ExcelError.VALUE;
        if (col > table.columns())
            return ExcelError.REF;
        Object[] firstColumn = new Object[table.rows()];
        for (int r = 0; r < table.rows(); r++)
            firstColumn[r] = table.get(r, 0);
        int row = find(needle, new RangeValue(table.rows(), 1, firstColumn), 0, table.rows(), approximate ? 1 : 0);
        return row < 0 ? ExcelError.NA : table.get(row, col - 1);
    }

    /**
     * Linear search. Type 0 is exact; 1 returns the last position whose value is
     * not greater than the needle; -1 the last whose value is not less.
     */
    private static int find(Object needle, RangeValue values, int from, int to, int type) {
        int best = -1;
        for (int i = from; i < to; i++) {
            Object v = values.get(i);
            if (v == null || v instanceof ExcelError || !sameKind(needle, v))
                continue;
            int c = Values.compare(v, needle);
            if (type == 0) {
                if (c == 0)
                    return i;
            } else if (type > 0) {
                if (c <= 0)
                    best = i;
                else
                    break;
            } else {
                if (c >= 0)
                    best = i;
                else
                    break;
            }
        }
        return best;
    }

    private static boolean sameKind(Object a, Object b) {
        return (a instanceof Double && b instanceof Double) || (a instanceof String && b instanceof String)
                || (a instanceof Boolean && b instanceof Boolean);
    }
}
