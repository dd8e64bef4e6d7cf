package com.spreadsheet.fgraph.fn.builtin;

import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.RangeValue;
import com.spreadsheet.fgraph.fn.Args;
import com.spreadsheet.fgraph.fn.FunctionRegistry;

/**
 * IS* predicates and NA(). These consume error arguments instead of
 * propagating them.
 */
public final class InformationFunctions {

    private InformationFunctions() {
        // Utility class
    }

    public static void register(FunctionRegistry registry) {
        registry.register("ISBLANK", args -> probe(args) == null);
        registry.register("ISERROR", args -> probe(args) instanceof ExcelError);
        registry.register("ISERR", args -> {
            Object v = probe(args);
            return v instanceof ExcelError && !ExcelError.NA.equals(v);
        });
        registry.register("ISNA", args -> ExcelError.NA.equals(probe(args)));
        registry.register("ISNUMBER", args -> probe(args) instanceof Double);
        registry.register("ISTEXT", args -> probe(args) instanceof String);
        registry.register("ISLOGICAL", args -> probe(args) instanceof Boolean);
        registry.register("NA", args -> {
            Args.count(args, 0, 0);
            return ExcelError.NA;
        });
    }

    private static Object probe(Object[] args) {
        Args.count(args, 1, 1);
        Object v = args[0];
        if (v instanceof RangeValue rv)
            return rv.size() == 1 ? rv.get(0) : rv;
        return v;
    }
}
