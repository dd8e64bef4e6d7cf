package com.spreadsheet.fgraph.fn.builtin;

import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.fn.Args;
import com.spreadsheet.fgraph.fn.FunctionRegistry;

/**
 * IF and the boolean connectives. IFERROR and IFNA consume error arguments.
 */
public final class LogicalFunctions {

    private LogicalFunctions() {
        // Utility class
    }

    public static void register(FunctionRegistry registry) {
        registry.register("IF", LogicalFunctions::ifFn);
        registry.register("AND", args -> {
            for (boolean b : Args.booleans(args))
                if (!b)
                    return false;
            return true;
        });
        registry.register("OR", args -> {
            for (boolean b : Args.booleans(args))
                if (b)
                    return true;
            return false;
        });
        registry.register("XOR", args -> {
            boolean acc = false;
            for (boolean b : Args.booleans(args))
                acc ^= b;
            return acc;
        });
        registry.register("NOT", args -> {
            Args.count(args, 1, 1);
            return !Args.bool(args, 0);
        });
        registry.register("IFERROR", args -> {
            Args.count(args, 2, 2);
            return args[0] instanceof ExcelError ? blankAsZero(args[1]) : args[0];
        });
        registry.register("IFNA", args -> {
            Args.count(args, 2, 2);
            return ExcelError.NA.equals(args[0]) ? blankAsZero(args[1]) : args[0];
        });
        registry.register("TRUE", args -> {
            Args.count(args, 0, 0);
            return true;
        });
        registry.register("FALSE", args -> {
            Args.count(args, 0, 0);
            return false;
        });
    }

    private static Object ifFn(Object[] args) {
        Args.count(args, 1, 3);
        if (Args.bool(args, 0))
            return args.length > 1 ? blankAsZero(args[1]) : Boolean.TRUE;
        return args.length > 2 ? blankAsZero(args[2]) : Boolean.FALSE;
    }

    // a blank branch result displays as 0
    private static Object blankAsZero(Object value) {
        return value == null ? 0.0 : value;
    }
}
