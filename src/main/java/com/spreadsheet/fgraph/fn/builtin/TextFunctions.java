package com.spreadsheet.fgraph.fn.builtin;

import java.util.Locale;

import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.Values;
import com.spreadsheet.fgraph.fn.Args;
import com.spreadsheet.fgraph.fn.FunctionRegistry;

/**
 * String functions. Positions and lengths are 1-based character counts.
 */
public final class TextFunctions {

    private TextFunctions() {
        // Utility class
    }

    public static void register(FunctionRegistry registry) {
        registry.register("CONCATENATE", args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.length; i++)
                sb.append(Args.text(args, i));
            return sb.toString();
        });
        registry.register("CONCAT", args -> {
            StringBuilder sb = new StringBuilder();
            for (Object v : Args.flatten(args))
                sb.append(Values.toText(v));
            return sb.toString();
        });
        registry.register("LEN", args -> {
            Args.count(args, 1, 1);
            return (double) Args.text(args, 0).length();
        });
        registry.register("UPPER", args -> {
            Args.count(args, 1, 1);
            return Args.text(args, 0).toUpperCase(Locale.ROOT);
        });
        registry.register("LOWER", args -> {
            Args.count(args, 1, 1);
            return Args.text(args, 0).toLowerCase(Locale.ROOT);
        });
        registry.register("TRIM", args -> {
            Args.count(args, 1, 1);
            return Args.text(args, 0).trim().replaceAll(" {2,}", " ");
        });
        registry.register("LEFT", args -> {
            Args.count(args, 1, 2);
            String s = Args.text(args, 0);
            int n = (int) Args.number(args, 1, 1);
            if (n < 0)
                return ExcelError.VALUE;
            return s.substring(0, Math.min(n, s.length()));
        });
        registry.register("RIGHT", args -> {
            Args.count(args, 1, 2);
            String s = Args.text(args, 0);
            int n = (int) Args.number(args, 1, 1);
            if (n < 0)
                return ExcelError.VALUE;
            return s.substring(Math.max(0, s.length() - n));
        });
        registry.register("MID", args -> {
            Args.count(args, 3, 3);
            String s = Args.text(args, 0);
            int start = (int) Args.number(args, 1);
            int n = (int) Args.number(args, 2);
            if (start < 1 || n < 0)
                return ExcelError.VALUE;
            if (start > s.length())
                return "";
            return s.substring(start - 1, Math.min(s.length(), start - 1 + n));
        });
        registry.register("EXACT", args -> {
            Args.count(args, 2, 2);
            return Args.text(args, 0).equals(Args.text(args, 1));
        });
        registry.register("VALUE", args -> {
            Args.count(args, 1, 1);
            return Values.toNumber(Args.text(args, 0));
        });
    }
}
