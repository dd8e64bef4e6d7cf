package com.spreadsheet.fgraph.fn;

import java.util.ArrayList;
import java.util.List;

import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.ExcelErrorException;
import com.spreadsheet.fgraph.api.RangeValue;
import com.spreadsheet.fgraph.api.Values;

/**
 * Argument helpers for built-in functions.
 *
 * Aggregates follow the usual spreadsheet rules: a directly supplied argument
 * is coerced (numeric text counts, other text is {@code #VALUE!}), while text,
 * booleans and blanks inside a range are skipped. Errors always propagate.
 */
public final class Args {

    private Args() {
        // Utility class
    }

    /** @throws ExcelErrorException {@code #VALUE!} when the count is outside [min, max]. */
    public static void count(Object[] args, int min, int max) {
        if (args.length < min || args.length > max)
            throw new ExcelErrorException(ExcelError.VALUE.withDetail(
                    "expected " + min + (max == min ? "" : ".." + max) + " arguments, got " + args.length));
    }

    public static boolean present(Object[] args, int i) {
        return i < args.length && args[i] != null;
    }

    public static double number(Object[] args, int i) {
        return Values.toNumber(Values.scalar(args[i]));
    }

    public static double number(Object[] args, int i, double defaultValue) {
        return present(args, i) ? number(args, i) : defaultValue;
    }

    public static String text(Object[] args, int i) {
        return Values.toText(Values.scalar(args[i]));
    }

    public static boolean bool(Object[] args, int i) {
        return Values.toBoolean(Values.scalar(args[i]));
    }

    public static boolean bool(Object[] args, int i, boolean defaultValue) {
        return present(args, i) ? bool(args, i) : defaultValue;
    }

    /** Views an argument as a range; a scalar becomes a 1x1 range. */
    public static RangeValue range(Object arg) {
        if (arg instanceof RangeValue rv)
            return rv;
        return new RangeValue(1, 1, new Object[] { arg });
    }

    /** Numeric values of all arguments, flattened. */
    public static List<Double> numbers(Object[] args) {
        List<Double> out = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof RangeValue rv) {
                for (int i = 0; i < rv.size(); i++) {
                    Object v = rv.get(i);
                    if (v instanceof ExcelError e)
                        throw new ExcelErrorException(e);
                    if (v instanceof Double d)
                        out.add(d);
                }
            } else {
                out.add(Values.toNumber(arg));
            }
        }
        return out;
    }

    /** Boolean values of all arguments; numbers count, text in ranges is skipped. */
    public static List<Boolean> booleans(Object[] args) {
        List<Boolean> out = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof RangeValue rv) {
                for (int i = 0; i < rv.size(); i++) {
                    Object v = rv.get(i);
                    if (v instanceof ExcelError e)
                        throw new ExcelErrorException(e);
                    if (v instanceof Boolean || v instanceof Double)
                        out.add(Values.toBoolean(v));
                }
            } else if (arg != null) {
                out.add(Values.toBoolean(arg));
            }
        }
        if (out.isEmpty())
            throw new ExcelErrorException(ExcelError.VALUE);
        return out;
    }

    /** Every value of every argument, ranges expanded, blanks included. */
    public static List<Object> flatten(Object[] args) {
        List<Object> out = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof RangeValue rv)
                out.addAll(rv.values());
            else
                out.add(arg);
        }
        return out;
    }

    /** Rethrows the first error among the arguments, scalar or inside a range. */
    public static void propagateErrors(Object[] args) {
        for (Object v : flatten(args))
            if (v instanceof ExcelError e)
                throw new ExcelErrorException(e);
    }
}
