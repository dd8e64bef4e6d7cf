package com.spreadsheet.fgraph.api;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Spreadsheet value coercions shared by operators and built-in functions.
 *
 * <p>
 * The value universe is: {@code null} (blank), {@link Double}, {@link String},
 * {@link Boolean}, {@link ExcelError} and {@link RangeValue}. Coercions that
 * fail, or that meet an error operand, throw {@link ExcelErrorException}; the
 * compiled expression catches it and turns it back into an in-band value.
 */
public final class Values {
    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final MathContext DISPLAY_PRECISION = new MathContext(15);

    private Values() {
        // Utility class
    }

    /**
     * Maps host values onto the value universe: any {@link Number} becomes a
     * {@link Double}, a {@code Object[][]} becomes a {@link RangeValue}.
     *
     * @throws IllegalArgumentException for unsupported types
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof Double || value instanceof String || value instanceof Boolean
                || value instanceof ExcelError || value instanceof RangeValue)
            return value;
        if (value instanceof Number n)
            return n.doubleValue();
        if (value instanceof Character c)
            return c.toString();
        if (value instanceof Object[][] matrix)
            return RangeValue.of(matrix);
        throw new IllegalArgumentException("Unsupported cell value type: " + value.getClass().getName());
    }

    /** Wraps a computed double, mapping NaN and infinities to {@code #NUM!}. */
    public static Object number(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d))
            return ExcelError.NUM;
        return d;
    }

    /**
     * Numeric coercion: blank is 0, booleans are 1/0, numeric text is parsed,
     * anything else is {@code #VALUE!}. Error operands are rethrown.
     */
    public static double toNumber(Object value) {
        if (value == null)
            return 0.0;
        if (value instanceof Double d)
            return d;
        if (value instanceof Boolean b)
            return b ? 1.0 : 0.0;
        if (value instanceof String s) {
            String t = s.trim();
            if (NUMERIC.matcher(t).matches())
                return Double.parseDouble(t);
            throw new ExcelErrorException(ExcelError.VALUE);
        }
        if (value instanceof ExcelError e)
            throw new ExcelErrorException(e);
        return toNumber(scalar(value));
    }

    /** True when {@link #toNumber(Object)} would parse the text. */
    public static boolean isNumericText(String s) {
        return NUMERIC.matcher(s.trim()).matches();
    }

    /** Text coercion: blank is empty, numbers print without a trailing {@code .0}. */
    public static String toText(Object value) {
        if (value == null)
            return "";
        if (value instanceof String s)
            return s;
        if (value instanceof Double d)
            return formatNumber(d);
        if (value instanceof Boolean b)
            return b ? "TRUE" : "FALSE";
        if (value instanceof ExcelError e)
            throw new ExcelErrorException(e);
        return toText(scalar(value));
    }

    /** Boolean coercion: numbers are true when non-zero, text must be TRUE/FALSE. */
    public static boolean toBoolean(Object value) {
        if (value == null)
            return false;
        if (value instanceof Boolean b)
            return b;
        if (value instanceof Double d)
            return d != 0.0;
        if (value instanceof String s) {
            if (s.equalsIgnoreCase("TRUE"))
                return true;
            if (s.equalsIgnoreCase("FALSE"))
                return false;
            throw new ExcelErrorException(ExcelError.VALUE);
        }
        if (value instanceof ExcelError e)
            throw new ExcelErrorException(e);
        return toBoolean(scalar(value));
    }

    /**
     * Reduces a single-cell range to its element. Larger ranges cannot be used
     * where a scalar is expected and yield {@code #VALUE!}.
     */
    public static Object scalar(Object value) {
        if (value instanceof RangeValue rv) {
            if (rv.size() == 1)
                return rv.get(0);
            throw new ExcelErrorException(ExcelError.VALUE);
        }
        return value;
    }

    /**
     * Spreadsheet comparison order: numbers sort before text, text before
     * booleans; text compares case-insensitively. A blank operand takes the
     * neutral value of the other side's type (0, "" or FALSE).
     */
    public static int compare(Object a, Object b) {
        if (a == null && b == null)
            return 0;
        if (a == null)
            a = blankLike(b);
        if (b == null)
            b = blankLike(a);
        int ra = rank(a);
        int rb = rank(b);
        if (ra != rb)
            return Integer.compare(ra, rb);
        if (a instanceof Double x && b instanceof Double y)
            return x < y ? -1 : (x > y ? 1 : 0);
        if (a instanceof String x && b instanceof String y)
            return x.toLowerCase(Locale.ROOT).compareTo(y.toLowerCase(Locale.ROOT));
        return Boolean.compare((Boolean) a, (Boolean) b);
    }

    private static Object blankLike(Object other) {
        if (other instanceof String)
            return "";
        if (other instanceof Boolean)
            return Boolean.FALSE;
        return 0.0;
    }

    private static int rank(Object v) {
        if (v instanceof Double)
            return 0;
        if (v instanceof String)
            return 1;
        if (v instanceof Boolean)
            return 2;
        if (v instanceof ExcelError e)
            throw new ExcelErrorException(e);
        throw new ExcelErrorException(ExcelError.VALUE);
    }

    /** Formats a number the way a cell displays it in General format. */
    public static String formatNumber(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 1e15)
            return Long.toString((long) d);
        if (Double.isNaN(d) || Double.isInfinite(d))
            return ExcelError.NUM.code();
        return new BigDecimal(d).round(DISPLAY_PRECISION).stripTrailingZeros().toPlainString();
    }

    /** Human-readable rendering for logs, value trees and reports. */
    public static String display(Object value) {
        if (value == null)
            return "<blank>";
        if (value instanceof Double d)
            return formatNumber(d);
        if (value instanceof Boolean b)
            return b ? "TRUE" : "FALSE";
        if (value instanceof ExcelError e)
            return e.code();
        return value.toString();
    }
}
