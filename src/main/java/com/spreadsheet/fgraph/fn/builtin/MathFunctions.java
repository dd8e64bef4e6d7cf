package com.spreadsheet.fgraph.fn.builtin;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.ExcelErrorException;
import com.spreadsheet.fgraph.api.RangeValue;
import com.spreadsheet.fgraph.api.Values;
import com.spreadsheet.fgraph.fn.Args;
import com.spreadsheet.fgraph.fn.FunctionRegistry;

/**
 * Arithmetic and aggregate functions.
 */
public final class MathFunctions {

    private MathFunctions() {
        // Utility class
    }

    public static void register(FunctionRegistry registry) {
        registry.register("SUM", args -> sum(Args.numbers(args)));
        registry.register("AVERAGE", MathFunctions::average);
        registry.register("MIN", args -> extreme(Args.numbers(args), true));
        registry.register("MAX", args -> extreme(Args.numbers(args), false));
        registry.register("COUNT", MathFunctions::count);
        registry.register("COUNTA", MathFunctions::countA);
        registry.register("PRODUCT", MathFunctions::product);
        registry.register("SUMPRODUCT", MathFunctions::sumProduct);
        registry.register("ABS", args -> unary(args, Math::abs));
        registry.register("INT", args -> unary(args, Math::floor));
        registry.register("SIGN", args -> unary(args, Math::signum));
        registry.register("EXP", args -> unary(args, Math::exp));
        registry.register("LN", MathFunctions::ln);
        registry.register("SQRT", MathFunctions::sqrt);
        registry.register("ROUND", args -> round(args, RoundingMode.HALF_UP));
        registry.register("ROUNDUP", args -> round(args, RoundingMode.UP));
        registry.register("ROUNDDOWN", args -> round(args, RoundingMode.DOWN));
        registry.register("MOD", MathFunctions::mod);
        registry.register("POWER", MathFunctions::power);
        registry.register("PI", args -> {
            Args.count(args, 0, 0);
            return Math.PI;
        });
    }

    private static Object sum(List<Double> values) {
        double total = 0.0;
        for (double v : values)
            total += v;
        return Values.number(total);
    }

    private static Object average(Object[] args) {
        List<Double> values = Args.numbers(args);
        if (values.isEmpty())
            return ExcelError.DIV0;
        double total = 0.0;
        for (double v : values)
            total += v;
        return Values.number(total / values.size());
    }

    private static Object extreme(List<Double> values, boolean min) {
        if (values.isEmpty())
            return 0.0;
        double best = values.get(0);
        for (double v : values)
            best = min ? Math.min(best, v) : Math.max(best, v);
        return best;
    }

    private static Object count(Object[] args) {
        int n = 0;
        for (Object arg : args) {
            if (arg instanceof RangeValue rv) {
                for (Object v : rv.values())
                    if (v instanceof Double)
                        n++;
            } else if (arg instanceof Double || arg instanceof Boolean) {
                n++;
            } else if (arg instanceof String s && Values.isNumericText(s)) {
                n++;
            }
        }
        return (double) n;
    }

    private static Object countA(Object[] args) {
        int n = 0;
        for (Object v : Args.flatten(args))
            if (v != null)
                n++;
        return (double) n;
    }

    private static Object product(Object[] args) {
        List<Double> values = Args.numbers(args);
        if (values.isEmpty())
            return 0.0;
        double p = 1.0;
        for (double v : values)
            p *= v;
        return Values.number(p);
    }

    private static Object sumProduct(Object[] args) {
        if (args.length == 0)
            throw new ExcelErrorException(ExcelError.VALUE);
        RangeValue first = Args.range(args[0]);
        double[] acc = new double[first.size()];
        Arrays.fill(acc, 1.0);
        for (Object arg : args) {
            RangeValue rv = Args.range(arg);
            if (rv.rows() != first.rows() || rv.columns() != first.columns())
                return ExcelError.VALUE;
            for (int i = 0; i < rv.size(); i++) {
                Object v = rv.get(i);
                if (v instanceof ExcelError e)
                    return e;
                acc[i] *= v instanceof Double d ? d : 0.0;
            }
        }
        double total = 0.0;
        for (double v : acc)
            total += v;
        return Values.number(total);
    }

    private static Object unary(Object[] args, DoubleUnaryOperator op) {
        Args.count(args, 1, 1);
        return Values.number(op.applyAsDouble(Args.number(args, 0)));
    }

    private static Object ln(Object[] args) {
        Args.count(args, 1, 1);
        double x = Args.number(args, 0);
        if (x <= 0)
            return ExcelError.NUM;
        return Values.number(Math.log(x));
    }

    private static Object sqrt(Object[] args) {
        Args.count(args, 1, 1);
        double x = Args.number(args, 0);
        if (x < 0)
            return ExcelError.NUM;
        return Math.sqrt(x);
    }

    private static Object round(Object[] args, RoundingMode mode) {
        Args.count(args, 2, 2);
        double x = Args.number(args, 0);
        int digits = (int) Args.number(args, 1);
        return new BigDecimal(Double.toString(x)).setScale(digits, mode).doubleValue();
    }

    private static Object mod(Object[] args) {
        Args.count(args, 2, 2);
        double n = Args.number(args, 0);
        double d = Args.number(args, 1);
        if (d == 0.0)
            return ExcelError.DIV0;
        return Values.number(n - d * Math.floor(n / d));
    }

    private static Object power(Object[] args) {
        Args.count(args, 2, 2);
        double base = Args.number(args, 0);
        double exp = Args.number(args, 1);
        if (base == 0.0 && exp < 0)
            return ExcelError.DIV0;
        if (base == 0.0 && exp == 0.0)
            return ExcelError.NUM;
        return Values.number(Math.pow(base, exp));
    }
}
