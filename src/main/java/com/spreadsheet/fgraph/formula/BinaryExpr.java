package com.spreadsheet.fgraph.formula;

import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.ExcelErrorException;
import com.spreadsheet.fgraph.api.Values;

/**
 * Binary operator application. Errors in either operand propagate, left first.
 */
public record BinaryExpr(Operator operator, Expr left, Expr right) implements Expr {

    @Override
    public Object evaluate(EvaluationContext context) {
        Object l = left.evaluate(context);
        Object r = right.evaluate(context);
        try {
            return apply(operator, Values.scalar(l), Values.scalar(r));
        } catch (ExcelErrorException e) {
            return e.error();
        }
    }

    static Object apply(Operator op, Object l, Object r) {
        if (l instanceof ExcelError e)
            return e;
        if (r instanceof ExcelError e)
            return e;
        return switch (op) {
            case ADD -> Values.number(Values.toNumber(l) + Values.toNumber(r));
            case SUB -> Values.number(Values.toNumber(l) - Values.toNumber(r));
            case MUL -> Values.number(Values.toNumber(l) * Values.toNumber(r));
            case DIV -> divide(Values.toNumber(l), Values.toNumber(r));
            case POW -> power(Values.toNumber(l), Values.toNumber(r));
            case CONCAT -> Values.toText(l) + Values.toText(r);
            case EQ -> Values.compare(l, r) == 0;
            case NE -> Values.compare(l, r) != 0;
            case LT -> Values.compare(l, r) < 0;
            case GT -> Values.compare(l, r) > 0;
            case LE -> Values.compare(l, r) <= 0;
            case GE -> Values.compare(l, r) >= 0;
        };
    }

    private static Object divide(double a, double b) {
        if (b == 0.0)
            return ExcelError.DIV0;
        return Values.number(a / b);
    }

    private static Object power(double base, double exponent) {
        if (base == 0.0 && exponent < 0)
            return ExcelError.DIV0;
        if (base == 0.0 && exponent == 0.0)
            return ExcelError.NUM;
        return Values.number(Math.pow(base, exponent));
    }

    @Override
    public String describe() {
        return "(" + left.describe() + operator.symbol() + right.describe() + ")";
    }
}
