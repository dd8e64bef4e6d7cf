package com.spreadsheet.fgraph.formula;

import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.ExcelErrorException;
import com.spreadsheet.fgraph.api.Values;

/** Prefix {@code -} or {@code +}. */
public record UnaryExpr(boolean negate, Expr operand) implements Expr {

    @Override
    public Object evaluate(EvaluationContext context) {
        Object v = operand.evaluate(context);
        try {
            double d = Values.toNumber(Values.scalar(v));
            return Values.number(negate ? -d : d);
        } catch (ExcelErrorException e) {
            return e.error();
        }
    }

    @Override
    public String describe() {
        return (negate ? "-" : "+") + operand.describe();
    }
}
