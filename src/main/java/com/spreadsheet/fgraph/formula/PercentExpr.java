package com.spreadsheet.fgraph.formula;

import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.ExcelErrorException;
import com.spreadsheet.fgraph.api.Values;

/** Postfix {@code %}: divides its operand by 100. */
public record PercentExpr(Expr operand) implements Expr {

    @Override
    public Object evaluate(EvaluationContext context) {
        try {
            return Values.number(Values.toNumber(Values.scalar(operand.evaluate(context))) / 100.0);
        } catch (ExcelErrorException e) {
            return e.error();
        }
    }

    @Override
    public String describe() {
        return operand.describe() + "%";
    }
}
