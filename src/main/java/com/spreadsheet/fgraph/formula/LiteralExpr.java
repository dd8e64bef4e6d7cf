package com.spreadsheet.fgraph.formula;

import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.Values;

/** A constant: number, text, boolean, error, or null for an omitted argument. */
public record LiteralExpr(Object value) implements Expr {

    @Override
    public Object evaluate(EvaluationContext context) {
        return value;
    }

    @Override
    public String describe() {
        if (value instanceof String s)
            return "\"" + s.replace("\"", "\"\"") + "\"";
        return value == null ? "" : Values.display(value);
    }
}
