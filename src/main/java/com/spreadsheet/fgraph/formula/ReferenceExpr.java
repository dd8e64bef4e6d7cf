package com.spreadsheet.fgraph.formula;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.EvaluationContext;

/**
 * A cell or range reference. A range evaluates to a
 * {@link com.spreadsheet.fgraph.api.RangeValue}; expansion happens in the range
 * node, not here.
 */
public record ReferenceExpr(Address address) implements Expr {

    @Override
    public Object evaluate(EvaluationContext context) {
        return context.valueOf(address);
    }

    @Override
    public String describe() {
        return address.address();
    }
}
