package com.spreadsheet.fgraph.formula;

import com.spreadsheet.fgraph.api.EvaluationContext;

/**
 * Node of a compiled formula's expression tree.
 */
public interface Expr {

    /**
     * Evaluates the expression. Spreadsheet errors are returned as
     * {@link com.spreadsheet.fgraph.api.ExcelError} values, never thrown.
     */
    Object evaluate(EvaluationContext context);

    /** Formula-like rendering used in diagnostics. */
    String describe();
}
