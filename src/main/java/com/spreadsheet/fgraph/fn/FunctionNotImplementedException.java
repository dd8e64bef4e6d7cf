package com.spreadsheet.fgraph.fn;

import com.spreadsheet.fgraph.api.FormulaGraphException;

/**
 * Thrown when a formula calls a function the registry does not know. The
 * calling node evaluates to {@code #NAME?}.
 */
public class FunctionNotImplementedException extends FormulaGraphException {
    private final String functionName;

    public FunctionNotImplementedException(String functionName) {
        super("Function not implemented: " + functionName);
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }
}
