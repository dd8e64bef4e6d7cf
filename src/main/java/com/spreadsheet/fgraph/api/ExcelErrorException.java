package com.spreadsheet.fgraph.api;

/**
 * Carries an {@link ExcelError} out of a coercion or function so the caller can
 * turn it back into a cell value. Stack traces are not captured.
 */
public class ExcelErrorException extends FormulaGraphException {
    private final ExcelError error;

    public ExcelErrorException(ExcelError error) {
        super(error.toString(), false);
        this.error = error;
    }

    public ExcelError error() {
        return error;
    }
}
