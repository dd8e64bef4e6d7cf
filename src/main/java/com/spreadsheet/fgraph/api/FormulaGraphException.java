package com.spreadsheet.fgraph.api;

/**
 * Root of the unchecked exceptions thrown by the formula graph engine.
 */
public class FormulaGraphException extends RuntimeException {

    public FormulaGraphException(String message) {
        super(message);
    }

    public FormulaGraphException(String message, Throwable cause) {
        super(message, cause);
    }

    protected FormulaGraphException(String message, boolean writableStackTrace) {
        super(message, null, false, writableStackTrace);
    }
}
