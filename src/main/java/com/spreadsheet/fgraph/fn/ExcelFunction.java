package com.spreadsheet.fgraph.fn;

/**
 * A spreadsheet function over already-evaluated arguments.
 *
 * <p>
 * Each argument is a scalar cell value (null for blank or an omitted
 * argument) or a {@link com.spreadsheet.fgraph.api.RangeValue} for range
 * arguments. Error arguments arrive as {@link com.spreadsheet.fgraph.api.ExcelError}
 * values; a function that does not consume errors lets the coercion helpers in
 * {@link Args} rethrow them.
 */
@FunctionalInterface
public interface ExcelFunction {

    /**
     * @return the result value; may throw
     *         {@link com.spreadsheet.fgraph.api.ExcelErrorException} to return an
     *         error in-band.
     */
    Object apply(Object[] args);
}
