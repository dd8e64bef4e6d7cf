package com.spreadsheet.fgraph.source;

import com.spreadsheet.fgraph.api.Values;

/**
 * What the workbook holds in one cell: a literal value, or formula text with
 * the value the spreadsheet application last computed for it.
 *
 * @param value       literal value (null for a formula cell)
 * @param formula     formula text starting with {@code =}, or null
 * @param cachedValue last value computed by the spreadsheet application, may
 *                    be null
 */
public record CellContent(Object value, String formula, Object cachedValue) {

    public CellContent {
        value = Values.normalize(value);
        cachedValue = Values.normalize(cachedValue);
        if (formula != null && !formula.startsWith("="))
            formula = "=" + formula;
    }

    public static CellContent literal(Object value) {
        return new CellContent(value, null, value);
    }

    public static CellContent formula(String formula, Object cachedValue) {
        return new CellContent(null, formula, cachedValue);
    }

    public boolean isFormula() {
        return formula != null;
    }
}
