package com.spreadsheet.fgraph.address;

import java.util.List;
import java.util.Locale;

/**
 * A spreadsheet table (list object) used to resolve structured references such
 * as {@code Sales[Amount]}, {@code Sales[#All]} or a bare {@code Sales}.
 *
 * @param name       table name, matched case-insensitively
 * @param range      the full table range including header rows
 * @param headerRows number of header rows at the top of {@code range} (0 or 1)
 * @param columns    column names, left to right
 */
public record TableDefinition(String name, AddressRange range, int headerRows, List<String> columns) {

    public TableDefinition {
        if (range.isMultiArea())
            throw new IllegalArgumentException("Table '" + name + "' must be a single area");
        if (headerRows < 0 || headerRows >= range.areas().get(0).rows())
            throw new IllegalArgumentException("Table '" + name + "' has no data rows");
        columns = List.copyOf(columns);
        if (columns.size() != range.areas().get(0).columns())
            throw new IllegalArgumentException("Table '" + name + "' declares " + columns.size()
                    + " columns for a range " + range.areas().get(0).columns() + " wide");
    }

    /**
     * Resolves a specifier inside the brackets of a structured reference.
     *
     * @param specifier empty or {@code #Data} for the data body, {@code #All},
     *                  {@code #Headers}, or a column name
     * @throws AddressException if the specifier names no column of this table
     */
    public AddressRange resolve(String specifier) {
        AddressRange.Area area = range.areas().get(0);
        int firstData = area.firstRow() + headerRows;
        String spec = specifier == null ? "" : specifier.trim();
        String upper = spec.toUpperCase(Locale.ROOT);
        if (upper.isEmpty() || upper.equals("#DATA"))
            return span(area.firstColumn(), firstData, area.lastColumn(), area.lastRow());
        if (upper.equals("#ALL"))
            return range;
        if (upper.equals("#HEADERS")) {
            if (headerRows == 0)
                throw new AddressException("Table has no header row", name + "[" + spec + "]");
            return span(area.firstColumn(), area.firstRow(), area.lastColumn(), firstData - 1);
        }
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).equalsIgnoreCase(spec)) {
                int col = area.firstColumn() + i;
                return span(col, firstData, col, area.lastRow());
            }
        }
        throw new AddressException("Unknown table column", name + "[" + spec + "]");
    }

    private AddressRange span(int firstColumn, int firstRow, int lastColumn, int lastRow) {
        return AddressRange.of(range.sheet(), List.of(new AddressRange.Area(firstColumn, firstRow, lastColumn, lastRow)));
    }
}
