package com.spreadsheet.fgraph.address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular span of cells on one sheet, or a union of such spans
 * (multi-area range, e.g. a named range built from a discontinuous selection).
 *
 * <p>
 * Whole-column ({@code A:C}) and whole-row ({@code 2:4}) spans are open-ended:
 * they are stored with sheet-maximum bounds and clipped to the populated extent
 * of the sheet when {@link #cells(int, int) expanded}.
 */
public final class AddressRange implements Address {
    private final String sheet;
    private final List<Area> areas;

    /**
     * One rectangular area with 1-based inclusive bounds, normalized so that
     * first ≤ last on both axes.
     */
    public record Area(int firstColumn, int firstRow, int lastColumn, int lastRow) {
        public Area {
            if (firstColumn > lastColumn) {
                int t = firstColumn;
                firstColumn = lastColumn;
                lastColumn = t;
            }
            if (firstRow > lastRow) {
                int t = firstRow;
                firstRow = lastRow;
                lastRow = t;
            }
            if (firstColumn < 1 || lastColumn > AddressCell.MAX_COLUMN || firstRow < 1
                    || lastRow > AddressCell.MAX_ROW)
                throw new AddressException("Area out of bounds",
                        firstColumn + "," + firstRow + ":" + lastColumn + "," + lastRow);
        }

        public static Area of(AddressCell start, AddressCell end) {
            return new Area(start.column(), start.row(), end.column(), end.row());
        }

        /** True when the area spans every row ({@code A:C}). */
        public boolean wholeColumn() {
            return firstRow == 1 && lastRow == AddressCell.MAX_ROW;
        }

        /** True when the area spans every column ({@code 2:4}). */
        public boolean wholeRow() {
            return firstColumn == 1 && lastColumn == AddressCell.MAX_COLUMN;
        }

        public int rows() {
            return lastRow - firstRow + 1;
        }

        public int columns() {
            return lastColumn - firstColumn + 1;
        }

        public boolean contains(int column, int row) {
            return column >= firstColumn && column <= lastColumn && row >= firstRow && row <= lastRow;
        }

        int clippedLastRow(int rowLimit) {
            return wholeColumn() ? Math.max(firstRow, Math.min(lastRow, rowLimit)) : lastRow;
        }

        int clippedLastColumn(int columnLimit) {
            return wholeRow() ? Math.max(firstColumn, Math.min(lastColumn, columnLimit)) : lastColumn;
        }

        String coordinate() {
            if (wholeColumn() && !wholeRow())
                return AddressCell.columnLetters(firstColumn) + ":" + AddressCell.columnLetters(lastColumn);
            if (wholeRow() && !wholeColumn())
                return firstRow + ":" + lastRow;
            String start = AddressCell.columnLetters(firstColumn) + firstRow;
            if (firstColumn == lastColumn && firstRow == lastRow)
                return start;
            return start + ":" + AddressCell.columnLetters(lastColumn) + lastRow;
        }
    }

    private AddressRange(String sheet, List<Area> areas) {
        this.sheet = sheet;
        this.areas = List.copyOf(areas);
    }

    /** Creates a range from one or more areas on the given sheet. */
    public static AddressRange of(String sheet, List<Area> areas) {
        if (sheet == null || sheet.isEmpty())
            throw new AddressException("Missing sheet name", String.valueOf(areas));
        if (areas.isEmpty())
            throw new AddressException("Range has no areas", sheet);
        return new AddressRange(sheet, areas);
    }

    /** Creates the single-area range spanning {@code start} to {@code end}. */
    public static AddressRange of(AddressCell start, AddressCell end) {
        if (!start.sheet().equals(end.sheet()))
            throw new AddressException("Range spans two sheets", start + ":" + end);
        return new AddressRange(start.sheet(), List.of(Area.of(start, end)));
    }

    /**
     * Parses range text such as {@code Sheet!A1:B3}, {@code A:A} or
     * {@code Sheet!A1:B2,D4}. A 1x1 span is still returned as a range here; use
     * {@link Addresses#parse(String, String)} for the normalized form.
     */
    public static AddressRange parse(String text, String defaultSheet) {
        return Addresses.parseRange(text, defaultSheet);
    }

    @Override
    public String sheet() {
        return sheet;
    }

    @Override
    public boolean isCell() {
        return false;
    }

    public List<Area> areas() {
        return areas;
    }

    public boolean isMultiArea() {
        return areas.size() > 1;
    }

    /** True when this is a single 1x1 area, i.e. address-equivalent to a cell. */
    public boolean isSingleCell() {
        if (areas.size() != 1)
            return false;
        Area a = areas.get(0);
        return a.rows() == 1 && a.columns() == 1;
    }

    /** Top-left cell of the first area. */
    public AddressCell start() {
        Area a = areas.get(0);
        return AddressCell.of(sheet, a.firstColumn(), a.firstRow());
    }

    /** Bottom-right cell of the first area. */
    public AddressCell end() {
        Area a = areas.get(0);
        return AddressCell.of(sheet, a.lastColumn(), a.lastRow());
    }

    public boolean contains(AddressCell cell) {
        if (!sheet.equals(cell.sheet()))
            return false;
        for (Area a : areas)
            if (a.contains(cell.column(), cell.row()))
                return true;
        return false;
    }

    /**
     * Expands the range into its constituent cells, row-major within each area
     * and area by area. Open (whole row/column) bounds are clipped to the given
     * limits.
     */
    public List<AddressCell> cells(int rowLimit, int columnLimit) {
        List<AddressCell> cells = new ArrayList<>();
        for (Area a : areas) {
            int lastRow = a.clippedLastRow(rowLimit);
            int lastColumn = a.clippedLastColumn(columnLimit);
            for (int r = a.firstRow(); r <= lastRow; r++)
                for (int c = a.firstColumn(); c <= lastColumn; c++)
                    cells.add(AddressCell.of(sheet, c, r));
        }
        return Collections.unmodifiableList(cells);
    }

    /**
     * Shape of the expanded range as {@code {rows, columns}}. A multi-area range
     * is reported as a single column holding every cell.
     */
    public int[] shape(int rowLimit, int columnLimit) {
        if (areas.size() == 1) {
            Area a = areas.get(0);
            return new int[] { a.clippedLastRow(rowLimit) - a.firstRow() + 1,
                    a.clippedLastColumn(columnLimit) - a.firstColumn() + 1 };
        }
        return new int[] { cells(rowLimit, columnLimit).size(), 1 };
    }

    @Override
    public String address() {
        StringBuilder sb = new StringBuilder(Addresses.quoteSheet(sheet)).append('!');
        for (int i = 0; i < areas.size(); i++) {
            if (i > 0)
                sb.append(',');
            sb.append(areas.get(i).coordinate());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AddressRange other))
            return false;
        return sheet.equals(other.sheet) && areas.equals(other.areas);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, areas);
    }

    @Override
    public String toString() {
        return address();
    }
}
