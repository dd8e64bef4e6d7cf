package com.spreadsheet.fgraph.address;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single sheet-qualified cell address, e.g. {@code Sheet!B7}.
 *
 * <p>
 * Immutable value type. Absolute markers ({@code $}) are accepted when parsing
 * but are not part of the value: {@code Sheet!$B$7} and {@code Sheet!B7} are the
 * same cell. Ordering is row-major within a sheet, which is the iteration order
 * of {@link AddressRange#cells(int, int)}.
 */
public final class AddressCell implements Address, Comparable<AddressCell> {
    public static final int MAX_ROW = 1_048_576;
    public static final int MAX_COLUMN = 16_384;

    private static final Comparator<AddressCell> ORDER = Comparator
            .comparing(AddressCell::sheet)
            .thenComparingInt(AddressCell::row)
            .thenComparingInt(AddressCell::column);

    private final String sheet;
    private final int column;
    private final int row;

    private AddressCell(String sheet, int column, int row) {
        this.sheet = sheet;
        this.column = column;
        this.row = row;
    }

    /**
     * Creates a cell address from 1-based coordinates.
     *
     * @throws AddressException if the sheet is missing or a coordinate is out of
     *                          bounds.
     */
    public static AddressCell of(String sheet, int column, int row) {
        if (sheet == null || sheet.isEmpty())
            throw new AddressException("Missing sheet name", columnLetters(Math.max(column, 1)) + row);
        if (column < 1 || column > MAX_COLUMN)
            throw new AddressException("Column out of range", sheet + "!" + column + ":" + row);
        if (row < 1 || row > MAX_ROW)
            throw new AddressException("Row out of range", sheet + "!" + column + ":" + row);
        return new AddressCell(sheet, column, row);
    }

    /** Parses a fully qualified cell address such as {@code Sheet!A1}. */
    public static AddressCell parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses a cell address, using {@code defaultSheet} when the text carries no
     * sheet prefix.
     *
     * @throws AddressException if the text is malformed or denotes more than one
     *                          cell.
     */
    public static AddressCell parse(String text, String defaultSheet) {
        Address parsed = Addresses.parse(text, defaultSheet);
        if (parsed instanceof AddressCell cell)
            return cell;
        throw new AddressException("Not a single cell", text);
    }

    @Override
    public String sheet() {
        return sheet;
    }

    public int column() {
        return column;
    }

    public int row() {
        return row;
    }

    @Override
    public boolean isCell() {
        return true;
    }

    /** Column letters, e.g. {@code AB}. */
    public String columnLetters() {
        return columnLetters(column);
    }

    /** Sheet-less coordinate, e.g. {@code AB12}. */
    public String coordinate() {
        return columnLetters(column) + row;
    }

    @Override
    public String address() {
        return Addresses.quoteSheet(sheet) + "!" + coordinate();
    }

    /** Returns the cell shifted by the given number of rows and columns. */
    public AddressCell offset(int rows, int columns) {
        return of(sheet, column + columns, row + rows);
    }

    /** Converts column letters ({@code A}, {@code AB}) to a 1-based index. */
    public static int columnIndex(String letters) {
        int col = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z')
                throw new AddressException("Bad column letters", letters);
            col = col * 26 + (c - 'A' + 1);
        }
        return col;
    }

    /** Converts a 1-based column index to letters. */
    public static String columnLetters(int column) {
        StringBuilder sb = new StringBuilder(3);
        int c = column;
        while (c > 0) {
            int rem = (c - 1) % 26;
            sb.append((char) ('A' + rem));
            c = (c - 1) / 26;
        }
        return sb.reverse().toString();
    }

    @Override
    public int compareTo(AddressCell other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AddressCell other))
            return false;
        return column == other.column && row == other.row && sheet.equals(other.sheet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, column, row);
    }

    @Override
    public String toString() {
        return address();
    }
}
