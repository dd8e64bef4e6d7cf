package com.spreadsheet.fgraph.api;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Values of a range in row-major order together with its shape.
 * Elements are scalar cell values (null for blank).
 */
public final class RangeValue {
    private final int rows;
    private final int columns;
    private final Object[] values;

    public RangeValue(int rows, int columns, Object[] values) {
        if (rows < 0 || columns < 0 || values.length != rows * columns)
            throw new IllegalArgumentException(
                    "Shape " + rows + "x" + columns + " does not match " + values.length + " values");
        this.rows = rows;
        this.columns = columns;
        this.values = values.clone();
    }

    /** Builds a range value from a rectangular 2-D array. */
    public static RangeValue of(Object[][] matrix) {
        int rows = matrix.length;
        int cols = rows == 0 ? 0 : matrix[0].length;
        Object[] flat = new Object[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (matrix[r].length != cols)
                throw new IllegalArgumentException("Ragged matrix at row " + r);
            for (int c = 0; c < cols; c++)
                flat[r * cols + c] = Values.normalize(matrix[r][c]);
        }
        return new RangeValue(rows, cols, flat);
    }

    /** Single-column range value. */
    public static RangeValue column(Object... values) {
        Object[] flat = new Object[values.length];
        for (int i = 0; i < values.length; i++)
            flat[i] = Values.normalize(values[i]);
        return new RangeValue(values.length, 1, flat);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public int size() {
        return values.length;
    }

    /** Element at 0-based row-major index. */
    public Object get(int index) {
        return values[index];
    }

    /** Element at 0-based row and column. */
    public Object get(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns)
            throw new IndexOutOfBoundsException("(" + row + "," + column + ") outside " + rows + "x" + columns);
        return values[row * columns + column];
    }

    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RangeValue other))
            return false;
        return rows == other.rows && columns == other.columns && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int r = 0; r < rows; r++) {
            if (r > 0)
                sb.append("; ");
            for (int c = 0; c < columns; c++) {
                if (c > 0)
                    sb.append(", ");
                sb.append(Values.display(values[r * columns + c]));
            }
        }
        return sb.append(']').toString();
    }
}
