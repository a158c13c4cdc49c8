package org.javai.formula.materialize;

import java.util.Arrays;
import java.util.Objects;

/**
 * A dense, immutable matrix of doubles stored row by row.
 */
public final class NumericMatrix {

    private final int rows;
    private final int columns;
    private final double[] data;

    private NumericMatrix(int rows, int columns, double[] data) {
        this.rows = rows;
        this.columns = columns;
        this.data = data;
    }

    /**
     * A matrix from row arrays, which must all have the same length.
     */
    public static NumericMatrix ofRows(double[][] rowValues) {
        Objects.requireNonNull(rowValues, "rowValues must not be null");
        int columns = rowValues.length == 0 ? 0 : rowValues[0].length;
        double[] data = new double[rowValues.length * columns];
        for (int i = 0; i < rowValues.length; i++) {
            if (rowValues[i].length != columns) {
                throw new IllegalArgumentException("row " + i + " has " + rowValues[i].length
                        + " values, expected " + columns);
            }
            System.arraycopy(rowValues[i], 0, data, i * columns, columns);
        }
        return new NumericMatrix(rowValues.length, columns, data);
    }

    /**
     * A matrix from column arrays of {@code rows} values each.
     */
    public static NumericMatrix ofColumns(int rows, double[][] columnValues) {
        Objects.requireNonNull(columnValues, "columnValues must not be null");
        int columns = columnValues.length;
        double[] data = new double[rows * columns];
        for (int j = 0; j < columns; j++) {
            if (columnValues[j].length != rows) {
                throw new IllegalArgumentException("column " + j + " has " + columnValues[j].length
                        + " values, expected " + rows);
            }
            for (int i = 0; i < rows; i++) {
                data[i * columns + j] = columnValues[j][i];
            }
        }
        return new NumericMatrix(rows, columns, data);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public double get(int row, int column) {
        Objects.checkIndex(row, rows);
        Objects.checkIndex(column, columns);
        return data[row * columns + column];
    }

    public double[] row(int row) {
        Objects.checkIndex(row, rows);
        return Arrays.copyOfRange(data, row * columns, (row + 1) * columns);
    }

    public double[] column(int column) {
        Objects.checkIndex(column, columns);
        double[] values = new double[rows];
        for (int i = 0; i < rows; i++) {
            values[i] = data[i * columns + column];
        }
        return values;
    }

    /**
     * A copy as row arrays.
     */
    public double[][] toArray() {
        double[][] result = new double[rows][];
        for (int i = 0; i < rows; i++) {
            result[i] = row(i);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NumericMatrix other
                && rows == other.rows
                && columns == other.columns
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NumericMatrix[").append(rows).append('×').append(columns).append(']');
        for (int i = 0; i < Math.min(rows, 10); i++) {
            sb.append("\n  ").append(Arrays.toString(row(i)));
        }
        if (rows > 10) {
            sb.append("\n  ...");
        }
        return sb.toString();
    }
}
