/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jrecur.matrix;

import java.util.Arrays;

/**
 * Matrix object where each row is a double[]; every cell is materialized.
 */
public class DenseMatrix implements Matrix {
    /**
     * The matrix data stored as rows.
     */
    final double[][] data;
    private final int columns;

    /**
     * Constructs an m-by-n matrix with all elements initialized to zero.
     * @param m the number of rows
     * @param n the number of columns
     */
    public DenseMatrix(int m, int n) {
        if (m < 0 || n < 0) {
            throw new IllegalArgumentException("negative matrix shape: " + m + "x" + n);
        }
        data = new double[m][n];
        columns = n;
    }

    private DenseMatrix(double[][] data, int columns) {
        this.data = data;
        this.columns = columns;
    }

    /**
     * Creates a matrix from a 2D array of values. Each row of the array is copied into a row of
     * the matrix.
     * @param values the 2D array containing the matrix elements (values[row][column])
     * @return a new DenseMatrix initialized with the provided values
     * @throws IllegalArgumentException if the rows have different lengths
     */
    public static DenseMatrix from(double[][] values) {
        int n = values.length == 0 ? 0 : values[0].length;
        var rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != n) {
                throw new IllegalArgumentException("ragged row " + i + ": " + values[i].length + "!=" + n);
            }
            rows[i] = values[i].clone();
        }
        return new DenseMatrix(rows, n);
    }

    @Override
    public int rows() {
        return data.length;
    }

    @Override
    public int columns() {
        return columns;
    }

    @Override
    public double get(int i, int j) {
        return data[i][j];
    }

    @Override
    public void set(int i, int j, double value) {
        data[i][j] = value;
    }

    /**
     * Adds a delta value to the element at row i and column j.
     * @param i the row index
     * @param j the column index
     * @param delta the value to add to the current element
     */
    public void addTo(int i, int j, double delta) {
        data[i][j] += delta;
    }

    /**
     * Checks if this matrix has the same dimensions as another matrix.
     * @param other the matrix to compare dimensions with
     * @return true if both matrices have the same number of rows and columns
     */
    public boolean isIsomorphicWith(Matrix other) {
        return rows() == other.rows() && columns() == other.columns();
    }

    /**
     * Replaces every element with the maximum of itself and the corresponding element of
     * another matrix, modifying this matrix in place.
     * @param other the matrix to compare with
     * @throws IllegalArgumentException if the matrices have different dimensions
     */
    public void maxInPlace(DenseMatrix other) {
        if (!isIsomorphicWith(other)) {
            throw new IllegalArgumentException("matrix dimensions differ: " + shape() + "!=" + other.shape());
        }
        for (int i = 0; i < data.length; i++) {
            var row = data[i];
            var otherRow = other.data[i];
            for (int j = 0; j < columns; j++) {
                row[j] = Math.max(row[j], otherRow[j]);
            }
        }
    }

    /**
     * Raises every negative element to zero, in place.
     */
    public void clipNegative() {
        for (var row : data) {
            for (int j = 0; j < columns; j++) {
                if (row[j] < 0) {
                    row[j] = 0;
                }
            }
        }
    }

    /**
     * Returns a copy of row i.
     * @param i the row index
     * @return the row values
     */
    public double[] getRow(int i) {
        return data[i].clone();
    }

    /**
     * Returns a copy of the contents as a 2D array.
     * @return values[row][column]
     */
    public double[][] toArray() {
        var copy = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            copy[i] = data[i].clone();
        }
        return copy;
    }

    @Override
    public boolean isSparse() {
        return false;
    }

    @Override
    public void forEachEntry(EntryConsumer consumer) {
        for (int i = 0; i < data.length; i++) {
            var row = data[i];
            for (int j = 0; j < columns; j++) {
                if (row[j] != 0) {
                    consumer.accept(i, j, row[j]);
                }
            }
        }
    }

    @Override
    public void eliminateZeros() {
        // zeros are not stored separately
    }

    @Override
    public DenseMatrix transpose() {
        var result = new DenseMatrix(columns, data.length);
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < columns; j++) {
                result.data[j][i] = data[i][j];
            }
        }
        return result;
    }

    @Override
    public DenseMatrix minimum(Matrix other) {
        if (!isIsomorphicWith(other)) {
            throw new IllegalArgumentException("matrix dimensions differ: " + shape() + "!=" + other.rows() + "x" + other.columns());
        }
        var result = new DenseMatrix(data.length, columns);
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < columns; j++) {
                result.data[i][j] = Math.min(data[i][j], other.get(i, j));
            }
        }
        return result;
    }

    @Override
    public DenseMatrix copy() {
        return new DenseMatrix(toArray(), columns);
    }

    @Override
    public DenseMatrix toDense() {
        return copy();
    }

    @Override
    public SparseMatrix toSparse() {
        var result = new SparseMatrix(data.length, columns);
        forEachEntry(result::set);
        return result;
    }

    String shape() {
        return data.length + "x" + columns;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (double[] row : data) {
            sb.append(Arrays.toString(row));
            sb.append("\n");
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof DenseMatrix)) {
            return false;
        }

        var other = (DenseMatrix) obj;
        return columns == other.columns && Arrays.deepEquals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * columns + Arrays.deepHashCode(data);
    }
}
