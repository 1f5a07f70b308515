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

/**
 * A two-dimensional real matrix, stored either densely or sparsely.
 * <p>
 * Algorithms in this library are written once against this interface; the caller selects the
 * backing format. Sparse matrices distinguish stored entries from implicit zeros, and may hold
 * explicit zeros until {@link #eliminateZeros()} is called. Dense matrices treat every nonzero
 * cell as an entry.
 * <p>
 * Implementations are not threadsafe.
 */
public interface Matrix {
    /**
     * Returns the number of rows.
     * @return the number of rows
     */
    int rows();

    /**
     * Returns the number of columns.
     * @return the number of columns
     */
    int columns();

    /**
     * Returns the value at row i and column j; absent sparse entries read as zero.
     * @param i the row index
     * @param j the column index
     * @return the value at (i, j)
     */
    double get(int i, int j);

    /**
     * Stores a value at row i and column j. A sparse matrix keeps an explicit entry even when
     * the value is zero.
     * @param i the row index
     * @param j the column index
     * @param value the value to store
     */
    void set(int i, int j, double value);

    /**
     * Returns true if this matrix uses sparse storage.
     * @return true for sparse storage
     */
    boolean isSparse();

    /**
     * Visits every entry in row-major order: the stored entries of a sparse matrix (including
     * explicit zeros), or the nonzero cells of a dense one.
     * @param consumer receives (row, column, value) for each entry
     */
    void forEachEntry(EntryConsumer consumer);

    /**
     * Removes stored entries whose value is exactly zero. A no-op for dense storage.
     */
    void eliminateZeros();

    /**
     * Returns a new matrix of the same format holding the transpose of this one.
     * @return the transpose
     */
    Matrix transpose();

    /**
     * Returns a new matrix of this matrix's format holding the elementwise minimum of this and
     * another matrix of the same shape, with absent entries read as zero. Entries whose minimum
     * is zero are not stored.
     * @param other the matrix to compare against
     * @return the elementwise minimum
     */
    Matrix minimum(Matrix other);

    /**
     * Returns an independent copy in the same format.
     * @return the copy
     */
    Matrix copy();

    /**
     * Returns a dense copy of this matrix.
     * @return the dense matrix
     */
    DenseMatrix toDense();

    /**
     * Returns a sparse copy of this matrix holding its entries.
     * @return the sparse matrix
     */
    SparseMatrix toSparse();

    /**
     * Returns the number of nonzero values.
     * @return the count of cells whose value is not zero
     */
    default int nonZeroCount() {
        int[] count = new int[1];
        forEachEntry((i, j, v) -> {
            if (v != 0) {
                count[0]++;
            }
        });
        return count[0];
    }

    /**
     * Returns true if this matrix has as many rows as columns.
     * @return true if the matrix is square
     */
    default boolean isSquare() {
        return rows() == columns();
    }

    /**
     * Returns true if this matrix equals its transpose.
     * @return true if the matrix is symmetric
     */
    default boolean isSymmetric() {
        if (!isSquare()) {
            return false;
        }
        boolean[] symmetric = {true};
        forEachEntry((i, j, v) -> {
            if (get(j, i) != v) {
                symmetric[0] = false;
            }
        });
        return symmetric[0];
    }

    /**
     * Creates a zero-filled matrix of the given shape and format.
     * @param rows the number of rows
     * @param columns the number of columns
     * @param sparse true for sparse storage
     * @return the new matrix
     */
    static Matrix zeros(int rows, int columns, boolean sparse) {
        return sparse ? new SparseMatrix(rows, columns) : new DenseMatrix(rows, columns);
    }

    /**
     * Compares two matrices by shape and values, regardless of storage format.
     * @param a the first matrix
     * @param b the second matrix
     * @return true if the shapes match and every cell holds the same value
     */
    static boolean valuesEqual(Matrix a, Matrix b) {
        if (a.rows() != b.rows() || a.columns() != b.columns()) {
            return false;
        }
        boolean[] equal = {true};
        a.forEachEntry((i, j, v) -> {
            if (b.get(i, j) != v) {
                equal[0] = false;
            }
        });
        b.forEachEntry((i, j, v) -> {
            if (a.get(i, j) != v) {
                equal[0] = false;
            }
        });
        return equal[0];
    }

    /**
     * Receives matrix entries during iteration.
     */
    @FunctionalInterface
    interface EntryConsumer {
        /**
         * Accepts one entry.
         * @param row the row index
         * @param column the column index
         * @param value the stored value
         */
        void accept(int row, int column, double value);
    }
}
