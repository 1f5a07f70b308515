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
 * Row-compressed sparse matrix: one {@link SparseRow} per row, each sorted by column.
 * <p>
 * Stored entries may be explicit zeros; {@link #eliminateZeros()} drops them.
 */
public class SparseMatrix implements Matrix {
    private final SparseRow[] rows;
    private final int columns;

    /**
     * Constructs an empty m-by-n matrix.
     * @param m the number of rows
     * @param n the number of columns
     */
    public SparseMatrix(int m, int n) {
        if (m < 0 || n < 0) {
            throw new IllegalArgumentException("negative matrix shape: " + m + "x" + n);
        }
        rows = new SparseRow[m];
        for (int i = 0; i < m; i++) {
            rows[i] = new SparseRow(0);
        }
        columns = n;
    }

    /**
     * Returns the live storage of row i. Changes to the returned row are visible in the matrix.
     * @param i the row index
     * @return the row storage
     */
    public SparseRow row(int i) {
        return rows[i];
    }

    /**
     * Replaces row i with the given entries.
     * @param i the row index
     * @param row the new row contents; the matrix takes ownership
     * @throws IllegalArgumentException if the row references a column outside this matrix
     */
    public void replaceRow(int i, SparseRow row) {
        if (row.size() > 0 && (row.getColumn(0) < 0 || row.getColumn(row.size() - 1) >= columns)) {
            throw new IllegalArgumentException("row " + i + " has columns outside [0, " + columns + ")");
        }
        rows[i] = row;
    }

    /**
     * Returns true if an entry, possibly an explicit zero, is stored at (i, j).
     * @param i the row index
     * @param j the column index
     * @return true if the entry is stored
     */
    public boolean contains(int i, int j) {
        return rows[i].contains(j);
    }

    /**
     * Removes the entry at (i, j), if any.
     * @param i the row index
     * @param j the column index
     */
    public void remove(int i, int j) {
        rows[i].remove(j);
    }

    /**
     * Returns the number of stored entries, explicit zeros included.
     * @return the stored entry count
     */
    public int storedCount() {
        int count = 0;
        for (var row : rows) {
            count += row.size();
        }
        return count;
    }

    @Override
    public int rows() {
        return rows.length;
    }

    @Override
    public int columns() {
        return columns;
    }

    @Override
    public double get(int i, int j) {
        checkColumn(j);
        return rows[i].get(j);
    }

    @Override
    public void set(int i, int j, double value) {
        checkColumn(j);
        rows[i].put(j, value);
    }

    private void checkColumn(int j) {
        if (j < 0 || j >= columns) {
            throw new IndexOutOfBoundsException("column " + j + " outside [0, " + columns + ")");
        }
    }

    @Override
    public boolean isSparse() {
        return true;
    }

    @Override
    public void forEachEntry(EntryConsumer consumer) {
        for (int i = 0; i < rows.length; i++) {
            var row = rows[i];
            for (int k = 0; k < row.size(); k++) {
                consumer.accept(i, row.getColumn(k), row.getValue(k));
            }
        }
    }

    @Override
    public void eliminateZeros() {
        for (var row : rows) {
            row.removeZeros();
        }
    }

    @Override
    public SparseMatrix transpose() {
        var result = new SparseMatrix(columns, rows.length);
        // visiting rows in ascending order keeps every target row sorted
        forEachEntry((i, j, v) -> result.rows[j].addInOrder(i, v));
        return result;
    }

    @Override
    public SparseMatrix minimum(Matrix other) {
        if (rows.length != other.rows() || columns != other.columns()) {
            throw new IllegalArgumentException("matrix dimensions differ: " + rows.length + "x" + columns
                    + "!=" + other.rows() + "x" + other.columns());
        }
        var result = new SparseMatrix(rows.length, columns);
        if (!other.isSparse()) {
            // absent entries here read as zero, so only negative cells of other survive outside our pattern
            for (int i = 0; i < rows.length; i++) {
                for (int j = 0; j < columns; j++) {
                    double v = Math.min(rows[i].get(j), other.get(i, j));
                    if (v != 0) {
                        result.rows[i].addInOrder(j, v);
                    }
                }
            }
            return result;
        }

        var sparseOther = (SparseMatrix) other;
        for (int i = 0; i < rows.length; i++) {
            SparseRow a = rows[i];
            SparseRow b = sparseOther.rows[i];
            SparseRow merged = result.rows[i];
            int ia = 0, ib = 0;
            while (ia < a.size() || ib < b.size()) {
                int ca = ia < a.size() ? a.getColumn(ia) : Integer.MAX_VALUE;
                int cb = ib < b.size() ? b.getColumn(ib) : Integer.MAX_VALUE;
                double v;
                int column;
                if (ca < cb) {
                    column = ca;
                    v = Math.min(a.getValue(ia++), 0);
                } else if (cb < ca) {
                    column = cb;
                    v = Math.min(b.getValue(ib++), 0);
                } else {
                    column = ca;
                    v = Math.min(a.getValue(ia++), b.getValue(ib++));
                }
                if (v != 0) {
                    merged.addInOrder(column, v);
                }
            }
        }
        return result;
    }

    @Override
    public SparseMatrix copy() {
        var result = new SparseMatrix(rows.length, columns);
        for (int i = 0; i < rows.length; i++) {
            result.rows[i] = rows[i].copy();
        }
        return result;
    }

    @Override
    public DenseMatrix toDense() {
        var result = new DenseMatrix(rows.length, columns);
        forEachEntry(result::set);
        return result;
    }

    @Override
    public SparseMatrix toSparse() {
        return copy();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("SparseMatrix(");
        sb.append(rows.length).append("x").append(columns).append(")\n");
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].size() > 0) {
                sb.append(i).append(": ").append(rows[i]).append("\n");
            }
        }
        return sb.toString();
    }
}
