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
 * SparseRow encodes the stored entries of one matrix row as a pair of growable arrays:
 * column indices and their values. Entries are arranged in ascending column order.
 */
public class SparseRow {
    private int size;
    private int[] columns;
    private double[] values;

    public SparseRow(int initialSize) {
        columns = new int[initialSize];
        values = new double[initialSize];
        size = 0;
    }

    /**
     * Add a new entry to the row. The column must be greater than all previously stored columns.
     */
    public void addInOrder(int column, double value) {
        if (size == columns.length) {
            growArrays();
        }
        assert size == 0 || columns[size - 1] < column
                : "Columns are added in the incorrect order! Comparing " + column
                + " to " + Arrays.toString(Arrays.copyOf(columns, size));
        columns[size] = column;
        values[size] = value;
        ++size;
    }

    /**
     * Stores a value at the given column, replacing any existing entry.
     *
     * @return the position of the entry within the row
     */
    public int put(int column, double value) {
        int idx = indexOf(column);
        if (idx >= 0) {
            values[idx] = value;
            return idx;
        }
        if (size == columns.length) {
            growArrays();
        }
        int insertionPoint = -idx - 1;
        System.arraycopy(columns, insertionPoint, columns, insertionPoint + 1, size - insertionPoint);
        System.arraycopy(values, insertionPoint, values, insertionPoint + 1, size - insertionPoint);
        columns[insertionPoint] = column;
        values[insertionPoint] = value;
        ++size;
        return insertionPoint;
    }

    /**
     * Returns the stored value at the given column, or zero if there is no entry.
     */
    public double get(int column) {
        int idx = indexOf(column);
        return idx >= 0 ? values[idx] : 0;
    }

    /**
     * Returns true if an entry, possibly an explicit zero, is stored at the given column.
     */
    public boolean contains(int column) {
        return indexOf(column) >= 0;
    }

    /**
     * Returns the position of the column's entry, or {@code -(insertionPoint) - 1} if absent.
     */
    public int indexOf(int column) {
        return Arrays.binarySearch(columns, 0, size, column);
    }

    /**
     * Removes the entry at the given column, if any.
     *
     * @return true if an entry was removed
     */
    public boolean remove(int column) {
        int idx = indexOf(column);
        if (idx < 0) {
            return false;
        }
        removeIndex(idx);
        return true;
    }

    public void removeIndex(int idx) {
        System.arraycopy(columns, idx + 1, columns, idx, size - idx - 1);
        System.arraycopy(values, idx + 1, values, idx, size - idx - 1);
        size--;
    }

    /**
     * Drops entries whose value is exactly zero, preserving the order of the rest.
     */
    public void removeZeros() {
        int writeIdx = 0;
        for (int readIdx = 0; readIdx < size; readIdx++) {
            if (values[readIdx] != 0) {
                if (writeIdx != readIdx) {
                    columns[writeIdx] = columns[readIdx];
                    values[writeIdx] = values[readIdx];
                }
                writeIdx++;
            }
        }
        size = writeIdx;
    }

    public SparseRow copy() {
        SparseRow copy = new SparseRow(size);
        copy.size = size;
        System.arraycopy(columns, 0, copy.columns, 0, size);
        System.arraycopy(values, 0, copy.values, 0, size);
        return copy;
    }

    private void growArrays() {
        int newLength = Math.max(4, columns.length + (columns.length >> 1) + 1);
        columns = Arrays.copyOf(columns, newLength);
        values = Arrays.copyOf(values, newLength);
    }

    public int size() {
        return size;
    }

    public void clear() {
        size = 0;
    }

    public int getColumn(int i) {
        return columns[i];
    }

    public double getValue(int i) {
        return values[i];
    }

    public void setValue(int i, double value) {
        values[i] = value;
    }

    /**
     * Returns the largest stored value, or negative infinity for an empty row.
     */
    public double maxValue() {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < size; i++) {
            max = Math.max(max, values[i]);
        }
        return max;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("SparseRow(");
        sb.append(size).append("/").append(columns.length).append(") [");
        for (int i = 0; i < size; i++) {
            sb.append("(").append(columns[i]).append(",").append(values[i]).append(")").append(", ");
        }
        sb.append("]");
        return sb.toString();
    }
}
