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

package io.github.jrecur.filters;

import io.github.jrecur.exceptions.ParameterException;
import io.github.jrecur.matrix.DenseMatrix;
import io.github.jrecur.matrix.Matrix;

import java.util.Arrays;

/**
 * Rectangular median filter. Each output cell is the element of rank {@code size / 2} among the
 * {@code rows x columns} cells around it (the upper median for even sizes), with the footprint
 * anchored at {@code (rows / 2, columns / 2)}.
 * <p>
 * Combined with {@link io.github.jrecur.lag.TimeLagFilter} this filters along the diagonals of
 * a recurrence matrix.
 */
public class MedianFilter {
    private final int rows;
    private final int columns;
    private final ConvolveOptions options;

    /**
     * @param rows the footprint height
     * @param columns the footprint width
     * @param options boundary handling
     * @throws ParameterException if either footprint dimension is less than 1
     */
    public MedianFilter(int rows, int columns, ConvolveOptions options) {
        if (rows < 1 || columns < 1) {
            throw new ParameterException("median footprint " + rows + "x" + columns + " must be at least 1x1");
        }
        this.rows = rows;
        this.columns = columns;
        this.options = options;
    }

    public MedianFilter(int rows, int columns) {
        this(rows, columns, ConvolveOptions.DEFAULT);
    }

    /**
     * Filters a matrix.
     * @param input the matrix to filter, dense or sparse
     * @return a new dense matrix of the same shape
     */
    public DenseMatrix apply(Matrix input) {
        int m = input.rows();
        int n = input.columns();
        var result = new DenseMatrix(m, n);
        if (m == 0 || n == 0) {
            return result;
        }
        double[][] data = input.toDense().toArray();
        int ch = rows / 2;
        int cw = columns / 2;
        var window = new double[rows * columns];
        int rank = window.length / 2;
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) {
                int w = 0;
                for (int a = 0; a < rows; a++) {
                    for (int b = 0; b < columns; b++) {
                        window[w++] = options.read(data, i + a - ch, j + b - cw);
                    }
                }
                Arrays.sort(window);
                result.set(i, j, window[rank]);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "MedianFilter(" + rows + "x" + columns + ", " + options + ")";
    }
}
