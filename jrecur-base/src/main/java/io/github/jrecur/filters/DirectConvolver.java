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

import io.github.jrecur.matrix.DenseMatrix;
import io.github.jrecur.matrix.Matrix;

/**
 * Direct (non-FFT) convolution:
 * {@code out[i, j] = sum over (a, b) of kernel[a][b] * in[i + h/2 - a, j + w/2 - b]}
 * where h x w is the kernel shape and out-of-range reads follow the boundary mode.
 * Zero kernel weights are skipped, which keeps thin diagonal kernels cheap.
 */
public class DirectConvolver implements Convolver {
    @Override
    public DenseMatrix convolve(Matrix input, double[][] kernel, ConvolveOptions options) {
        if (kernel.length == 0 || kernel[0].length == 0) {
            throw new IllegalArgumentException("kernel must not be empty");
        }
        int rows = input.rows();
        int columns = input.columns();
        var result = new DenseMatrix(rows, columns);
        if (rows == 0 || columns == 0) {
            return result;
        }

        double[][] data = input instanceof DenseMatrix ? ((DenseMatrix) input).toArray() : input.toDense().toArray();
        int kh = kernel.length;
        int kw = kernel[0].length;
        int ch = kh / 2;
        int cw = kw / 2;
        for (int a = 0; a < kh; a++) {
            for (int b = 0; b < kw; b++) {
                double weight = kernel[a][b];
                if (weight == 0) {
                    continue;
                }
                int di = ch - a;
                int dj = cw - b;
                for (int i = 0; i < rows; i++) {
                    for (int j = 0; j < columns; j++) {
                        result.addTo(i, j, weight * options.read(data, i + di, j + dj));
                    }
                }
            }
        }
        return result;
    }
}
