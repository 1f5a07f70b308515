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
 * A two-dimensional convolution primitive.
 */
@FunctionalInterface
public interface Convolver {
    /**
     * Convolves a matrix with a kernel. The output has the shape of the input; the kernel is
     * centered at {@code (rows / 2, columns / 2)}.
     *
     * @param input the matrix to filter
     * @param kernel the convolution weights, kernel[row][column]
     * @param options boundary handling
     * @return a new dense matrix
     */
    DenseMatrix convolve(Matrix input, double[][] kernel, ConvolveOptions options);
}
