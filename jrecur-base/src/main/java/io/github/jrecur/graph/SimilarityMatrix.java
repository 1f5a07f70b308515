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

package io.github.jrecur.graph;

import io.github.jrecur.matrix.DenseMatrix;
import io.github.jrecur.matrix.Matrix;
import io.github.jrecur.matrix.SparseMatrix;

/**
 * A square recurrence matrix tagged with the {@link SimilarityMode} of its values.
 * <p>
 * Reads and structural operations delegate to the backing {@link Matrix}, so a
 * SimilarityMatrix can be handed directly to the lag transforms and filters. Results of
 * those operations are plain matrices: they no longer carry recurrence semantics.
 */
public final class SimilarityMatrix implements Matrix {
    private final Matrix values;
    private final SimilarityMode mode;
    private final double bandwidth;

    /**
     * Wraps a square matrix.
     * @param values the recurrence values; ownership passes to this object
     * @param mode the kind of values held
     * @param bandwidth the affinity bandwidth used, or NaN for other modes
     * @throws IllegalArgumentException if the matrix is not square
     */
    public SimilarityMatrix(Matrix values, SimilarityMode mode, double bandwidth) {
        if (!values.isSquare()) {
            throw new IllegalArgumentException("recurrence matrix must be square, got " + values.rows() + "x" + values.columns());
        }
        this.values = values;
        this.mode = mode;
        this.bandwidth = bandwidth;
    }

    /**
     * Returns the number of frames, i.e. the side of the matrix.
     * @return the number of frames
     */
    public int size() {
        return values.rows();
    }

    /**
     * Returns the kind of values held.
     * @return the similarity mode
     */
    public SimilarityMode mode() {
        return mode;
    }

    /**
     * Returns the bandwidth used to map distances to affinities. For affinity matrices built
     * without any edge this is NaN, and so are the diagonal affinities.
     * @return the bandwidth, or NaN for connectivity and distance matrices
     */
    public double bandwidth() {
        return bandwidth;
    }

    /**
     * Returns true if frames i and j are linked.
     * @param i the first frame
     * @param j the second frame
     * @return true if the cell is nonzero
     */
    public boolean isLinked(int i, int j) {
        return values.get(i, j) != 0;
    }

    /**
     * Returns the backing matrix.
     * @return the live backing matrix
     */
    public Matrix matrix() {
        return values;
    }

    @Override
    public int rows() {
        return values.rows();
    }

    @Override
    public int columns() {
        return values.columns();
    }

    @Override
    public double get(int i, int j) {
        return values.get(i, j);
    }

    @Override
    public void set(int i, int j, double value) {
        values.set(i, j, value);
    }

    @Override
    public boolean isSparse() {
        return values.isSparse();
    }

    @Override
    public void forEachEntry(EntryConsumer consumer) {
        values.forEachEntry(consumer);
    }

    @Override
    public void eliminateZeros() {
        values.eliminateZeros();
    }

    @Override
    public Matrix transpose() {
        return values.transpose();
    }

    @Override
    public Matrix minimum(Matrix other) {
        return values.minimum(other);
    }

    @Override
    public SimilarityMatrix copy() {
        return new SimilarityMatrix(values.copy(), mode, bandwidth);
    }

    @Override
    public DenseMatrix toDense() {
        return values.toDense();
    }

    @Override
    public SparseMatrix toSparse() {
        return values.toSparse();
    }

    @Override
    public String toString() {
        return String.format("SimilarityMatrix(%s, %dx%d, %s)%n%s", mode, size(), size(),
                             values.isSparse() ? "sparse" : "dense", values);
    }
}
