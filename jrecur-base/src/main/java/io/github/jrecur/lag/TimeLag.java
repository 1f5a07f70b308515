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

package io.github.jrecur.lag;

import io.github.jrecur.exceptions.ParameterException;
import io.github.jrecur.graph.FeatureSequence;
import io.github.jrecur.matrix.Matrix;

/**
 * Conversion between time-time (recurrence) and time-lag coordinates.
 * <p>
 * In lag coordinates one axis keeps its meaning as time while the other measures the offset
 * between the two frames, so repetitions that run along diagonals of a recurrence matrix become
 * horizontal or vertical bands. With the time axis on columns (axis 1 or -1):
 * <pre>
 *     lag[r, j] = rec[(r + j) mod N, j]
 * </pre>
 * and with the time axis on rows (axis 0), {@code lag[i, c] = rec[i, (c + i) mod N]}.
 * <p>
 * When padded, the lag axis is first extended with n zeros ({@code N = 2n}), which makes the
 * transform injective and {@link #fromLag} its exact inverse. Without padding the lag matrix
 * stays n x n, which amounts to assuming the sequence repeats periodically; the round trip is
 * then only an identity for periodic structure.
 * <p>
 * Both directions preserve the storage format, and sparse inputs only move their stored
 * entries.
 */
public final class TimeLag {
    private TimeLag() {
    }

    /**
     * Converts a recurrence matrix into a padded lag matrix with time on the columns.
     * @param rec a square recurrence matrix
     * @return the lag matrix, 2n x n
     */
    public static Matrix toLag(Matrix rec) {
        return toLag(rec, true, -1);
    }

    /**
     * Converts a recurrence matrix into a lag matrix.
     *
     * @param rec a square recurrence matrix
     * @param pad if true, zero-pad the lag axis to 2n
     * @param axis the axis to keep as time: 0 for rows, 1 or -1 for columns
     * @return a new lag matrix in the format of {@code rec}: (lag x time) for axis 1,
     *         (time x lag) for axis 0
     * @throws ParameterException if rec is not square or the axis is invalid
     */
    public static Matrix toLag(Matrix rec, boolean pad, int axis) {
        int timeAxis = FeatureSequence.normalizeAxis(axis);
        if (!rec.isSquare()) {
            throw new ParameterException("non-square recurrence matrix shape: " + rec.rows() + "x" + rec.columns());
        }

        int n = rec.rows();
        int lagLength = pad ? 2 * n : n;
        Matrix lag = timeAxis == 1
                     ? Matrix.zeros(lagLength, n, rec.isSparse())
                     : Matrix.zeros(n, lagLength, rec.isSparse());

        if (timeAxis == 1) {
            // column j is rotated up by j
            rec.forEachEntry((r, j, v) -> lag.set(Math.floorMod(r - j, lagLength), j, v));
        } else {
            // row i is rotated left by i
            rec.forEachEntry((i, c, v) -> lag.set(i, Math.floorMod(c - i, lagLength), v));
        }
        return lag;
    }

    /**
     * Converts a lag matrix with time on the columns back into a recurrence matrix.
     * @param lag a lag matrix, as produced by {@link #toLag(Matrix)}
     * @return the recurrence matrix
     */
    public static Matrix fromLag(Matrix lag) {
        return fromLag(lag, -1);
    }

    /**
     * Converts a lag matrix back into a recurrence matrix.
     *
     * @param lag a lag matrix: square (unpadded), or with its lag axis exactly twice as long as
     *        its time axis (padded)
     * @param axis the time axis of {@code lag}: 0 for rows, 1 or -1 for columns
     * @return a new n x n recurrence matrix in the format of {@code lag}
     * @throws ParameterException if the axis is invalid or the shape fits neither form
     */
    public static Matrix fromLag(Matrix lag, int axis) {
        int timeAxis = FeatureSequence.normalizeAxis(axis);
        int n = timeAxis == 1 ? lag.columns() : lag.rows();
        int lagLength = timeAxis == 1 ? lag.rows() : lag.columns();
        if (!lag.isSquare() && lagLength != 2 * n) {
            throw new ParameterException("Invalid lag matrix shape: " + lag.rows() + "x" + lag.columns());
        }

        Matrix rec = Matrix.zeros(n, n, lag.isSparse());
        if (timeAxis == 1) {
            lag.forEachEntry((r, j, v) -> {
                int i = Math.floorMod(r + j, lagLength);
                if (i < n) {
                    rec.set(i, j, v);
                }
            });
        } else {
            lag.forEachEntry((i, c, v) -> {
                int j = Math.floorMod(c + i, lagLength);
                if (j < n) {
                    rec.set(i, j, v);
                }
            });
        }
        return rec;
    }
}
