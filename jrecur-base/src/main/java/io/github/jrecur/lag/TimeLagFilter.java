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
 * Runs an ordinary image filter in time-lag space.
 * <p>
 * {@code TimeLagFilter.wrap(f, pad, index)} returns a filter equivalent to
 * <pre>{@code
 * args[index] = TimeLag.toLag(args[index], pad, axis);
 * Matrix filtered = f.apply(args);
 * return TimeLag.fromLag(filtered, axis);
 * }</pre>
 * so a rectangular filter, e.g. a {@code 1 x 3} median, smooths along the diagonals of a
 * recurrence matrix.
 */
public final class TimeLagFilter {
    private TimeLagFilter() {
    }

    /**
     * Wraps a filter with time on the columns.
     *
     * @param filter the filter to run in lag space
     * @param pad whether to zero-pad the lag axis
     * @param index the position of the matrix among the filter's arguments
     * @return the wrapped filter
     */
    public static MatrixFilter wrap(MatrixFilter filter, boolean pad, int index) {
        return wrap(filter, pad, index, -1);
    }

    /**
     * Wraps a filter.
     *
     * @param filter the filter to run in lag space
     * @param pad whether to zero-pad the lag axis
     * @param index the position of the matrix among the filter's arguments
     * @param axis the time axis: 0 for rows, 1 or -1 for columns
     * @return the wrapped filter; it throws {@link ParameterException} when called without a
     *         matrix at {@code index}
     * @throws ParameterException if index is negative or the axis is invalid
     */
    public static MatrixFilter wrap(MatrixFilter filter, boolean pad, int index, int axis) {
        if (index < 0) {
            throw new ParameterException("argument index=" + index + " must be non-negative");
        }
        FeatureSequence.normalizeAxis(axis);
        return args -> {
            if (index >= args.length || !(args[index] instanceof Matrix)) {
                throw new ParameterException("argument " + index + " of " + args.length + " is not a matrix");
            }
            Object[] lagArgs = args.clone();
            lagArgs[index] = TimeLag.toLag((Matrix) args[index], pad, axis);
            return TimeLag.fromLag(filter.apply(lagArgs), axis);
        };
    }
}
