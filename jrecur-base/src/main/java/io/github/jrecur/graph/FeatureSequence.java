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

import io.github.jrecur.exceptions.ParameterException;

/**
 * An immutable, ordered sequence of feature vectors (frames).
 * <p>
 * Built from a 2D array and an axis: with axis {@code 0} row {@code i} of the array is frame
 * {@code i}; with axis {@code 1} or {@code -1} column {@code i} is frame {@code i}, which is the
 * usual layout of a (features x time) matrix.
 */
public final class FeatureSequence {
    private final double[][] frames;
    private final int dimension;

    private FeatureSequence(double[][] frames, int dimension) {
        this.frames = frames;
        this.dimension = dimension;
    }

    /**
     * Creates a sequence whose frames are the columns of {@code data}.
     * @param data a (features x time) array
     * @return the sequence
     */
    public static FeatureSequence of(double[][] data) {
        return of(data, -1);
    }

    /**
     * Creates a sequence from {@code data}, reading frames along the given axis.
     * @param data the feature array; copied
     * @param axis {@code 0} if rows are frames, {@code 1} or {@code -1} if columns are frames
     * @return the sequence
     * @throws ParameterException if the axis is invalid or the array is ragged
     */
    public static FeatureSequence of(double[][] data, int axis) {
        int normalized = normalizeAxis(axis);
        int rows = data.length;
        int columns = rows == 0 ? 0 : data[0].length;
        for (int i = 0; i < rows; i++) {
            if (data[i].length != columns) {
                throw new ParameterException("ragged feature array: row " + i + " has length " + data[i].length
                                             + ", expected " + columns);
            }
        }

        if (normalized == 0) {
            var frames = new double[rows][];
            for (int i = 0; i < rows; i++) {
                frames[i] = data[i].clone();
            }
            return new FeatureSequence(frames, columns);
        }

        var frames = new double[columns][rows];
        for (int i = 0; i < rows; i++) {
            for (int t = 0; t < columns; t++) {
                frames[t][i] = data[i][t];
            }
        }
        return new FeatureSequence(frames, rows);
    }

    /**
     * Maps an axis argument onto {@code 0} or {@code 1}.
     * @param axis {@code 0}, {@code 1} or {@code -1}
     * @return the normalized axis
     * @throws ParameterException for any other value
     */
    public static int normalizeAxis(int axis) {
        if (axis != 0 && axis != 1 && axis != -1) {
            throw new ParameterException("Invalid target axis: " + axis);
        }
        return Math.abs(axis);
    }

    /**
     * Returns the number of frames.
     * @return the sequence length
     */
    public int size() {
        return frames.length;
    }

    /**
     * Returns the number of features per frame.
     * @return the frame dimension
     */
    public int dimension() {
        return dimension;
    }

    /**
     * Returns a copy of frame t.
     * @param t the frame index
     * @return the feature values of frame t
     */
    public double[] frame(int t) {
        return frames[t].clone();
    }

    /**
     * Returns feature i of frame t.
     * @param t the frame index
     * @param i the feature index
     * @return the feature value
     */
    public double get(int t, int i) {
        return frames[t][i];
    }

    /**
     * Returns a copy of all frames, one row per frame.
     * @return frames[time][feature]
     */
    public double[][] toFrameArray() {
        var copy = new double[frames.length][];
        for (int t = 0; t < frames.length; t++) {
            copy[t] = frames[t].clone();
        }
        return copy;
    }

    /**
     * Returns the frames in {@code [start, end)} as a new sequence.
     * @param start the first frame, inclusive
     * @param end the last frame, exclusive
     * @return the subsequence
     * @throws ParameterException if the range is empty or out of bounds
     */
    public FeatureSequence slice(int start, int end) {
        if (start < 0 || end > frames.length || start >= end) {
            throw new ParameterException("invalid frame range [" + start + ", " + end + ") for sequence of length " + frames.length);
        }
        var sliced = new double[end - start][];
        for (int t = start; t < end; t++) {
            sliced[t - start] = frames[t].clone();
        }
        return new FeatureSequence(sliced, dimension);
    }

    @Override
    public String toString() {
        return String.format("FeatureSequence(%d frames x %d features)", frames.length, dimension);
    }
}
