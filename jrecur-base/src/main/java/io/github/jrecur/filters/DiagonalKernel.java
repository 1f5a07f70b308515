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
import io.github.jrecur.util.MathUtil;

/**
 * Generates diagonal smoothing kernels: square matrices whose mass follows a window function
 * along a line through the center.
 * <p>
 * The slope is the ratio of vertical (row) to horizontal (column) step along the line; a slope
 * of 1 is the main diagonal and gives exactly {@code diag(window)}. Other slopes rotate the
 * line about the kernel center, keeping its length, and spread each window sample bilinearly
 * over the four surrounding cells. The kernel grows as needed to hold the rotated line.
 * <p>
 * Kernels are normalized to sum to 1. Zero-mean kernels then have their mean subtracted from
 * every cell, so they sum to 0 and respond negatively to uniform blocks.
 */
public final class DiagonalKernel {
    private static final double SQRT2 = Math.sqrt(2.0);

    private DiagonalKernel() {
    }

    /**
     * Generates a kernel from a named window.
     *
     * @param window the window shape
     * @param n the number of window samples along the line
     * @param slope the ratio of vertical to horizontal step, strictly positive
     * @param zeroMean if true, the kernel sums to 0 instead of 1
     * @return kernel[row][column]
     * @throws ParameterException if n or slope is out of range
     */
    public static double[][] generate(WindowFunction window, int n, double slope, boolean zeroMean) {
        return generate(window.generate(n), slope, zeroMean);
    }

    /**
     * Generates a kernel from explicit window samples.
     *
     * @param window the window samples along the line
     * @param slope the ratio of vertical to horizontal step, strictly positive
     * @param zeroMean if true, the kernel sums to 0 instead of 1
     * @return kernel[row][column]
     * @throws ParameterException if the window is empty or has no positive mass, or the slope
     *         is not a positive finite number
     */
    public static double[][] generate(double[] window, double slope, boolean zeroMean) {
        if (window.length == 0) {
            throw new ParameterException("window must have at least one sample");
        }
        if (!(slope > 0) || Double.isInfinite(slope)) {
            throw new ParameterException("slope=" + slope + " must be strictly positive and finite");
        }

        double angle = Math.atan(slope);
        double[][] kernel = isDiagonal(angle) ? diagonal(window) : rotated(window, angle);

        double sum = 0;
        for (double[] row : kernel) {
            for (int j = 0; j < row.length; j++) {
                if (row[j] < 0) {
                    row[j] = 0;
                }
                sum += row[j];
            }
        }
        if (!(sum > 0)) {
            throw new ParameterException("window of length " + window.length + " has no positive mass");
        }

        int m = kernel.length;
        double mean = 1.0 / ((double) m * m);
        for (double[] row : kernel) {
            for (int j = 0; j < m; j++) {
                row[j] /= sum;
                if (zeroMean) {
                    row[j] -= mean;
                }
            }
        }
        return kernel;
    }

    // same tolerance as the usual isclose(angle, pi / 4)
    private static boolean isDiagonal(double angle) {
        return MathUtil.isClose(angle, Math.PI / 4, 1e-5, 1e-8);
    }

    private static double[][] diagonal(double[] window) {
        int n = window.length;
        var kernel = new double[n][n];
        for (int k = 0; k < n; k++) {
            kernel[k][k] = window[k];
        }
        return kernel;
    }

    private static double[][] rotated(double[] window, double angle) {
        int n = window.length;
        double sin = Math.sin(angle);
        double cos = Math.cos(angle);

        var rowOffsets = new double[n];
        var colOffsets = new double[n];
        double extent = 0;
        for (int k = 0; k < n; k++) {
            // arc position along the line; the unrotated diagonal has step sqrt(2)
            double s = (k - (n - 1) / 2.0) * SQRT2;
            rowOffsets[k] = s * sin;
            colOffsets[k] = s * cos;
            extent = Math.max(extent, Math.max(Math.abs(rowOffsets[k]), Math.abs(colOffsets[k])));
        }

        int half = (int) Math.ceil(extent - 1e-9);
        int m = 2 * half + 1;
        var kernel = new double[m][m];
        for (int k = 0; k < n; k++) {
            double r = half + rowOffsets[k];
            double c = half + colOffsets[k];
            int r0 = (int) Math.floor(r);
            int c0 = (int) Math.floor(c);
            double fr = r - r0;
            double fc = c - c0;
            splat(kernel, r0, c0, window[k] * (1 - fr) * (1 - fc));
            splat(kernel, r0 + 1, c0, window[k] * fr * (1 - fc));
            splat(kernel, r0, c0 + 1, window[k] * (1 - fr) * fc);
            splat(kernel, r0 + 1, c0 + 1, window[k] * fr * fc);
        }
        return kernel;
    }

    private static void splat(double[][] kernel, int r, int c, double weight) {
        if (r >= 0 && r < kernel.length && c >= 0 && c < kernel.length) {
            kernel[r][c] += weight;
        }
    }
}
