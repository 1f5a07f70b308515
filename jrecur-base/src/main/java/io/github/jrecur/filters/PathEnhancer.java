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
import io.github.jrecur.util.MathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Multi-angle path enhancement for self- and cross-similarity matrices.
 * <p>
 * Convolves the input with several diagonal smoothing kernels, one per tempo ratio, and keeps
 * the elementwise maximum of the responses:
 * {@code out[i, j] = max over ratios of (R * kernel_ratio)[i, j]}. Each kernel models one tempo
 * hypothesis, so the best-fitting one dominates at each cell and repeated passages played at
 * a different speed still show up as continuous paths.
 * <p>
 * Ratios are spaced uniformly in log2 between {@code minRatio} and {@code maxRatio}, both
 * included. With the default {@code minRatio = 1 / maxRatio}, an odd filter count includes
 * ratio 1, the undistorted diagonal.
 * <p>
 * When the input comes from {@link io.github.jrecur.graph.RecurrenceGraphBuilder}, build it
 * with self-loops; an empty main diagonal leaves a gap that the smoothing spreads into its
 * neighborhood.
 */
public class PathEnhancer {
    private static final Logger logger = LoggerFactory.getLogger(PathEnhancer.class);

    private final WindowFunction window;
    private final double maxRatio;
    private final double minRatio;
    private final int filterCount;
    private final boolean zeroMean;
    private final boolean clip;
    private final ConvolveOptions options;
    private final Convolver convolver;

    private PathEnhancer(Builder builder, double minRatio) {
        this.window = builder.window;
        this.maxRatio = builder.maxRatio;
        this.minRatio = minRatio;
        this.filterCount = builder.filterCount;
        this.zeroMean = builder.zeroMean;
        this.clip = builder.clip;
        this.options = builder.options;
        this.convolver = builder.convolver;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the tempo ratios, one per filter.
     * @return the ratios, from minRatio to maxRatio
     */
    public double[] ratios() {
        return ratios(minRatio, maxRatio, filterCount);
    }

    /**
     * Returns {@code count} values spaced uniformly in log2 from min to max inclusive. A single
     * value is {@code min}.
     */
    static double[] ratios(double min, double max, int count) {
        var ratios = new double[count];
        double logMin = MathUtil.log2(min);
        double logMax = MathUtil.log2(max);
        for (int i = 0; i < count; i++) {
            ratios[i] = count == 1 ? min : Math.pow(2, logMin + i * (logMax - logMin) / (count - 1));
        }
        ratios[0] = min;
        if (count > 1) {
            ratios[count - 1] = max;
        }
        return ratios;
    }

    /**
     * Smooths a similarity matrix.
     *
     * @param similarity the self- or cross-similarity matrix; must be dense
     * @param n the length of the smoothing kernels
     * @return a new dense matrix of the input's shape
     * @throws ParameterException if the input is sparse or n is less than 1
     */
    public DenseMatrix enhance(Matrix similarity, int n) {
        if (similarity.isSparse()) {
            throw new ParameterException("sparse input is not supported by path enhancement; convert it with toDense()");
        }
        if (n < 1) {
            throw new ParameterException("filter length n=" + n + " must be at least 1");
        }

        double[] ratios = ratios();
        logger.debug("Enhancing {}x{} matrix with {} {} filters of length {} at ratios {}",
                     similarity.rows(), similarity.columns(), ratios.length, window, n, Arrays.toString(ratios));

        DenseMatrix smooth = null;
        for (double ratio : ratios) {
            double[][] kernel = DiagonalKernel.generate(window, n, ratio, zeroMean);
            DenseMatrix response = convolver.convolve(similarity, kernel, options);
            if (smooth == null) {
                smooth = response;
            } else {
                smooth.maxInPlace(response);
            }
        }

        if (clip) {
            smooth.clipNegative();
        }
        return smooth;
    }

    @Override
    public String toString() {
        return String.format("PathEnhancer(window=%s, ratios=[%s, %s] x %d, zeroMean=%s, clip=%s, %s)",
                             window, minRatio, maxRatio, filterCount, zeroMean, clip, options);
    }

    /**
     * Builder for PathEnhancer. Defaults: Hann window, maxRatio 2, minRatio 1/maxRatio, 7
     * filters, averaging (not zero-mean) kernels, clipping on, reflecting boundaries and the
     * {@link DirectConvolver}.
     */
    public static class Builder {
        private WindowFunction window = WindowFunction.HANN;
        private double maxRatio = 2.0;
        private Double minRatio;
        private int filterCount = 7;
        private boolean zeroMean;
        private boolean clip = true;
        private ConvolveOptions options = ConvolveOptions.DEFAULT;
        private Convolver convolver = new DirectConvolver();

        private Builder() {
        }

        public Builder withWindow(WindowFunction window) {
            this.window = Objects.requireNonNull(window, "window");
            return this;
        }

        /**
         * The largest tempo ratio to support, strictly positive.
         */
        public Builder withMaxRatio(double maxRatio) {
            this.maxRatio = maxRatio;
            return this;
        }

        /**
         * The smallest tempo ratio to support; null means {@code 1 / maxRatio}.
         */
        public Builder withMinRatio(Double minRatio) {
            this.minRatio = minRatio;
            return this;
        }

        public Builder withFilterCount(int filterCount) {
            this.filterCount = filterCount;
            return this;
        }

        /**
         * Zero-mean kernels suppress uniform blocks while enhancing diagonals.
         */
        public Builder withZeroMean(boolean zeroMean) {
            this.zeroMean = zeroMean;
            return this;
        }

        /**
         * If true, negative values of the result are raised to 0.
         */
        public Builder withClip(boolean clip) {
            this.clip = clip;
            return this;
        }

        public Builder withOptions(ConvolveOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder withConvolver(Convolver convolver) {
            this.convolver = Objects.requireNonNull(convolver, "convolver");
            return this;
        }

        /**
         * @throws ParameterException if a ratio is not strictly positive, minRatio exceeds
         *         maxRatio, or the filter count is less than 1
         */
        public PathEnhancer build() {
            if (!(maxRatio > 0) || Double.isInfinite(maxRatio)) {
                throw new ParameterException("max_ratio=" + maxRatio + " must be strictly positive and finite");
            }
            double min;
            if (minRatio == null) {
                min = 1.0 / maxRatio;
            } else if (minRatio > maxRatio) {
                throw new ParameterException("min_ratio=" + minRatio + " cannot exceed max_ratio=" + maxRatio);
            } else if (!(minRatio > 0)) {
                throw new ParameterException("min_ratio=" + minRatio + " must be strictly positive");
            } else {
                min = minRatio;
            }
            if (filterCount < 1) {
                throw new ParameterException("n_filters=" + filterCount + " must be at least 1");
            }
            return new PathEnhancer(this, min);
        }
    }
}
