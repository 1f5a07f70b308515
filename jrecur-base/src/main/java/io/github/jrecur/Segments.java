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

package io.github.jrecur;

import io.github.jrecur.exceptions.ParameterException;
import io.github.jrecur.filters.ConvolveOptions;
import io.github.jrecur.filters.PathEnhancer;
import io.github.jrecur.filters.WindowFunction;
import io.github.jrecur.graph.FeatureSequence;
import io.github.jrecur.graph.RecurrenceGraphBuilder;
import io.github.jrecur.graph.RecurrenceParams;
import io.github.jrecur.graph.SimilarityMatrix;
import io.github.jrecur.lag.MatrixFilter;
import io.github.jrecur.lag.TimeLag;
import io.github.jrecur.lag.TimeLagFilter;
import io.github.jrecur.matrix.DenseMatrix;
import io.github.jrecur.matrix.Matrix;
import io.github.jrecur.segment.Agglomerative;
import io.github.jrecur.segment.Clusterer;
import io.github.jrecur.segment.Subsegment;

/**
 * Static entry points for recurrence analysis and temporal segmentation.
 * <p>
 * Each method validates its arguments up front, throwing {@link ParameterException} before
 * doing any work, and returns a freshly allocated result. For repeated use with the same
 * settings, or to plug in a different k-NN index or convolution, use the component classes
 * directly: {@link RecurrenceGraphBuilder}, {@link TimeLag}, {@link TimeLagFilter},
 * {@link PathEnhancer}, {@link Agglomerative} and {@link Subsegment}.
 */
public final class Segments {
    private static final RecurrenceGraphBuilder builder = new RecurrenceGraphBuilder();

    private Segments() {
    }

    /**
     * Builds a recurrence (self-similarity) matrix.
     *
     * @param data the feature array
     * @param k neighbors per frame, or null for {@link RecurrenceGraphBuilder#defaultK}
     * @param width the exclusion band; frames closer than this are never linked
     * @param metric distance metric name, e.g. "euclidean" or "cosine"
     * @param symmetric keep only mutual neighbors
     * @param sparse return sparse storage
     * @param mode "connectivity", "distance" or "affinity"
     * @param bandwidth the affinity bandwidth, or null to estimate it
     * @param selfLoops link each frame to itself
     * @param axis the time axis of {@code data}: 0 for rows, 1 or -1 for columns
     * @return the n x n recurrence matrix
     */
    public static SimilarityMatrix buildRecurrenceMatrix(double[][] data, Integer k, int width, String metric,
                                                         boolean symmetric, boolean sparse, String mode,
                                                         Double bandwidth, boolean selfLoops, int axis) {
        var params = RecurrenceParams.builder()
                .withK(k)
                .withWidth(width)
                .withMetric(metric)
                .withSymmetric(symmetric)
                .withSparse(sparse)
                .withMode(mode)
                .withBandwidth(bandwidth)
                .withSelfLoops(selfLoops)
                .build();
        return builder.build(FeatureSequence.of(data, axis), params);
    }

    /**
     * Builds a recurrence matrix from a prepared feature sequence.
     * @param features the frames
     * @param params graph parameters
     * @return the recurrence matrix
     */
    public static SimilarityMatrix buildRecurrenceMatrix(FeatureSequence features, RecurrenceParams params) {
        return builder.build(features, params);
    }

    /**
     * @see TimeLag#toLag(Matrix, boolean, int)
     */
    public static Matrix toLag(Matrix rec, boolean pad, int axis) {
        return TimeLag.toLag(rec, pad, axis);
    }

    /**
     * @see TimeLag#fromLag(Matrix, int)
     */
    public static Matrix fromLag(Matrix lag, int axis) {
        return TimeLag.fromLag(lag, axis);
    }

    /**
     * @see TimeLagFilter#wrap(MatrixFilter, boolean, int)
     */
    public static MatrixFilter wrapAsLagFilter(MatrixFilter filter, boolean pad, int index) {
        return TimeLagFilter.wrap(filter, pad, index);
    }

    /**
     * Smooths a similarity matrix along diagonals at several tempo ratios.
     *
     * @param similarity a dense similarity or cross-similarity matrix
     * @param n the length of each smoothing filter
     * @param window the window shaping each filter
     * @param maxRatio the largest slope ratio
     * @param minRatio the smallest slope ratio, or null for {@code 1 / maxRatio}
     * @param nFilters the number of ratios to try
     * @param zeroMean make each filter sum to zero
     * @param clip clamp negative output to 0
     * @param options boundary handling for the convolution
     * @return the enhanced matrix
     * @see PathEnhancer
     */
    public static DenseMatrix enhancePaths(Matrix similarity, int n, WindowFunction window, double maxRatio,
                                           Double minRatio, int nFilters, boolean zeroMean, boolean clip,
                                           ConvolveOptions options) {
        var enhancer = PathEnhancer.builder()
                .withWindow(window)
                .withMaxRatio(maxRatio)
                .withMinRatio(minRatio)
                .withFilterCount(nFilters)
                .withZeroMean(zeroMean)
                .withClip(clip)
                .withOptions(options)
                .build();
        return enhancer.enhance(similarity, n);
    }

    /**
     * @see Agglomerative#segment(FeatureSequence, int, Clusterer)
     */
    public static int[] agglomerative(FeatureSequence features, int k, Clusterer clusterer) {
        return Agglomerative.segment(features, k, clusterer);
    }

    /**
     * @see Subsegment#subdivide(FeatureSequence, int[], int, Clusterer)
     */
    public static int[] subsegment(FeatureSequence features, int[] frames, int nSegments, Clusterer clusterer) {
        return Subsegment.subdivide(features, frames, nSegments, clusterer);
    }
}
