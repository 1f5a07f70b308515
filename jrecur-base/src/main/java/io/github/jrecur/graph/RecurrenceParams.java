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
import io.github.jrecur.graph.knn.DistanceMetric;

import java.util.Objects;

/**
 * Immutable parameters for {@link RecurrenceGraphBuilder}. Use {@link #builder()}; every
 * setting has a default.
 */
public final class RecurrenceParams {
    private final Integer k;
    private final int width;
    private final DistanceMetric metric;
    private final boolean symmetric;
    private final boolean sparse;
    private final SimilarityMode mode;
    private final Double bandwidth;
    private final boolean selfLoops;

    private RecurrenceParams(Builder builder) {
        this.k = builder.k;
        this.width = builder.width;
        this.metric = builder.metric;
        this.symmetric = builder.symmetric;
        this.sparse = builder.sparse;
        this.mode = builder.mode;
        this.bandwidth = builder.bandwidth;
        this.selfLoops = builder.selfLoops;
    }

    /**
     * Returns the parameters with every default: automatic k, width 1, Euclidean distance,
     * asymmetric, dense connectivity output, no self-loops.
     * @return the default parameters
     */
    public static RecurrenceParams defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the neighbor count, or null to derive it from the sequence length */
    public Integer k() {
        return k;
    }

    /** @return the minimum index separation of linked frames */
    public int width() {
        return width;
    }

    /** @return the distance used to find neighbors */
    public DistanceMetric metric() {
        return metric;
    }

    /** @return true if only mutual neighbors are linked */
    public boolean symmetric() {
        return symmetric;
    }

    /** @return true if the result uses sparse storage */
    public boolean sparse() {
        return sparse;
    }

    /** @return the kind of values produced */
    public SimilarityMode mode() {
        return mode;
    }

    /** @return the affinity bandwidth, or null to estimate it */
    public Double bandwidth() {
        return bandwidth;
    }

    /** @return true if the main diagonal is populated */
    public boolean selfLoops() {
        return selfLoops;
    }

    @Override
    public String toString() {
        return String.format("RecurrenceParams(k=%s, width=%d, metric=%s, symmetric=%s, sparse=%s, mode=%s, bandwidth=%s, self=%s)",
                             k == null ? "auto" : k, width, metric, symmetric, sparse, mode,
                             bandwidth == null ? "auto" : bandwidth, selfLoops);
    }

    /**
     * Builder for RecurrenceParams.
     */
    public static class Builder {
        private Integer k;
        private int width = 1;
        private DistanceMetric metric = DistanceMetric.EUCLIDEAN;
        private boolean symmetric;
        private boolean sparse;
        private SimilarityMode mode = SimilarityMode.CONNECTIVITY;
        private Double bandwidth;
        private boolean selfLoops;

        private Builder() {
        }

        /**
         * Sets the number of neighbors kept per frame. When unset it defaults to
         * {@code 2 * ceil(sqrt(n - 2 * width + 1))}, or 2 for short sequences.
         */
        public Builder withK(Integer k) {
            this.k = k;
            return this;
        }

        /**
         * Only frames at least this far apart are linked. Must be in {@code [1, n]}.
         */
        public Builder withWidth(int width) {
            this.width = width;
            return this;
        }

        public Builder withMetric(DistanceMetric metric) {
            this.metric = Objects.requireNonNull(metric, "metric");
            return this;
        }

        /**
         * Sets the metric by name, e.g. "cosine".
         */
        public Builder withMetric(String metric) {
            return withMetric(DistanceMetric.forName(metric));
        }

        public Builder withSymmetric(boolean symmetric) {
            this.symmetric = symmetric;
            return this;
        }

        public Builder withSparse(boolean sparse) {
            this.sparse = sparse;
            return this;
        }

        public Builder withMode(SimilarityMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        /**
         * Sets the mode by name: "connectivity", "distance" or "affinity".
         */
        public Builder withMode(String mode) {
            return withMode(SimilarityMode.forName(mode));
        }

        /**
         * Sets the affinity bandwidth. When unset it is estimated as the median, over frames, of
         * the distance to the furthest retained neighbor.
         */
        public Builder withBandwidth(Double bandwidth) {
            this.bandwidth = bandwidth;
            return this;
        }

        /**
         * Populates the main diagonal with self-links: 1 in connectivity and affinity modes.
         * Distance matrices keep an empty diagonal, i.e. a self-distance of 0.
         */
        public Builder withSelfLoops(boolean selfLoops) {
            this.selfLoops = selfLoops;
            return this;
        }

        /**
         * @throws ParameterException if width, k or bandwidth is out of range
         */
        public RecurrenceParams build() {
            if (width < 1) {
                throw new ParameterException("width=" + width + " must be at least 1");
            }
            if (k != null && k < 1) {
                throw new ParameterException("k=" + k + " must be at least 1");
            }
            if (bandwidth != null && !(bandwidth > 0)) {
                throw new ParameterException("Invalid bandwidth=" + bandwidth + ". Must be strictly positive.");
            }
            return new RecurrenceParams(this);
        }
    }
}
