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

package io.github.jrecur.graph.knn;

import io.github.jrecur.graph.FeatureSequence;

/**
 * A nearest-neighbor index over the frames of a {@link FeatureSequence}.
 * <p>
 * The recurrence builder only needs the k-nearest-neighbor graph of the fitted points; how the
 * index finds it is up to the implementation. Results must be deterministic for a given index
 * and input, because the order of equally distant neighbors decides which edges survive
 * pruning.
 */
public interface KnnIndex {
    /**
     * Returns the number of indexed points.
     * @return the number of indexed points
     */
    int size();

    /**
     * Returns, for every indexed point, its {@code k} nearest other points, closest first.
     * A point is never its own neighbor.
     *
     * @param k the number of neighbors per point; at most {@code size() - 1}
     * @return neighbors[point][rank]
     */
    Neighbor[][] kNearest(int k);

    /**
     * Builds an index over a feature sequence.
     */
    @FunctionalInterface
    interface Factory {
        /**
         * Fits an index to the frames of a sequence.
         * @param points the frames to index
         * @param metric the distance to rank neighbors by
         * @return the fitted index
         */
        KnnIndex fit(FeatureSequence points, DistanceMetric metric);
    }
}
