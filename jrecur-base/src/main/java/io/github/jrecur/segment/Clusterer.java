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

package io.github.jrecur.segment;

import io.github.jrecur.matrix.Matrix;

/**
 * A connectivity-constrained clustering algorithm, e.g. Ward agglomerative clustering.
 * <p>
 * Implementations assign each point to one of {@code nClusters} clusters, merging only points
 * that are connected (directly or transitively) in the given graph.
 */
@FunctionalInterface
public interface Clusterer {
    /**
     * @param points one row per point
     * @param nClusters the number of clusters to produce, in [1, points.length]
     * @param connectivity a points.length x points.length adjacency matrix
     * @return a cluster label per point
     */
    int[] fit(double[][] points, int nClusters, Matrix connectivity);
}
