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

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Exact k-nearest-neighbor search by scanning every pair of frames.
 * <p>
 * Neighbors are ordered by distance, then by frame index, so results are reproducible.
 * Rows are scored on the common fork-join pool when the {@code jrecur.knn.parallel} system
 * property is true; each row is independent, so the result does not depend on the setting.
 */
public class BruteForceKnnIndex implements KnnIndex {
    /**
     * Whether rows are scored in parallel, configurable via the jrecur.knn.parallel system property
     */
    private static final boolean parallel = Boolean.getBoolean("jrecur.knn.parallel");

    private final double[][] points;
    private final DistanceMetric metric;

    /**
     * Creates an index over the frames of a sequence.
     * @param points the frames to index
     * @param metric the distance to rank neighbors by
     */
    public BruteForceKnnIndex(FeatureSequence points, DistanceMetric metric) {
        this.points = points.toFrameArray();
        this.metric = metric;
    }

    @Override
    public int size() {
        return points.length;
    }

    @Override
    public Neighbor[][] kNearest(int k) {
        if (k < 0 || k > Math.max(0, points.length - 1)) {
            throw new IllegalArgumentException("k=" + k + " must be in [0, " + Math.max(0, points.length - 1) + "]");
        }
        var result = new Neighbor[points.length][];
        IntStream rows = IntStream.range(0, points.length);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(i -> result[i] = nearestTo(i, k));
        return result;
    }

    private Neighbor[] nearestTo(int i, int k) {
        var candidates = new Neighbor[points.length - 1];
        int c = 0;
        for (int j = 0; j < points.length; j++) {
            if (j != i) {
                candidates[c++] = new Neighbor(j, metric.distance(points[i], points[j]));
            }
        }
        Arrays.sort(candidates);
        return Arrays.copyOf(candidates, k);
    }

    /**
     * Returns true if rows are scored in parallel.
     * @return the value of the jrecur.knn.parallel property at class initialization
     */
    public static boolean isParallel() {
        return parallel;
    }
}
