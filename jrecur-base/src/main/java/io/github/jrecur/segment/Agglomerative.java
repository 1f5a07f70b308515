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

import io.github.jrecur.exceptions.ParameterException;
import io.github.jrecur.graph.FeatureSequence;
import io.github.jrecur.matrix.SparseMatrix;
import org.agrona.collections.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bottom-up temporal segmentation: clusters frames under the constraint that only
 * neighboring frames may merge, so every cluster is a contiguous run of time.
 */
public final class Agglomerative {
    private static final Logger logger = LoggerFactory.getLogger(Agglomerative.class);

    private Agglomerative() {
    }

    /**
     * @param n the number of frames
     * @return a sparse n x n matrix linking each frame to itself and its immediate neighbors
     */
    public static SparseMatrix temporalConnectivity(int n) {
        var connectivity = new SparseMatrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = Math.max(0, i - 1); j <= Math.min(n - 1, i + 1); j++) {
                connectivity.set(i, j, 1.0);
            }
        }
        return connectivity;
    }

    /**
     * Partitions a feature sequence into {@code k} contiguous segments.
     *
     * @param features the sequence to segment
     * @param k the number of segments, in [1, n]
     * @param clusterer the clustering algorithm to run under the temporal constraint
     * @return the left boundary frame of each segment, starting with 0
     * @throws ParameterException if k is out of range
     */
    public static int[] segment(FeatureSequence features, int k, Clusterer clusterer) {
        int n = features.size();
        if (k < 1 || k > n) {
            throw new ParameterException("Invalid number of segments k=" + k + " for " + n + " frames");
        }

        int[] labels = clusterer.fit(features.toFrameArray(), k, temporalConnectivity(n));
        if (labels.length != n) {
            throw new IllegalStateException("clusterer returned " + labels.length + " labels for " + n + " frames");
        }

        var boundaries = new IntArrayList();
        boundaries.addInt(0);
        for (int i = 0; i + 1 < n; i++) {
            if (labels[i] != labels[i + 1]) {
                boundaries.addInt(i + 1);
            }
        }
        logger.debug("Segmented {} frames into {} runs for k={}", n, boundaries.size(), k);
        return boundaries.toIntArray();
    }
}
