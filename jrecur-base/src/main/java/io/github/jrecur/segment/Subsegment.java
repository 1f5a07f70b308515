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
import org.agrona.collections.IntArrayList;

/**
 * Refines an existing segmentation by running {@link Agglomerative} inside each segment.
 */
public final class Subsegment {
    private Subsegment() {
    }

    /**
     * Sub-divides each interval between consecutive boundary frames into at most
     * {@code nSegments} pieces.
     *
     * @param features the full feature sequence
     * @param frames coarse boundary frames; 0 and n are added, and values beyond n are clipped
     * @param nSegments the maximum number of sub-segments per interval
     * @param clusterer the clustering algorithm
     * @return the left boundaries of all sub-segments, in increasing order
     * @throws ParameterException if nSegments is less than 1 or a frame is negative
     */
    public static int[] subdivide(FeatureSequence features, int[] frames, int nSegments, Clusterer clusterer) {
        if (nSegments < 1) {
            throw new ParameterException("n_segments must be a positive integer, got " + nSegments);
        }

        int[] fixed = Frames.fix(frames, 0, features.size(), true);
        var boundaries = new IntArrayList();
        for (int s = 0; s + 1 < fixed.length; s++) {
            int start = fixed[s];
            int end = fixed[s + 1];
            int[] local = Agglomerative.segment(features.slice(start, end), Math.min(end - start, nSegments), clusterer);
            for (int b : local) {
                boundaries.addInt(start + b);
            }
        }
        return boundaries.toIntArray();
    }
}
