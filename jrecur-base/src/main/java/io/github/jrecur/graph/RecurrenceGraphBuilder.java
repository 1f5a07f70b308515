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
import io.github.jrecur.graph.knn.BruteForceKnnIndex;
import io.github.jrecur.graph.knn.KnnIndex;
import io.github.jrecur.graph.knn.Neighbor;
import io.github.jrecur.matrix.Matrix;
import io.github.jrecur.matrix.SparseMatrix;
import io.github.jrecur.matrix.SparseRow;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;

/**
 * Builds recurrence matrices from the k-nearest-neighbor graph of a feature sequence.
 * <p>
 * {@code rec[i, j]} is nonzero if frames i and j are among each other's nearest neighbors and
 * {@code |i - j| >= width}. Construction proceeds as follows:
 * <ol>
 *   <li>query {@code min(n - 1, k + 2 * width)} neighbors per frame, leaving slack for the
 *       exclusion band;</li>
 *   <li>drop neighbors inside the band and keep the {@code k} closest of the rest, in the order
 *       the index ranks equally distant neighbors. Connectivity pruning also ranks by the
 *       underlying distance. Outside connectivity mode, neighbors at distance zero are skipped
 *       since they cannot be stored as links;</li>
 *   <li>add self-links if requested;</li>
 *   <li>if symmetric, take the elementwise minimum with the transpose so only mutual links
 *       survive;</li>
 *   <li>drop zero-valued links and map the remaining distances to the requested mode.</li>
 * </ol>
 * Builders are stateless apart from the index factory and may be shared between threads.
 */
public class RecurrenceGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(RecurrenceGraphBuilder.class);

    private final KnnIndex.Factory indexFactory;

    /**
     * Creates a builder backed by exact brute-force neighbor search.
     */
    public RecurrenceGraphBuilder() {
        this(BruteForceKnnIndex::new);
    }

    /**
     * Creates a builder backed by the given neighbor index.
     * @param indexFactory fits a k-NN index to the frames being linked
     */
    public RecurrenceGraphBuilder(KnnIndex.Factory indexFactory) {
        this.indexFactory = indexFactory;
    }

    /**
     * Returns the neighbor count used when none is given: {@code 2 * ceil(sqrt(n - 2 * width + 1))}
     * if {@code n > 2 * width + 1}, else 2.
     * @param n the sequence length
     * @param width the exclusion width
     * @return the default k
     */
    public static int defaultK(int n, int width) {
        if (n > 2 * width + 1) {
            return 2 * (int) Math.ceil(Math.sqrt(n - 2 * width + 1));
        }
        return 2;
    }

    /**
     * Computes the recurrence matrix of a feature sequence.
     *
     * @param features the frames to link
     * @param params the construction parameters
     * @return a freshly allocated n x n recurrence matrix
     * @throws ParameterException if {@code params.width()} exceeds the sequence length
     */
    public SimilarityMatrix build(FeatureSequence features, RecurrenceParams params) {
        int n = features.size();
        int width = params.width();
        if (width < 1 || width > n) {
            throw new ParameterException(String.format("width=%d must be at least 1 and at most the sequence length %d", width, n));
        }
        int k = params.k() != null ? params.k() : defaultK(n, width);
        int nNeighbors = Math.min(n - 1, k + 2 * width);
        logger.debug("Building {}x{} recurrence matrix with k={} ({} neighbors queried): {}", n, n, k, nNeighbors, params);

        Neighbor[][] neighbors = indexFactory.fit(features, params.metric()).kNearest(nNeighbors);

        var graph = new EdgeTable(n);
        for (int i = 0; i < n; i++) {
            graph.values.replaceRow(i, retainNearest(i, neighbors[i], width, k, params.mode()));
        }

        if (params.selfLoops()) {
            switch (params.mode()) {
                case CONNECTIVITY:
                    for (int i = 0; i < n; i++) {
                        graph.values.set(i, i, 1.0);
                    }
                    break;
                case AFFINITY:
                    for (int i = 0; i < n; i++) {
                        graph.markSelfLoop(i);
                    }
                    break;
                case DISTANCE:
                    // a frame's distance to itself is 0, which is an absent entry
                    break;
            }
        }

        if (params.symmetric()) {
            graph.values = graph.values.minimum(graph.values.transpose());
        }
        graph.values.eliminateZeros();

        double bandwidth = Double.NaN;
        if (params.mode() == SimilarityMode.AFFINITY) {
            bandwidth = params.bandwidth() != null ? params.bandwidth() : estimateBandwidth(graph.values);
            graph.toAffinity(bandwidth);
        }

        Matrix result = params.sparse() ? graph.values : graph.values.toDense();
        return new SimilarityMatrix(result, params.mode(), bandwidth);
    }

    /**
     * Keeps the k closest neighbors of frame i that lie outside the exclusion band.
     */
    private static SparseRow retainNearest(int i, Neighbor[] candidates, int width, int k, SimilarityMode mode) {
        List<Neighbor> outsideBand = new ArrayList<>(candidates.length);
        for (Neighbor candidate : candidates) {
            if (Math.abs(i - candidate.index) < width) {
                continue;
            }
            // a zero distance would be dropped with the explicit zeros
            if (mode != SimilarityMode.CONNECTIVITY && candidate.distance == 0) {
                continue;
            }
            outsideBand.add(candidate);
        }
        // stable, so equal distances keep the index's ranking
        outsideBand.sort(Comparator.comparingDouble(nb -> nb.distance));

        var row = new SparseRow(Math.min(k, outsideBand.size()));
        for (int r = 0; r < Math.min(k, outsideBand.size()); r++) {
            Neighbor nb = outsideBand.get(r);
            row.put(nb.index, mode == SimilarityMode.CONNECTIVITY ? 1.0 : nb.distance);
        }
        return row;
    }

    /**
     * Median over frames with at least one link of the distance to their furthest link.
     * NaN if no frame has a link.
     */
    static double estimateBandwidth(SparseMatrix distances) {
        double[] rowMaxima = new double[distances.rows()];
        int count = 0;
        for (int i = 0; i < distances.rows(); i++) {
            SparseRow row = distances.row(i);
            if (row.size() > 0) {
                rowMaxima[count++] = row.maxValue();
            }
        }
        double bandwidth = new Median().evaluate(rowMaxima, 0, count);
        if (Double.isNaN(bandwidth)) {
            logger.warn("No frame has a neighbor outside the exclusion band; affinity bandwidth is NaN");
        } else {
            logger.debug("Estimated affinity bandwidth {} from {} frames", bandwidth, count);
        }
        return bandwidth;
    }

    /**
     * State of one cell while a recurrence matrix is being assembled.
     */
    enum CellState {
        /** the cell holds a distance or connectivity value */
        VALUE,
        /** the cell is a self-link whose value is assigned when the mode is applied */
        PENDING_SELF_LOOP,
        /** the cell is empty */
        ABSENT
    }

    /**
     * Staging structure for graph construction. Pending self-links are kept apart from the
     * stored values, so they take no part in symmetrization, zero elimination or bandwidth
     * estimation.
     */
    static final class EdgeTable {
        SparseMatrix values;
        private final BitSet pendingSelfLoops;

        EdgeTable(int n) {
            values = new SparseMatrix(n, n);
            pendingSelfLoops = new BitSet(n);
        }

        void markSelfLoop(int i) {
            pendingSelfLoops.set(i);
        }

        CellState state(int i, int j) {
            if (i == j && pendingSelfLoops.get(i)) {
                return CellState.PENDING_SELF_LOOP;
            }
            return values.contains(i, j) ? CellState.VALUE : CellState.ABSENT;
        }

        /**
         * Maps every stored distance d to {@code exp(-d / bandwidth)} and resolves pending
         * self-links as distance 0.
         */
        void toAffinity(double bandwidth) {
            for (int i = 0; i < values.rows(); i++) {
                SparseRow row = values.row(i);
                for (int r = 0; r < row.size(); r++) {
                    row.setValue(r, Math.exp(-row.getValue(r) / bandwidth));
                }
            }
            for (int i = pendingSelfLoops.nextSetBit(0); i >= 0; i = pendingSelfLoops.nextSetBit(i + 1)) {
                values.set(i, i, Math.exp(-0.0 / bandwidth));
            }
            pendingSelfLoops.clear();
        }
    }
}
