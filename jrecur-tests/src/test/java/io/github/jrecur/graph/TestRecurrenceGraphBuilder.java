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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jrecur.exceptions.ParameterException;
import io.github.jrecur.graph.knn.DistanceMetric;
import io.github.jrecur.graph.knn.KnnIndex;
import io.github.jrecur.graph.knn.Neighbor;
import io.github.jrecur.matrix.SparseMatrix;
import org.junit.Test;

import static io.github.jrecur.TestUtil.assertMatrixEquals;
import static io.github.jrecur.TestUtil.randomFeatures;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestRecurrenceGraphBuilder extends RandomizedTest {
    private final RecurrenceGraphBuilder builder = new RecurrenceGraphBuilder();

    @Test
    public void testConnectivityScenario() {
        FeatureSequence features = randomFeatures(getRandom(), 20, 12);
        var params = RecurrenceParams.builder().withK(3).withWidth(1).build();
        SimilarityMatrix rec = builder.build(features, params);

        assertEquals(20, rec.size());
        assertFalse(rec.isSparse());
        assertSame(SimilarityMode.CONNECTIVITY, rec.mode());
        for (int i = 0; i < 20; i++) {
            int linked = 0;
            for (int j = 0; j < 20; j++) {
                double v = rec.get(i, j);
                assertTrue(v == 0.0 || v == 1.0);
                if (v != 0) {
                    linked++;
                }
            }
            assertEquals(0.0, rec.get(i, i), 0.0);
            assertTrue("row " + i + " has " + linked + " links", linked <= 3);
        }
    }

    @Test
    public void testExclusionBand() {
        for (int trial = 0; trial < 10; trial++) {
            int n = randomIntBetween(2, 40);
            int width = randomIntBetween(1, n);
            var mode = randomFrom(SimilarityMode.values());
            var params = RecurrenceParams.builder()
                    .withWidth(width)
                    .withMode(mode)
                    .withSparse(randomBoolean())
                    .withSymmetric(randomBoolean())
                    .build();
            SimilarityMatrix rec = builder.build(randomFeatures(getRandom(), n, 4), params);
            rec.forEachEntry((i, j, v) -> assertTrue("link " + i + "->" + j + " inside width " + width,
                                                     v == 0 || Math.abs(i - j) >= width));
        }
    }

    @Test
    public void testAtMostKPerRow() {
        int n = randomIntBetween(10, 50);
        int k = randomIntBetween(1, 6);
        var params = RecurrenceParams.builder().withK(k).withWidth(randomIntBetween(1, 3)).withSparse(true).build();
        var rec = (SparseMatrix) builder.build(randomFeatures(getRandom(), n, 5), params).matrix();
        for (int i = 0; i < n; i++) {
            assertTrue(rec.row(i).size() <= k);
        }
    }

    @Test
    public void testSymmetricConnectivity() {
        var params = RecurrenceParams.builder().withSymmetric(true).withWidth(2).build();
        SimilarityMatrix rec = builder.build(randomFeatures(getRandom(), 30, 8), params);
        assertTrue(rec.isSymmetric());
        assertMatrixEquals(rec.transpose(), rec);
    }

    @Test
    public void testValueRanges() {
        FeatureSequence features = randomFeatures(getRandom(), 25, 6);

        var affinity = builder.build(features, RecurrenceParams.builder().withMode(SimilarityMode.AFFINITY).build());
        assertTrue(affinity.bandwidth() > 0);
        assertTrue(affinity.nonZeroCount() > 0);
        affinity.forEachEntry((i, j, v) -> assertTrue(v == 0 || (v > 0 && v <= 1)));

        var distance = builder.build(features, RecurrenceParams.builder().withMode("distance").build());
        distance.forEachEntry((i, j, v) -> {
            assertTrue(v >= 0);
            if (v != 0) {
                assertEquals(DistanceMetric.EUCLIDEAN.distance(features.frame(i), features.frame(j)), v, 0.0);
            }
        });
    }

    @Test
    public void testAffinityFromExplicitBandwidth() {
        FeatureSequence features = randomFeatures(getRandom(), 15, 3);
        var distance = builder.build(features, RecurrenceParams.builder().withMode(SimilarityMode.DISTANCE).build());
        var affinity = builder.build(features, RecurrenceParams.builder()
                .withMode(SimilarityMode.AFFINITY)
                .withBandwidth(2.0)
                .build());
        assertEquals(2.0, affinity.bandwidth(), 0.0);
        for (int i = 0; i < 15; i++) {
            for (int j = 0; j < 15; j++) {
                double d = distance.get(i, j);
                assertEquals(d == 0 ? 0 : Math.exp(-d / 2.0), affinity.get(i, j), 1e-12);
            }
        }
    }

    @Test
    public void testSparseAndDenseAgree() {
        FeatureSequence features = randomFeatures(getRandom(), randomIntBetween(5, 30), 4);
        var mode = randomFrom(SimilarityMode.values());
        boolean symmetric = randomBoolean();
        boolean selfLoops = randomBoolean();
        var sparse = builder.build(features, RecurrenceParams.builder()
                .withMode(mode).withSymmetric(symmetric).withSelfLoops(selfLoops).withSparse(true).build());
        var dense = builder.build(features, RecurrenceParams.builder()
                .withMode(mode).withSymmetric(symmetric).withSelfLoops(selfLoops).withSparse(false).build());
        assertTrue(sparse.isSparse());
        assertFalse(dense.isSparse());
        assertMatrixEquals(dense, sparse);
    }

    @Test
    public void testSelfLoops() {
        FeatureSequence features = randomFeatures(getRandom(), 12, 3);
        for (var mode : SimilarityMode.values()) {
            var rec = builder.build(features, RecurrenceParams.builder()
                    .withMode(mode)
                    .withSymmetric(true)
                    .withSelfLoops(true)
                    .build());
            double expected = mode == SimilarityMode.DISTANCE ? 0.0 : 1.0;
            for (int i = 0; i < 12; i++) {
                assertEquals(mode + " diagonal", expected, rec.get(i, i), 0.0);
            }
        }
    }

    @Test
    public void testSelfLoopsDoNotAffectBandwidth() {
        FeatureSequence features = randomFeatures(getRandom(), 16, 3);
        var with = builder.build(features, RecurrenceParams.builder().withMode("affinity").withSelfLoops(true).build());
        var without = builder.build(features, RecurrenceParams.builder().withMode("affinity").build());
        assertEquals(without.bandwidth(), with.bandwidth(), 0.0);
        for (int i = 0; i < 16; i++) {
            for (int j = 0; j < 16; j++) {
                if (i != j) {
                    assertEquals(without.get(i, j), with.get(i, j), 0.0);
                }
            }
        }
    }

    @Test
    public void testNaNBandwidthWithoutLinks() {
        // every pair of the 3 frames falls inside the exclusion band
        var rec = builder.build(randomFeatures(getRandom(), 3, 2),
                                RecurrenceParams.builder().withWidth(3).withMode(SimilarityMode.AFFINITY).build());
        assertTrue(Double.isNaN(rec.bandwidth()));
        assertEquals(0, rec.nonZeroCount());
    }

    @Test
    public void testTiesKeepIndexOrder() {
        // a fixed index that ranks all candidates equally, highest index first
        KnnIndex.Factory factory = (points, metric) -> new KnnIndex() {
            @Override
            public int size() {
                return points.size();
            }

            @Override
            public Neighbor[][] kNearest(int k) {
                var result = new Neighbor[points.size()][];
                for (int i = 0; i < points.size(); i++) {
                    result[i] = new Neighbor[k];
                    int r = 0;
                    for (int j = points.size() - 1; j >= 0 && r < k; j--) {
                        if (j != i) {
                            result[i][r++] = new Neighbor(j, 1.0);
                        }
                    }
                }
                return result;
            }
        };
        var rec = new RecurrenceGraphBuilder(factory).build(randomFeatures(getRandom(), 4, 2),
                                                            RecurrenceParams.builder().withK(1).build());
        assertTrue(rec.isLinked(0, 3));
        assertTrue(rec.isLinked(1, 3));
        assertTrue(rec.isLinked(2, 3));
        assertTrue(rec.isLinked(3, 2));
        assertEquals(4, rec.nonZeroCount());
    }

    @Test
    public void testDuplicateFramesDoNotUseUpNeighbors() {
        // frame 5 repeats frame 0
        double[][] data = {{0}, {10}, {20}, {30}, {40}, {0}, {60}, {3}};
        FeatureSequence features = FeatureSequence.of(data, 0);

        var distance = builder.build(features, RecurrenceParams.builder()
                .withK(1)
                .withMode(SimilarityMode.DISTANCE)
                .withSparse(true)
                .build());
        assertFalse(distance.isLinked(0, 5));
        assertFalse(distance.isLinked(5, 0));
        assertEquals(3.0, distance.get(0, 7), 1e-12);
        assertEquals(3.0, distance.get(5, 7), 1e-12);
        assertEquals(8, distance.nonZeroCount());

        var affinity = builder.build(features, RecurrenceParams.builder()
                .withK(1)
                .withMode(SimilarityMode.AFFINITY)
                .withSparse(true)
                .build());
        for (int i = 0; i < data.length; i++) {
            int linked = 0;
            for (int j = 0; j < data.length; j++) {
                if (affinity.get(i, j) > 0) {
                    linked++;
                }
            }
            assertEquals("row " + i, 1, linked);
        }
        assertTrue(affinity.bandwidth() > 0);

        // connectivity keeps the duplicate as the nearest link
        var connectivity = builder.build(features, RecurrenceParams.builder().withK(1).build());
        assertTrue(connectivity.isLinked(0, 5));
        assertTrue(connectivity.isLinked(5, 0));
    }

    @Test
    public void testDefaults() {
        var params = RecurrenceParams.defaults();
        assertNull(params.k());
        assertEquals(1, params.width());
        assertSame(DistanceMetric.EUCLIDEAN, params.metric());
        assertSame(SimilarityMode.CONNECTIVITY, params.mode());
        assertFalse(params.sparse() || params.symmetric() || params.selfLoops());

        // default k for 30 frames is 2 * ceil(sqrt(29)) = 12
        var sparse = RecurrenceParams.builder().withSparse(true).build();
        var rec = (SparseMatrix) builder.build(randomFeatures(getRandom(), 30, 4), sparse).matrix();
        for (int i = 0; i < 30; i++) {
            assertEquals(12, rec.row(i).size());
        }
    }

    @Test
    public void testDefaultK() {
        assertEquals(10, RecurrenceGraphBuilder.defaultK(20, 1));
        assertEquals(2, RecurrenceGraphBuilder.defaultK(3, 1));
        assertEquals(2 * (int) Math.ceil(Math.sqrt(95)), RecurrenceGraphBuilder.defaultK(100, 3));
    }

    @Test
    public void testEstimateBandwidth() {
        var distances = new SparseMatrix(5, 5);
        distances.set(0, 1, 1.0);
        distances.set(1, 2, 3.0);
        distances.set(1, 3, 0.5);
        distances.set(2, 4, 2.0);
        distances.set(3, 0, 4.0);
        // row maxima 1, 3, 2, 4; row 4 has no links
        assertEquals(2.5, RecurrenceGraphBuilder.estimateBandwidth(distances), 1e-12);
        assertTrue(Double.isNaN(RecurrenceGraphBuilder.estimateBandwidth(new SparseMatrix(3, 3))));
    }

    @Test
    public void testEdgeTableStates() {
        var table = new RecurrenceGraphBuilder.EdgeTable(3);
        table.values.set(0, 1, 2.0);
        table.markSelfLoop(2);
        assertSame(RecurrenceGraphBuilder.CellState.VALUE, table.state(0, 1));
        assertSame(RecurrenceGraphBuilder.CellState.ABSENT, table.state(1, 0));
        assertSame(RecurrenceGraphBuilder.CellState.PENDING_SELF_LOOP, table.state(2, 2));

        table.toAffinity(2.0);
        assertEquals(Math.exp(-1.0), table.values.get(0, 1), 1e-15);
        assertEquals(1.0, table.values.get(2, 2), 0.0);
        assertSame(RecurrenceGraphBuilder.CellState.VALUE, table.state(2, 2));
    }

    @Test(expected = ParameterException.class)
    public void testWidthLargerThanSequence() {
        builder.build(randomFeatures(getRandom(), 5, 2), RecurrenceParams.builder().withWidth(6).build());
    }

    @Test
    public void testInvalidParameters() {
        expectParameterException(() -> RecurrenceParams.builder().withWidth(0).build());
        expectParameterException(() -> RecurrenceParams.builder().withK(0).build());
        expectParameterException(() -> RecurrenceParams.builder().withBandwidth(0.0).build());
        expectParameterException(() -> RecurrenceParams.builder().withBandwidth(-1.0).build());
        expectParameterException(() -> RecurrenceParams.builder().withBandwidth(Double.NaN).build());
        expectParameterException(() -> RecurrenceParams.builder().withMode("similarity"));
        expectParameterException(() -> RecurrenceParams.builder().withMetric("levenshtein"));
    }

    private static void expectParameterException(Runnable r) {
        try {
            r.run();
        } catch (ParameterException e) {
            return;
        }
        throw new AssertionError("expected ParameterException");
    }
}
