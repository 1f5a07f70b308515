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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jrecur.exceptions.ParameterException;
import io.github.jrecur.matrix.DenseMatrix;
import io.github.jrecur.matrix.Matrix;
import org.junit.Test;

import static io.github.jrecur.TestUtil.assertMatrixEquals;
import static io.github.jrecur.TestUtil.randomMatrix;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestPathEnhancer extends RandomizedTest {

    @Test
    public void testDefaultRatios() {
        var enhancer = PathEnhancer.builder().withMaxRatio(2.0).withFilterCount(3).build();
        assertArrayEquals(new double[] {0.5, 1.0, 2.0}, enhancer.ratios(), 1e-12);
    }

    @Test
    public void testRatiosAreLogSpaced() {
        double[] ratios = PathEnhancer.ratios(0.25, 4.0, 5);
        assertArrayEquals(new double[] {0.25, 0.5, 1, 2, 4}, ratios, 1e-12);
        assertArrayEquals(new double[] {0.7}, PathEnhancer.ratios(0.7, 3.0, 1), 0.0);
    }

    @Test
    public void testSingleUnitFilterIsOneConvolution() {
        DenseMatrix similarity = randomMatrix(getRandom(), 12, 12, 0.5);
        var enhancer = PathEnhancer.builder().withMaxRatio(1.0).withFilterCount(1).build();
        assertArrayEquals(new double[] {1.0}, enhancer.ratios(), 0.0);

        double[][] kernel = DiagonalKernel.generate(WindowFunction.HANN, 5, 1.0, false);
        DenseMatrix expected = new DirectConvolver().convolve(similarity, kernel, ConvolveOptions.DEFAULT);
        assertMatrixEquals(expected, enhancer.enhance(similarity, 5));
    }

    @Test
    public void testClipRemovesNegatives() {
        DenseMatrix similarity = randomMatrix(getRandom(), 16, 16, 0.3);
        var unclipped = PathEnhancer.builder().withZeroMean(true).withClip(false).build().enhance(similarity, 7);
        var clipped = PathEnhancer.builder().withZeroMean(true).withClip(true).build().enhance(similarity, 7);
        for (int i = 0; i < 16; i++) {
            for (int j = 0; j < 16; j++) {
                assertTrue(clipped.get(i, j) >= 0);
                assertEquals(Math.max(0, unclipped.get(i, j)), clipped.get(i, j), 0.0);
            }
        }
    }

    @Test
    public void testRunningMaximum() {
        DenseMatrix similarity = randomMatrix(getRandom(), 10, 10, 0.5);
        var enhancer = PathEnhancer.builder().withFilterCount(5).build();
        DenseMatrix enhanced = enhancer.enhance(similarity, 5);
        for (double ratio : enhancer.ratios()) {
            double[][] kernel = DiagonalKernel.generate(WindowFunction.HANN, 5, ratio, false);
            DenseMatrix response = new DirectConvolver().convolve(similarity, kernel, ConvolveOptions.DEFAULT);
            for (int i = 0; i < 10; i++) {
                for (int j = 0; j < 10; j++) {
                    assertTrue(enhanced.get(i, j) >= response.get(i, j));
                }
            }
        }
    }

    @Test
    public void testDiagonalIsReinforced() {
        var similarity = new DenseMatrix(20, 20);
        for (int i = 0; i < 20; i++) {
            similarity.set(i, i, 1.0);
        }
        similarity.set(5, 15, 1.0);
        DenseMatrix enhanced = PathEnhancer.builder().build().enhance(similarity, 9);
        assertTrue(enhanced.get(10, 10) > enhanced.get(5, 15));
    }

    @Test
    public void testCrossSimilarityKeepsShape() {
        Matrix similarity = randomMatrix(getRandom(), 6, 9, 0.5);
        DenseMatrix enhanced = PathEnhancer.builder().build().enhance(similarity, 3);
        assertEquals(6, enhanced.rows());
        assertEquals(9, enhanced.columns());
    }

    @Test
    public void testCustomConvolver() {
        int[] calls = new int[1];
        Convolver counting = (input, kernel, options) -> {
            calls[0]++;
            return new DirectConvolver().convolve(input, kernel, options);
        };
        PathEnhancer.builder().withFilterCount(4).withConvolver(counting).build()
                .enhance(new DenseMatrix(4, 4), 3);
        assertEquals(4, calls[0]);
    }

    @Test
    public void testInvalidArguments() {
        expectParameterException(() -> PathEnhancer.builder().withMaxRatio(1.0).withMinRatio(2.0).build());
        expectParameterException(() -> PathEnhancer.builder().withMaxRatio(0.0).build());
        expectParameterException(() -> PathEnhancer.builder().withMinRatio(-0.5).build());
        expectParameterException(() -> PathEnhancer.builder().withFilterCount(0).build());
        expectParameterException(() -> PathEnhancer.builder().build().enhance(new DenseMatrix(3, 3), 0));
        expectParameterException(() -> PathEnhancer.builder().build().enhance(new DenseMatrix(3, 3).toSparse(), 3));
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
