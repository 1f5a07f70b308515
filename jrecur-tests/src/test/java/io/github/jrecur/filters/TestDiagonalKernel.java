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
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestDiagonalKernel extends RandomizedTest {

    private static double sum(double[][] kernel) {
        double sum = 0;
        for (double[] row : kernel) {
            for (double v : row) {
                sum += v;
            }
        }
        return sum;
    }

    @Test
    public void testUnitSlopeIsDiagonal() {
        double[][] kernel = DiagonalKernel.generate(WindowFunction.HANN, 5, 1.0, false);
        double[] expected = {0, 0.25, 0.5, 0.25, 0};
        assertEquals(5, kernel.length);
        for (int i = 0; i < 5; i++) {
            assertEquals(5, kernel[i].length);
            for (int j = 0; j < 5; j++) {
                assertEquals(i == j ? expected[i] : 0.0, kernel[i][j], 1e-12);
            }
        }
    }

    @Test
    public void testZeroMean() {
        double[][] kernel = DiagonalKernel.generate(WindowFunction.HANN, 5, 1.0, true);
        assertEquals(0.0, sum(kernel), 1e-12);
        assertEquals(0.5 - 1.0 / 25, kernel[2][2], 1e-12);
        assertEquals(-1.0 / 25, kernel[0][4], 1e-12);
    }

    @Test
    public void testSlopedKernelIsNormalized() {
        for (int trial = 0; trial < 10; trial++) {
            var window = randomFrom(WindowFunction.values());
            int n = 2 * randomIntBetween(1, 10) + 1;
            double slope = Math.pow(2, -2 + 4 * randomDouble());
            double[][] kernel = DiagonalKernel.generate(window, n, slope, false);

            int m = kernel.length;
            assertEquals(1, m % 2);
            for (double[] row : kernel) {
                assertEquals(m, row.length);
                for (double v : row) {
                    assertTrue(v >= 0);
                }
            }
            assertEquals(1.0, sum(kernel), 1e-12);
        }
    }

    @Test
    public void testReciprocalSlopesAreTransposes() {
        double[][] steep = DiagonalKernel.generate(WindowFunction.HANN, 9, 2.0, false);
        double[][] shallow = DiagonalKernel.generate(WindowFunction.HANN, 9, 0.5, false);
        assertEquals(steep.length, shallow.length);
        for (int i = 0; i < steep.length; i++) {
            for (int j = 0; j < steep.length; j++) {
                assertEquals(steep[i][j], shallow[j][i], 1e-12);
            }
        }
    }

    @Test
    public void testSteepKernelIsTallerThanWide() {
        double[][] kernel = DiagonalKernel.generate(WindowFunction.BOXCAR, 7, 3.0, false);
        int c = kernel.length / 2;
        // mass sits near the center column, spread over many rows
        double centerColumn = 0;
        double centerRow = 0;
        for (int k = 0; k < kernel.length; k++) {
            centerColumn += kernel[k][c];
            centerRow += kernel[c][k];
        }
        assertTrue(centerColumn > centerRow);
    }

    @Test
    public void testInvalidArguments() {
        for (double slope : new double[] {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY}) {
            try {
                DiagonalKernel.generate(WindowFunction.HANN, 5, slope, false);
                throw new AssertionError("slope " + slope + " accepted");
            } catch (ParameterException e) {
                assertTrue(e.getMessage().contains("slope"));
            }
        }
    }

    @Test(expected = ParameterException.class)
    public void testWindowWithoutMass() {
        // the two-point Hann window is all zeros
        DiagonalKernel.generate(WindowFunction.HANN, 2, 1.0, false);
    }

    @Test(expected = ParameterException.class)
    public void testEmptyWindow() {
        DiagonalKernel.generate(new double[0], 1.0, false);
    }
}
