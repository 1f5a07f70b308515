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
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class TestFeatureSequence {
    private static final double[][] DATA = {{1, 2, 3}, {4, 5, 6}};

    @Test
    public void testColumnsAreFramesByDefault() {
        var features = FeatureSequence.of(DATA);
        assertEquals(3, features.size());
        assertEquals(2, features.dimension());
        assertArrayEquals(new double[] {2, 5}, features.frame(1), 0.0);
        assertEquals(features.size(), FeatureSequence.of(DATA, 1).size());
    }

    @Test
    public void testRowsAreFramesOnAxisZero() {
        var features = FeatureSequence.of(DATA, 0);
        assertEquals(2, features.size());
        assertEquals(3, features.dimension());
        assertArrayEquals(new double[] {4, 5, 6}, features.frame(1), 0.0);
    }

    @Test
    public void testSlice() {
        var slice = FeatureSequence.of(DATA).slice(1, 3);
        assertEquals(2, slice.size());
        assertEquals(3.0, slice.get(1, 0), 0.0);
    }

    @Test(expected = ParameterException.class)
    public void testEmptySlice() {
        FeatureSequence.of(DATA).slice(2, 2);
    }

    @Test(expected = ParameterException.class)
    public void testInvalidAxis() {
        FeatureSequence.of(DATA, 2);
    }

    @Test(expected = ParameterException.class)
    public void testRaggedData() {
        FeatureSequence.of(new double[][] {{1, 2}, {3}}, 0);
    }
}
