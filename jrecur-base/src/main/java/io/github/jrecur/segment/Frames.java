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

import java.util.Arrays;

/**
 * Frame index helpers.
 */
public final class Frames {
    private Frames() {
    }

    /**
     * Normalizes a list of frame indices: optionally pads with the interval endpoints, clips to
     * {@code [xMin, xMax]}, then sorts and removes duplicates.
     *
     * @param frames frame indices, all non-negative
     * @param xMin the smallest allowed frame
     * @param xMax the largest allowed frame
     * @param pad if true, add {@code xMin} and {@code xMax}
     * @return a new sorted array of distinct frames
     * @throws ParameterException if any frame is negative, or xMin exceeds xMax
     */
    public static int[] fix(int[] frames, int xMin, int xMax, boolean pad) {
        if (xMin > xMax) {
            throw new ParameterException("x_min=" + xMin + " exceeds x_max=" + xMax);
        }
        for (int f : frames) {
            if (f < 0) {
                throw new ParameterException("Negative frame index detected");
            }
        }

        int[] result = Arrays.copyOf(frames, pad ? frames.length + 2 : frames.length);
        if (pad) {
            result[frames.length] = xMin;
            result[frames.length + 1] = xMax;
        }
        for (int i = 0; i < result.length; i++) {
            result[i] = Math.min(Math.max(result[i], xMin), xMax);
        }
        return Arrays.stream(result).sorted().distinct().toArray();
    }
}
