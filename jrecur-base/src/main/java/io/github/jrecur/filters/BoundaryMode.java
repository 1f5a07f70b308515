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

/**
 * How filters read cells beyond the edge of their input. Illustrated for a row
 * {@code a b c d}:
 * <pre>
 * REFLECT   d c b a | a b c d | d c b a
 * MIRROR      d c b | a b c d | c b a
 * NEAREST   a a a a | a b c d | d d d d
 * WRAP      a b c d | a b c d | a b c d
 * CONSTANT  k k k k | a b c d | k k k k
 * </pre>
 */
public enum BoundaryMode {
    REFLECT {
        @Override
        public int resolve(int index, int length) {
            int period = 2 * length;
            int q = Math.floorMod(index, period);
            return q < length ? q : period - 1 - q;
        }
    },
    MIRROR {
        @Override
        public int resolve(int index, int length) {
            if (length == 1) {
                return 0;
            }
            int period = 2 * length - 2;
            int q = Math.floorMod(index, period);
            return q < length ? q : period - q;
        }
    },
    NEAREST {
        @Override
        public int resolve(int index, int length) {
            return Math.max(0, Math.min(length - 1, index));
        }
    },
    WRAP {
        @Override
        public int resolve(int index, int length) {
            return Math.floorMod(index, length);
        }
    },
    CONSTANT {
        @Override
        public int resolve(int index, int length) {
            return index >= 0 && index < length ? index : -1;
        }
    };

    /**
     * Maps a possibly out-of-range index onto the input.
     *
     * @param index the requested index
     * @param length the input length along this axis, at least 1
     * @return an index in {@code [0, length)}, or -1 if the constant fill value applies
     */
    public abstract int resolve(int index, int length);
}
