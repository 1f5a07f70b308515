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

package io.github.jrecur.util;

/**
 * Utility methods for mathematical operations.
 */
public class MathUtil {
    /** Private constructor to prevent instantiation. */
    private MathUtil() {
    }

    /**
     * Squares the given value.
     *
     * @param a the value to square
     * @return the square of a
     */
    public static double square(double a) {
        return a * a;
    }

    /**
     * @param a a positive value
     * @return the base-2 logarithm of a
     */
    public static double log2(double a) {
        return Math.log(a) / Math.log(2);
    }

    /**
     * Tests approximate equality with the tolerance {@code atol + rtol * |b|}.
     *
     * @param a the value to test
     * @param b the reference value
     * @param rtol relative tolerance
     * @param atol absolute tolerance
     * @return true if a is within tolerance of b
     */
    public static boolean isClose(double a, double b, double rtol, double atol) {
        return Math.abs(a - b) <= atol + rtol * Math.abs(b);
    }
}
