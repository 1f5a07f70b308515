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

package io.github.jrecur.graph.knn;

import io.github.jrecur.exceptions.ParameterException;
import io.github.jrecur.util.MathUtil;

import java.util.Locale;

/**
 * Distance functions between feature vectors. Smaller is closer.
 */
public enum DistanceMetric {
    /** Straight-line distance. */
    EUCLIDEAN {
        @Override
        public double distance(double[] a, double[] b) {
            return Math.sqrt(SQEUCLIDEAN.distance(a, b));
        }
    },

    /** Sum of squared differences. */
    SQEUCLIDEAN {
        @Override
        public double distance(double[] a, double[] b) {
            double sum = 0;
            for (int i = 0; i < a.length; i++) {
                sum += MathUtil.square(a[i] - b[i]);
            }
            return sum;
        }
    },

    /** Sum of absolute differences. */
    MANHATTAN {
        @Override
        public double distance(double[] a, double[] b) {
            double sum = 0;
            for (int i = 0; i < a.length; i++) {
                sum += Math.abs(a[i] - b[i]);
            }
            return sum;
        }
    },

    /** Largest absolute difference. */
    CHEBYSHEV {
        @Override
        public double distance(double[] a, double[] b) {
            double max = 0;
            for (int i = 0; i < a.length; i++) {
                max = Math.max(max, Math.abs(a[i] - b[i]));
            }
            return max;
        }
    },

    /**
     * One minus the cosine of the angle between the vectors. A zero vector has cosine 0 to
     * everything, so its distance is 1.
     */
    COSINE {
        @Override
        public double distance(double[] a, double[] b) {
            double dot = 0, na = 0, nb = 0;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
                na += a[i] * a[i];
                nb += b[i] * b[i];
            }
            if (na == 0 || nb == 0) {
                return 1.0;
            }
            return Math.max(0.0, 1.0 - dot / (Math.sqrt(na) * Math.sqrt(nb)));
        }
    };

    /**
     * Calculates the distance between two vectors of the same dimension.
     *
     * @param a the first vector
     * @param b the second vector
     * @return the distance, never negative
     */
    public abstract double distance(double[] a, double[] b);

    /**
     * Looks up a metric by name, ignoring case ("euclidean", "cosine", ...).
     *
     * @param name the metric name
     * @return the metric
     * @throws ParameterException if no metric has that name
     */
    public static DistanceMetric forName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ParameterException("Unknown distance metric: " + name, e);
        }
    }
}
