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

import io.github.jrecur.exceptions.ParameterException;

import java.util.Locale;

/**
 * Symmetric window functions, as used for filter design (the first and last samples mirror each
 * other). A window of length 1 is always {@code [1]}.
 */
public enum WindowFunction {
    HANN {
        @Override
        double value(int k, int n) {
            return 0.5 - 0.5 * Math.cos(2 * Math.PI * k / (n - 1));
        }
    },
    HAMMING {
        @Override
        double value(int k, int n) {
            return 0.54 - 0.46 * Math.cos(2 * Math.PI * k / (n - 1));
        }
    },
    BLACKMAN {
        @Override
        double value(int k, int n) {
            double x = 2 * Math.PI * k / (n - 1);
            return 0.42 - 0.5 * Math.cos(x) + 0.08 * Math.cos(2 * x);
        }
    },
    /** Triangle reaching zero at both ends. */
    BARTLETT {
        @Override
        double value(int k, int n) {
            return 1.0 - Math.abs(2.0 * k / (n - 1) - 1.0);
        }
    },
    /** Triangle with nonzero end points. */
    TRIANG {
        @Override
        double value(int k, int n) {
            double half = n % 2 == 1 ? n + 1 : n;
            return 1.0 - Math.abs(2.0 * k - (n - 1)) / half;
        }
    },
    /** Rectangular window. */
    BOXCAR {
        @Override
        double value(int k, int n) {
            return 1.0;
        }
    };

    abstract double value(int k, int n);

    /**
     * Samples the window.
     *
     * @param n the number of samples
     * @return the window values
     * @throws ParameterException if n is less than 1
     */
    public double[] generate(int n) {
        if (n < 1) {
            throw new ParameterException("window length n=" + n + " must be at least 1");
        }
        var w = new double[n];
        if (n == 1) {
            w[0] = 1.0;
            return w;
        }
        for (int k = 0; k < n; k++) {
            w[k] = value(k, n);
        }
        return w;
    }

    /**
     * Looks up a window by name, ignoring case. "hanning" is accepted for HANN and "rect" or
     * "ones" for BOXCAR.
     *
     * @param name the window name
     * @return the window
     * @throws ParameterException if no window has that name
     */
    public static WindowFunction forName(String name) {
        if (name == null) {
            throw new ParameterException("Unknown window: null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "hann":
            case "hanning":
                return HANN;
            case "hamming":
                return HAMMING;
            case "blackman":
                return BLACKMAN;
            case "bartlett":
                return BARTLETT;
            case "triang":
            case "triangle":
                return TRIANG;
            case "boxcar":
            case "rect":
            case "ones":
                return BOXCAR;
            default:
                throw new ParameterException("Unknown window: " + name);
        }
    }
}
