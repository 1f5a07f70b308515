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

import java.util.Objects;

/**
 * Boundary handling passed through to a {@link Convolver} or {@link MedianFilter}.
 */
public final class ConvolveOptions {
    /** Reflect at the edges, with a fill value of 0. */
    public static final ConvolveOptions DEFAULT = new ConvolveOptions(BoundaryMode.REFLECT, 0.0);

    private final BoundaryMode mode;
    private final double cval;

    /**
     * @param mode how cells beyond the input edge are read
     * @param cval the fill value for {@link BoundaryMode#CONSTANT}
     */
    public ConvolveOptions(BoundaryMode mode, double cval) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.cval = cval;
    }

    public static ConvolveOptions of(BoundaryMode mode) {
        return new ConvolveOptions(mode, 0.0);
    }

    public BoundaryMode mode() {
        return mode;
    }

    public double cval() {
        return cval;
    }

    /**
     * Reads cell (i, j) of a row-major array, applying the boundary mode on both axes.
     */
    double read(double[][] data, int i, int j) {
        int r = mode.resolve(i, data.length);
        if (r < 0) {
            return cval;
        }
        int c = mode.resolve(j, data[r].length);
        if (c < 0) {
            return cval;
        }
        return data[r][c];
    }

    @Override
    public String toString() {
        return mode == BoundaryMode.CONSTANT ? "ConvolveOptions(CONSTANT, cval=" + cval + ")" : "ConvolveOptions(" + mode + ")";
    }
}
