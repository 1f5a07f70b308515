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

import java.util.Locale;

/**
 * The kind of value a recurrence matrix holds for each linked pair of frames.
 */
public enum SimilarityMode {
    /** Linked pairs hold 1, all other cells 0. */
    CONNECTIVITY,
    /** Linked pairs hold the distance between the frames. */
    DISTANCE,
    /** Linked pairs hold {@code exp(-distance / bandwidth)}, in (0, 1]. */
    AFFINITY;

    /**
     * Looks up a mode by name, ignoring case ("connectivity", "distance" or "affinity").
     *
     * @param name the mode name
     * @return the mode
     * @throws ParameterException if no mode has that name
     */
    public static SimilarityMode forName(String name) {
        if (name != null) {
            for (SimilarityMode mode : values()) {
                if (mode.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                    return mode;
                }
            }
        }
        throw new ParameterException("Invalid mode='" + name + "'. Must be one of [connectivity, distance, affinity]");
    }
}
