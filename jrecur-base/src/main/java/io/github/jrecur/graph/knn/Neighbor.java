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

import java.util.Objects;

/**
 * Represents a neighboring frame and its distance from the query frame.
 */
public final class Neighbor implements Comparable<Neighbor> {
    /** The index of the neighboring frame */
    public final int index;
    /** The distance to the neighboring frame */
    public final double distance;

    /**
     * Creates a new Neighbor pairing a frame with its distance.
     * @param index the index of the neighboring frame
     * @param distance the distance to that frame
     */
    public Neighbor(int index, double distance) {
        this.index = index;
        this.distance = distance;
    }

    @Override
    public String toString() {
        return String.format("Neighbor(%d, %s)", index, distance);
    }

    @Override
    public int compareTo(Neighbor o) {
        // closest first
        int distanceCompare = Double.compare(this.distance, o.distance);
        // If distances are equal, break ties using index (ascending order)
        return distanceCompare != 0 ? distanceCompare : Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Neighbor neighbor = (Neighbor) o;
        return index == neighbor.index && Double.compare(distance, neighbor.distance) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, distance);
    }
}
