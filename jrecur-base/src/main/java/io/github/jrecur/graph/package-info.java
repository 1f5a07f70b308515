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

/**
 * Construction of recurrence graphs from feature sequences.
 * <p>
 * A {@link io.github.jrecur.graph.RecurrenceGraphBuilder} links each frame of a
 * {@link io.github.jrecur.graph.FeatureSequence} to its nearest neighbors, excluding frames
 * inside a band around the diagonal, and returns a square
 * {@link io.github.jrecur.graph.SimilarityMatrix} holding connectivity, distance or affinity
 * values.
 * <pre>{@code
 * var params = RecurrenceParams.builder()
 *         .withWidth(3)
 *         .withMode(SimilarityMode.AFFINITY)
 *         .withSymmetric(true)
 *         .build();
 * SimilarityMatrix rec = new RecurrenceGraphBuilder().build(FeatureSequence.of(chroma), params);
 * }</pre>
 * Neighbor search is delegated to a {@link io.github.jrecur.graph.knn.KnnIndex}.
 */
package io.github.jrecur.graph;
