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
 * Provides the exception type used to report invalid parameters.
 * <p>
 * {@link io.github.jrecur.exceptions.ParameterException} is the only exception thrown by the
 * library on its own account. It extends {@link java.lang.IllegalArgumentException}, so callers
 * that already guard against bad arguments need no extra handling.
 *
 * <h2>When it is thrown</h2>
 * <ul>
 *   <li>An exclusion width outside {@code [1, n]}, or a non-positive neighbor count</li>
 *   <li>An unknown similarity mode, distance metric or window name</li>
 *   <li>A non-positive affinity bandwidth</li>
 *   <li>A non-square matrix passed to {@code toLag}, or a malformed lag matrix passed to
 *       {@code fromLag}</li>
 *   <li>An axis other than {@code 0}, {@code 1} or {@code -1}</li>
 *   <li>{@code minRatio > maxRatio} in path enhancement</li>
 * </ul>
 *
 * <p>
 * Numeric degeneracies are not errors: an affinity bandwidth estimated from a matrix without
 * edges is {@code NaN}, and that {@code NaN} flows into the result.
 *
 * <pre>{@code
 * try {
 *     SimilarityMatrix rec = Segments.buildRecurrenceMatrix(features, params);
 * } catch (ParameterException e) {
 *     logger.warn("Rejected recurrence parameters: {}", e.getMessage());
 * }
 * }</pre>
 *
 * @see io.github.jrecur.exceptions.ParameterException
 */
package io.github.jrecur.exceptions;
