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

package io.github.jrecur.lag;

import io.github.jrecur.matrix.Matrix;

/**
 * A filter over positional arguments, at least one of which is the matrix being filtered.
 * <p>
 * The argument array lets existing filters with several parameters be adapted with a lambda,
 * e.g. {@code args -> median.apply((Matrix) args[0])}.
 */
@FunctionalInterface
public interface MatrixFilter {
    /**
     * Applies the filter.
     * @param args the positional arguments
     * @return the filtered matrix
     */
    Matrix apply(Object... args);
}
