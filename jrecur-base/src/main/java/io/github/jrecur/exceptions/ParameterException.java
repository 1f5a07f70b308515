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

package io.github.jrecur.exceptions;

/**
 * Thrown when an argument to one of the recurrence, lag or filtering operations is outside
 * its documented domain.
 * <p>
 * All validation happens before any work is done, so an operation that throws this never
 * leaves a partially computed result behind.
 */
public class ParameterException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new ParameterException with the given message.
     * @param message a description of the offending parameter and its value
     */
    public ParameterException(String message) {
        super(message);
    }

    /**
     * Creates a new ParameterException wrapping another failure.
     * @param message a description of the offending parameter and its value
     * @param cause the underlying failure
     */
    public ParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
