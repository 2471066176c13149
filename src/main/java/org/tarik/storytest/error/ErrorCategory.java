/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.storytest.error;

/**
 * Categories of errors reported by the test automation service.
 * These categories determine whether the caller may retry and how the failure is logged.
 */
public enum ErrorCategory {
    /**
     * The generator produced no usable scenario for the given story.
     * Retry: YES (with the same or a refined story)
     * Severity: ERROR
     */
    GENERATION_FAILURE,

    /**
     * The repository failed to read or write an entity.
     * Retry: YES (Exponential backoff)
     * Severity: ERROR
     */
    PERSISTENCE_FAILURE,

    /**
     * The requested scenario or result does not exist.
     * Retry: NO
     * Severity: WARN
     */
    NOT_FOUND,

    /**
     * No registered executor declares support for the scenario's test type.
     * Retry: NO (until an executor is registered)
     * Severity: ERROR
     */
    NO_EXECUTOR,

    /**
     * An executor raised an unexpected fault, distinct from a failed assertion.
     * Retry: OPTIONAL
     * Severity: ERROR
     */
    EXECUTION_FAILURE,

    /**
     * The scenario or one of its steps failed structural validation.
     * Retry: NO (the scenario must be fixed first)
     * Severity: WARN
     */
    VALIDATION_FAILURE
}
