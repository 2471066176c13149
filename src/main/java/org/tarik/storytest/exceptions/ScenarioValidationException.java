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
package org.tarik.storytest.exceptions;

import java.util.List;

import static org.tarik.storytest.error.ErrorCategory.VALIDATION_FAILURE;

/**
 * Thrown when a scenario fails structural validation before being persisted or executed.
 */
public class ScenarioValidationException extends TestAutomationException {
    private final List<String> validationErrors;

    public ScenarioValidationException(String scenarioTitle, List<String> validationErrors) {
        super("Test scenario '%s' is invalid: %s".formatted(scenarioTitle, String.join("; ", validationErrors)),
                VALIDATION_FAILURE);
        this.validationErrors = List.copyOf(validationErrors);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
