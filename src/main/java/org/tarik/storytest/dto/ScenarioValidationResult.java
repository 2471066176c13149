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
package org.tarik.storytest.dto;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Quality assessment of a scenario produced by the generator.
 *
 * @param valid                 whether the scenario passes structural validation
 * @param qualityScore          score between 0 and 100
 * @param issues                structural problems, the scenario cannot be executed while any exist
 * @param suggestions           improvements which are not mandatory
 * @param missingCoverage       aspects of the story which no step covers
 * @param recommendedAssertions assertions worth adding
 */
public record ScenarioValidationResult(boolean valid,
                                       int qualityScore,
                                       @NotNull List<String> issues,
                                       @NotNull List<String> suggestions,
                                       @NotNull List<String> missingCoverage,
                                       @NotNull List<String> recommendedAssertions) {
    public ScenarioValidationResult {
        issues = List.copyOf(issues);
        suggestions = List.copyOf(suggestions);
        missingCoverage = List.copyOf(missingCoverage);
        recommendedAssertions = List.copyOf(recommendedAssertions);
    }
}
