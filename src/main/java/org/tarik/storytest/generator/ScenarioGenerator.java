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
package org.tarik.storytest.generator;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.storytest.dto.ScenarioValidationResult;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.model.ParameterValue;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.model.TestStep;

import java.util.List;
import java.util.Map;

/**
 * Turns user stories into test scenarios and assists with their maintenance. Implementations are called from the
 * service's worker pool and must be safe for concurrent use.
 */
public interface ScenarioGenerator {

    /**
     * Generates a scenario from the story. The returned scenario carries neither a project ID nor a persisted state;
     * the caller stamps and stores it.
     */
    TestScenario generate(@Nullable String userStory, @Nullable String projectContext);

    /**
     * Returns a reworked copy of the steps which takes the reviewer feedback into account.
     */
    List<TestStep> refineSteps(@NotNull List<TestStep> steps, @Nullable String feedback);

    /**
     * Returns a human-readable explanation of why the execution failed.
     */
    String analyzeFailure(@NotNull TestResult result);

    Map<String, ParameterValue> generateTestData(@NotNull TestScenario scenario, @Nullable String requirements);

    List<TestScenario> optimizeScenarios(@NotNull List<TestScenario> scenarios);

    /**
     * Proposes scenarios which cover what the existing ones miss. Suggestions are not persisted.
     */
    List<TestScenario> suggestAdditionalTests(@NotNull List<TestScenario> existingScenarios,
                                              @Nullable String context);

    ScenarioValidationResult validateScenario(@NotNull TestScenario scenario);
}
