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
package org.tarik.storytest.repository;

import org.jetbrains.annotations.NotNull;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.dto.TestStatistics;
import org.tarik.storytest.model.TestScenario;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Storage of scenarios and their execution results. Each scenario and each result is saved as an atomic unit; there
 * is no consistency guarantee spanning a scenario and its results.
 * <p>
 * Implementations must be safe for concurrent use.
 */
public interface TestRepository {

    /**
     * Stores a new scenario or replaces the one with the same ID.
     *
     * @return ID of the stored scenario
     */
    CompletableFuture<String> saveScenario(@NotNull TestScenario scenario);

    CompletableFuture<Optional<TestScenario>> getScenario(@NotNull String scenarioId);

    /**
     * Returns all scenarios of a project, oldest first.
     */
    CompletableFuture<List<TestScenario>> getScenariosByProject(@NotNull String projectId);

    CompletableFuture<List<TestScenario>> searchScenarios(@NotNull ScenarioSearchCriteria criteria);

    /**
     * Replaces an existing scenario with the given one as is. Applying the same update twice yields the same state.
     *
     * @return {@code false} if no scenario with that ID exists
     */
    CompletableFuture<Boolean> updateScenario(@NotNull TestScenario scenario);

    /**
     * Deletes the scenario together with its results.
     *
     * @return {@code false} if no scenario with that ID exists
     */
    CompletableFuture<Boolean> deleteScenario(@NotNull String scenarioId);

    /**
     * Appends a completed result to its scenario's execution history.
     *
     * @return ID of the stored result
     */
    CompletableFuture<String> saveResult(@NotNull TestResult result);

    /**
     * Returns the execution history of a scenario, newest first.
     */
    CompletableFuture<List<TestResult>> getResults(@NotNull String scenarioId);

    CompletableFuture<List<TestResult>> searchResults(@NotNull ResultSearchCriteria criteria);

    /**
     * Aggregates the results of a project's scenarios which started within {@code [from, to]}.
     */
    CompletableFuture<TestStatistics> getTestStatistics(@NotNull String projectId, @NotNull Instant from,
                                                        @NotNull Instant to);

    /**
     * Removes all results which started strictly before the cutoff. Scenarios are never removed.
     *
     * @return number of removed results
     */
    CompletableFuture<Integer> archiveOldResults(@NotNull Instant olderThan);
}
