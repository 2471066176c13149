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
package org.tarik.storytest.executor;

import org.jetbrains.annotations.NotNull;
import org.tarik.storytest.dto.ExecutorCapabilities;
import org.tarik.storytest.dto.ExecutorValidationResult;
import org.tarik.storytest.dto.HealthCheckResult;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.model.ParameterValue;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.model.TestType;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Backend able to run test scenarios of one or more {@link TestType}s, e.g. a browser driver or an HTTP client.
 * <p>
 * {@link #initialize(Map)} and {@link #cleanup()} bracket the executor's lifetime and are called once, at
 * registration and at teardown. Per-test resources are the executor's own business.
 */
public interface TestExecutor {

    @NotNull
    String getName();

    boolean canExecute(@NotNull TestType testType);

    /**
     * Runs the scenario. Failed assertions are reported through a completed {@link TestResult} which did not pass;
     * the returned future completes exceptionally only if the executor itself faults.
     * <p>
     * Cancelling the returned future stops the run. Per-test cleanup still takes place.
     */
    @NotNull
    CompletableFuture<TestResult> executeTest(@NotNull TestScenario scenario);

    /**
     * Checks, without executing anything, whether the scenario can be run by this executor.
     */
    @NotNull
    ExecutorValidationResult validateScenario(@NotNull TestScenario scenario);

    @NotNull
    ExecutorCapabilities getCapabilities();

    /**
     * Cheap liveness probe which measures its own response time.
     */
    @NotNull
    CompletableFuture<HealthCheckResult> performHealthCheck();

    /**
     * Acquires the resources the executor needs.
     *
     * @return {@code false} if the executor can't operate with the given configuration
     */
    boolean initialize(@NotNull Map<String, ParameterValue> configuration);

    void cleanup();
}
