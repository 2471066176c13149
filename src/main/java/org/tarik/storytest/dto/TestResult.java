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

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.storytest.model.TestEnvironment;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.time.Instant.now;
import static org.tarik.storytest.utils.CommonUtils.isBlank;

/**
 * Result of a single scenario execution.
 * <p>
 * An executor creates the result with {@link #start}, appends one {@link StepResult} per executed step and calls
 * {@link #complete()} exactly once. A completed result is immutable, any further mutation attempt throws
 * {@link IllegalStateException}.
 */
public class TestResult {
    private static final String SUCCESS_MESSAGE = "All test steps completed successfully";
    private static final String FAILURE_MESSAGE = "One or more required steps failed";

    private final String id;
    private final String scenarioId;
    private final TestEnvironment environment;
    private final String executedBy;
    private final Instant startedAt;
    private final List<String> executionTags;
    private final List<StepResult> stepResults = new ArrayList<>();
    private Instant completedAt;
    private boolean passed;
    private String message;
    private String failureReason;
    private int retryAttempts;

    private TestResult(String id, String scenarioId, TestEnvironment environment, String executedBy,
                       Instant startedAt, List<String> executionTags) {
        this.id = id;
        this.scenarioId = scenarioId;
        this.environment = environment;
        this.executedBy = executedBy;
        this.startedAt = startedAt;
        this.executionTags = List.copyOf(executionTags);
    }

    public static TestResult start(@NotNull String scenarioId, @NotNull TestEnvironment environment,
                                   @NotNull String executedBy) {
        return start(scenarioId, environment, executedBy, now(), List.of());
    }

    public static TestResult start(@NotNull String scenarioId, @NotNull TestEnvironment environment,
                                   @NotNull String executedBy, @NotNull Instant startedAt,
                                   @NotNull List<String> executionTags) {
        checkArgument(!isBlank(scenarioId), "Scenario ID must be provided");
        return new TestResult(UUID.randomUUID().toString(), scenarioId, environment, executedBy, startedAt,
                executionTags);
    }

    /**
     * Appends the result of an executed step. A failed required step marks the whole result as failing and, if no
     * message has been set yet, names that step in the message.
     */
    public synchronized void addStepResult(@NotNull StepResult stepResult) {
        checkNotCompleted();
        stepResults.add(stepResult);
        if (!stepResult.passed() && stepResult.required() && isBlank(message)) {
            message = "Test failed at step: %s".formatted(stepResult.stepName());
        }
    }

    /**
     * Records a failure which is not attributable to a single step, e.g. an exhausted scenario timeout. The result
     * will not pass regardless of its step results.
     */
    public synchronized void fail(@NotNull String reason) {
        checkNotCompleted();
        this.failureReason = reason;
        this.message = reason;
    }

    public synchronized void complete() {
        complete(now());
    }

    public synchronized void complete(@NotNull Instant completionTime) {
        checkNotCompleted();
        checkArgument(!completionTime.isBefore(startedAt), "Completion time %s is before the start time %s",
                completionTime, startedAt);
        this.completedAt = completionTime;
        this.passed = failureReason == null && stepResults.stream()
                .filter(StepResult::required)
                .allMatch(StepResult::passed);
        if (passed) {
            message = SUCCESS_MESSAGE;
        } else if (isBlank(message)) {
            message = FAILURE_MESSAGE;
        }
    }

    /**
     * Returns a completed copy of this result carrying the number of retries that preceded it.
     */
    public synchronized TestResult withRetryAttempts(int attempts) {
        checkState(isCompleted(), "Retry attempts can only be recorded on a completed result");
        var copy = new TestResult(id, scenarioId, environment, executedBy, startedAt, executionTags);
        copy.stepResults.addAll(stepResults);
        copy.completedAt = completedAt;
        copy.passed = passed;
        copy.message = message;
        copy.failureReason = failureReason;
        copy.retryAttempts = attempts;
        return copy;
    }

    public synchronized boolean isCompleted() {
        return completedAt != null;
    }

    public String getId() {
        return id;
    }

    public String getScenarioId() {
        return scenarioId;
    }

    public TestEnvironment getEnvironment() {
        return environment;
    }

    public String getExecutedBy() {
        return executedBy;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized @Nullable Instant getCompletedAt() {
        return completedAt;
    }

    /**
     * Returns the elapsed time between start and completion, or {@link Duration#ZERO} while still running.
     */
    public synchronized Duration getDuration() {
        return completedAt == null ? Duration.ZERO : Duration.between(startedAt, completedAt);
    }

    public synchronized boolean isPassed() {
        return passed;
    }

    public synchronized String getMessage() {
        return message;
    }

    public List<String> getExecutionTags() {
        return executionTags;
    }

    public synchronized List<StepResult> getStepResults() {
        return List.copyOf(stepResults);
    }

    public synchronized int getRetryAttempts() {
        return retryAttempts;
    }

    @JsonIgnore
    public synchronized Optional<StepResult> getFirstFailure() {
        return stepResults.stream().filter(stepResult -> !stepResult.passed()).findFirst();
    }

    /**
     * Returns the percentage of passed steps, 0 if no step has been executed.
     */
    public synchronized double getSuccessRate() {
        if (stepResults.isEmpty()) {
            return 0;
        }
        long passedSteps = stepResults.stream().filter(StepResult::passed).count();
        return passedSteps * 100.0 / stepResults.size();
    }

    private void checkNotCompleted() {
        checkState(completedAt == null, "Test result %s has already been completed", id);
    }

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("============================================================\n");
        sb.append("Scenario: ").append(scenarioId).append("\n");
        sb.append("Execution Result: ").append(completedAt == null ? "RUNNING" : passed ? "PASSED" : "FAILED")
                .append("\n");
        if (message != null) {
            sb.append("Message: ").append(message).append("\n");
        }
        sb.append("Executed By: ").append(executedBy).append(" in ").append(environment).append("\n");
        sb.append("Start Time: ").append(startedAt).append("\n");
        sb.append("End Time: ").append(completedAt != null ? completedAt.toString() : "N/A").append("\n");
        if (retryAttempts > 0) {
            sb.append("Retries: ").append(retryAttempts).append("\n");
        }
        sb.append("============================================================\n");
        if (stepResults.isEmpty()) {
            sb.append("  - No steps were executed.\n");
        } else {
            for (int i = 0; i < stepResults.size(); i++) {
                sb.append("\n[Step ").append(i + 1).append("]\n");
                sb.append("  ").append(stepResults.get(i).toString().replaceAll("\n", "\n  ")).append("\n");
            }
        }
        sb.append("====================== End of Test =======================");
        return sb.toString();
    }
}
