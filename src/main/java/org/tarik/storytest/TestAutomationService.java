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
package org.tarik.storytest;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.storytest.dto.HealthCheckResult;
import org.tarik.storytest.dto.ScenarioValidationResult;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.dto.TestStatistics;
import org.tarik.storytest.error.RetryPolicy;
import org.tarik.storytest.error.RetryState;
import org.tarik.storytest.exceptions.NoExecutorException;
import org.tarik.storytest.exceptions.PersistenceException;
import org.tarik.storytest.exceptions.ScenarioGenerationException;
import org.tarik.storytest.exceptions.ScenarioNotFoundException;
import org.tarik.storytest.exceptions.ScenarioValidationException;
import org.tarik.storytest.exceptions.TestAutomationException;
import org.tarik.storytest.exceptions.TestExecutionException;
import org.tarik.storytest.executor.ExecutorRegistry;
import org.tarik.storytest.executor.TestExecutor;
import org.tarik.storytest.generator.AiScenarioGenerator;
import org.tarik.storytest.generator.RuleBasedScenarioGenerator;
import org.tarik.storytest.generator.ScenarioGenerator;
import org.tarik.storytest.manager.ExecutionSlotManager;
import org.tarik.storytest.model.ParameterValue;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.repository.InMemoryTestRepository;
import org.tarik.storytest.repository.ResultSearchCriteria;
import org.tarik.storytest.repository.ScenarioSearchCriteria;
import org.tarik.storytest.repository.TestRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static java.time.Instant.now;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.tarik.storytest.StoryTestConfig.GeneratorMode.AI;
import static org.tarik.storytest.StoryTestConfig.*;
import static org.tarik.storytest.model.TestStatus.DRAFT;
import static org.tarik.storytest.model.TestStatus.VALIDATED;
import static org.tarik.storytest.utils.CommonUtils.unwrapAsyncFailure;

/**
 * Entry point of the framework: turns user stories into persisted scenarios, dispatches scenarios to executors and
 * exposes the execution history.
 * <p>
 * Every operation returns a {@link CompletableFuture}. Failures complete the future exceptionally with a
 * {@link TestAutomationException} subclass. Cancelling a future returned by an execution operation cancels the
 * executor run which is in flight.
 */
public class TestAutomationService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TestAutomationService.class);
    private static final int POOL_TERMINATION_TIMEOUT_SECONDS = 5;

    private final ScenarioGenerator scenarioGenerator;
    private final TestRepository repository;
    private final ExecutorRegistry executorRegistry;
    private final ExecutorService workerPool;

    public TestAutomationService(@NotNull ScenarioGenerator scenarioGenerator, @NotNull TestRepository repository,
                                 @NotNull ExecutorRegistry executorRegistry) {
        this(scenarioGenerator, repository, executorRegistry,
                Executors.newFixedThreadPool(getExecutionThreadPoolSize()));
    }

    public TestAutomationService(@NotNull ScenarioGenerator scenarioGenerator, @NotNull TestRepository repository,
                                 @NotNull ExecutorRegistry executorRegistry, @NotNull ExecutorService workerPool) {
        this.scenarioGenerator = scenarioGenerator;
        this.repository = repository;
        this.executorRegistry = executorRegistry;
        this.workerPool = workerPool;
    }

    /**
     * Creates a service with an in-memory repository and the generator selected by {@code generator.mode}.
     */
    public static TestAutomationService createDefault(@NotNull ExecutorRegistry executorRegistry) {
        ScenarioGenerator generator = getGeneratorMode() == AI
                ? AiScenarioGenerator.createFromConfig()
                : new RuleBasedScenarioGenerator();
        LOG.info("Using {} scenario generator", generator.getClass().getSimpleName());
        return new TestAutomationService(generator, new InMemoryTestRepository(), executorRegistry);
    }

    // Scenario creation and maintenance

    /**
     * Generates a scenario from the user story, validates it and stores it under the given project.
     *
     * @return ID of the stored scenario
     */
    public CompletableFuture<String> createFromUserStory(@Nullable String userStory, @Nullable String projectId,
                                                         @Nullable String projectContext) {
        return generate(() -> scenarioGenerator.generate(userStory, projectContext), "generate a test scenario")
                .thenApply(scenario -> {
                    if (scenario == null) {
                        throw new ScenarioGenerationException("Generator returned no scenario for the user story",
                                null);
                    }
                    Instant creationTime = now();
                    return scenario.toBuilder()
                            .projectId(projectId)
                            .createdAt(creationTime)
                            .updatedAt(creationTime)
                            .build();
                })
                .thenApply(TestAutomationService::requireValid)
                .thenCompose(scenario -> persist(() -> repository.saveScenario(scenario),
                        "save scenario '%s'".formatted(scenario.title()))
                        .thenApply(scenarioId -> {
                            LOG.info("Created {} scenario '{}' ({}) with {} steps in project '{}'", scenario.type(),
                                    scenario.title(), scenarioId, scenario.steps().size(), projectId);
                            return scenarioId;
                        }));
    }

    /**
     * Replaces the steps of the scenario with the ones reworked according to the feedback.
     */
    public CompletableFuture<TestScenario> refineTestScenario(@NotNull String scenarioId, @Nullable String feedback) {
        return loadScenario(scenarioId)
                .thenCompose(scenario -> generate(() -> scenarioGenerator.refineSteps(scenario.steps(), feedback),
                        "refine scenario '%s'".formatted(scenarioId))
                        .thenApply(refinedSteps -> scenario.toBuilder()
                                .steps(refinedSteps)
                                .status(VALIDATED)
                                .updatedAt(now())
                                .build()))
                .thenApply(TestAutomationService::requireValid)
                .thenCompose(refined -> update(refined).thenApply(ignored -> refined));
    }

    public CompletableFuture<Map<String, ParameterValue>> generateTestData(@NotNull String scenarioId,
                                                                          @Nullable String requirements) {
        return loadScenario(scenarioId)
                .thenCompose(scenario -> generate(() -> scenarioGenerator.generateTestData(scenario, requirements),
                        "generate test data for scenario '%s'".formatted(scenarioId)));
    }

    public CompletableFuture<ScenarioValidationResult> validateTestScenario(@NotNull String scenarioId) {
        return loadScenario(scenarioId)
                .thenCompose(scenario -> generate(() -> scenarioGenerator.validateScenario(scenario),
                        "validate scenario '%s'".formatted(scenarioId)));
    }

    /**
     * Proposes draft scenarios covering what the project's scenarios miss. The suggestions are not stored.
     */
    public CompletableFuture<List<TestScenario>> suggestAdditionalTests(@NotNull String projectId,
                                                                        @Nullable String projectContext) {
        return getProjectTests(projectId)
                .thenCompose(existing -> generate(() -> scenarioGenerator.suggestAdditionalTests(existing,
                        projectContext), "suggest additional tests for project '%s'".formatted(projectId)))
                .thenApply(suggestions -> {
                    Instant creationTime = now();
                    return suggestions.stream()
                            .map(suggestion -> suggestion.toBuilder()
                                    .projectId(projectId)
                                    .status(DRAFT)
                                    .createdAt(creationTime)
                                    .updatedAt(creationTime)
                                    .build())
                            .toList();
                });
    }

    /**
     * Optimizes every scenario of the project and stores the optimized versions in place of the originals.
     */
    public CompletableFuture<List<TestScenario>> optimizeTestScenarios(@NotNull String projectId) {
        return getProjectTests(projectId)
                .thenCompose(scenarios -> generate(() -> scenarioGenerator.optimizeScenarios(scenarios),
                        "optimize scenarios of project '%s'".formatted(projectId)))
                .thenCompose(optimized -> {
                    var updates = optimized.stream()
                            .map(scenario -> scenario.toBuilder().updatedAt(now()).build())
                            .map(scenario -> update(scenario).thenApply(ignored -> scenario))
                            .toList();
                    return CompletableFuture.allOf(updates.toArray(CompletableFuture[]::new))
                            .thenApply(ignored -> updates.stream().map(CompletableFuture::join).toList());
                })
                .thenApply(optimized -> {
                    LOG.info("Optimized {} scenarios of project '{}'", optimized.size(), projectId);
                    return optimized;
                });
    }

    public CompletableFuture<Boolean> deleteTestScenario(@NotNull String scenarioId) {
        LOG.info("Deleting scenario '{}'", scenarioId);
        return persist(() -> repository.deleteScenario(scenarioId), "delete scenario '%s'".formatted(scenarioId));
    }

    /**
     * Stores a draft copy of the scenario with new IDs.
     *
     * @param newTitle title of the copy, the original title with a " (Copy)" suffix if blank
     * @return ID of the copy
     */
    public CompletableFuture<String> cloneTestScenario(@NotNull String scenarioId, @Nullable String newTitle) {
        return loadScenario(scenarioId)
                .thenApply(scenario -> scenario.cloneAsDraft(newTitle))
                .thenCompose(clone -> persist(() -> repository.saveScenario(clone),
                        "save clone of scenario '%s'".formatted(scenarioId)))
                .thenApply(cloneId -> {
                    LOG.info("Cloned scenario '{}' to '{}'", scenarioId, cloneId);
                    return cloneId;
                });
    }

    // Execution

    /**
     * Runs the scenario on the first registered executor supporting its type. A failed run is repeated up to the
     * scenario's retry count; only the last run is stored and returned. Executor faults are not retried.
     */
    public CompletableFuture<TestResult> executeTest(@NotNull String scenarioId) {
        CompletableFuture<TestResult> execution = new CompletableFuture<>();
        AtomicReference<CompletableFuture<TestResult>> runInFlight = new AtomicReference<>();
        execution.whenComplete((result, error) -> {
            if (execution.isCancelled()) {
                Optional.ofNullable(runInFlight.get()).ifPresent(run -> run.cancel(true));
            }
        });

        loadScenario(scenarioId)
                .thenApplyAsync(TestAutomationService::requireValid, workerPool)
                .thenCompose(scenario -> {
                    TestExecutor executor = executorRegistry.findExecutor(scenario.type())
                            .orElseThrow(() -> new NoExecutorException(scenario.type()));
                    LOG.info("Executing scenario '{}' ({}) with executor '{}'", scenario.title(), scenarioId,
                            executor.getName());
                    RetryPolicy retryPolicy = getScenarioRetryPolicy(scenario.retryCount());
                    return runWithRetries(scenario, executor, retryPolicy, new RetryState(), execution, runInFlight);
                })
                .thenCompose(result -> persist(() -> repository.saveResult(result),
                        "save result of scenario '%s'".formatted(scenarioId)).thenApply(ignored -> result))
                .whenComplete((result, error) -> {
                    if (error == null) {
                        LOG.info("Scenario '{}' finished: passed = {}, retries = {}, duration = {}", scenarioId,
                                result.isPassed(), result.getRetryAttempts(), result.getDuration());
                        execution.complete(result);
                    } else {
                        Throwable cause = unwrapAsyncFailure(error);
                        if (!execution.isCancelled()) {
                            LOG.error("Execution of scenario '{}' failed", scenarioId, cause);
                        }
                        execution.completeExceptionally(cause);
                    }
                });
        return execution;
    }

    public CompletableFuture<List<TestResult>> executeTestsParallel(@NotNull List<String> scenarioIds) {
        return executeTestsParallel(scenarioIds, getDefaultMaxConcurrency());
    }

    /**
     * Executes the scenarios with at most {@code maxConcurrency} of them running at any time. A failing execution
     * doesn't cancel the others. Once all of them finished, the future completes with the results in completion
     * order, or, if any execution failed, with the first failure carrying the remaining ones as suppressed.
     */
    public CompletableFuture<List<TestResult>> executeTestsParallel(@NotNull List<String> scenarioIds,
                                                                    int maxConcurrency) {
        if (maxConcurrency <= 0) {
            return failedFuture(new IllegalArgumentException(
                    "Max concurrency must be positive, got %d".formatted(maxConcurrency)));
        }
        ExecutionSlotManager slotManager = new ExecutionSlotManager(maxConcurrency);
        List<TestResult> results = Collections.synchronizedList(new ArrayList<>());
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<TestResult>> executions = scenarioIds.stream()
                .map(scenarioId -> slotManager.submit(() -> executeTest(scenarioId)))
                .toList();
        List<CompletableFuture<TestResult>> trackedExecutions = executions.stream()
                .map(execution -> execution.whenComplete((result, error) -> {
                    if (error == null) {
                        results.add(result);
                    } else {
                        failures.add(unwrapAsyncFailure(error));
                    }
                }))
                .toList();

        CompletableFuture<List<TestResult>> combined = CompletableFuture
                .allOf(trackedExecutions.toArray(CompletableFuture[]::new))
                .handle((ignored, error) -> {
                    LOG.info("Parallel execution of {} scenarios finished: {} succeeded, {} failed (peak concurrency {})",
                            scenarioIds.size(), results.size(), failures.size(), slotManager.getPeakActiveTasks());
                    List<Throwable> allFailures;
                    synchronized (failures) {
                        allFailures = List.copyOf(failures);
                    }
                    if (allFailures.isEmpty()) {
                        synchronized (results) {
                            return List.copyOf(results);
                        }
                    }
                    Throwable firstFailure = allFailures.get(0);
                    allFailures.stream().skip(1)
                            .filter(failure -> failure != firstFailure)
                            .forEach(firstFailure::addSuppressed);
                    throw new CompletionException(firstFailure);
                });
        combined.whenComplete((result, error) -> {
            if (combined.isCancelled()) {
                executions.forEach(execution -> execution.cancel(true));
            }
        });
        return combined;
    }

    /**
     * Probes every registered executor. A probe which fails or exceeds {@code health.check.timeout.millis} reports the
     * executor as unhealthy without affecting the others.
     *
     * @return health check results keyed by executor name, in registration order
     */
    public CompletableFuture<Map<String, HealthCheckResult>> getExecutorHealthStatus() {
        List<TestExecutor> executors = executorRegistry.getExecutors();
        ExecutionSlotManager slotManager = new ExecutionSlotManager(getHealthCheckMaxConcurrency());
        long timeoutMillis = getHealthCheckTimeoutMillis();
        List<CompletableFuture<HealthCheckResult>> checks = executors.stream()
                .map(executor -> slotManager.submit(() -> checkHealth(executor, timeoutMillis)))
                .toList();
        return CompletableFuture.allOf(checks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    Map<String, HealthCheckResult> healthStatus = new LinkedHashMap<>();
                    for (int i = 0; i < executors.size(); i++) {
                        healthStatus.put(executors.get(i).getName(), checks.get(i).join());
                    }
                    return healthStatus;
                });
    }

    /**
     * Explains the latest failed run of the scenario.
     *
     * @return the analysis, or "No failures to analyze" if the scenario has no runs or its latest run passed
     */
    public CompletableFuture<String> analyzeFailure(@NotNull String scenarioId) {
        return getTestHistory(scenarioId)
                .thenCompose(history -> {
                    if (history.isEmpty() || history.get(0).isPassed()) {
                        return completedFuture("No failures to analyze");
                    }
                    TestResult latestResult = history.get(0);
                    return generate(() -> scenarioGenerator.analyzeFailure(latestResult),
                            "analyze failure of scenario '%s'".formatted(scenarioId));
                });
    }

    // Queries

    public CompletableFuture<List<TestScenario>> getProjectTests(@NotNull String projectId) {
        return persist(() -> repository.getScenariosByProject(projectId),
                "load scenarios of project '%s'".formatted(projectId));
    }

    public CompletableFuture<List<TestScenario>> searchTests(@NotNull ScenarioSearchCriteria criteria) {
        return persist(() -> repository.searchScenarios(criteria), "search scenarios");
    }

    public CompletableFuture<List<TestResult>> searchResults(@NotNull ResultSearchCriteria criteria) {
        return persist(() -> repository.searchResults(criteria), "search results");
    }

    /**
     * Returns the runs of the scenario, newest first.
     */
    public CompletableFuture<List<TestResult>> getTestHistory(@NotNull String scenarioId) {
        return persist(() -> repository.getResults(scenarioId),
                "load results of scenario '%s'".formatted(scenarioId));
    }

    public CompletableFuture<TestStatistics> getTestStatistics(@NotNull String projectId, @NotNull Instant from,
                                                               @NotNull Instant to) {
        return persist(() -> repository.getTestStatistics(projectId, from, to),
                "calculate statistics of project '%s'".formatted(projectId));
    }

    /**
     * Removes every run which started before the cutoff.
     *
     * @return number of removed runs
     */
    public CompletableFuture<Integer> archiveOldResults(@NotNull Instant olderThan) {
        return persist(() -> repository.archiveOldResults(olderThan), "archive results older than %s"
                .formatted(olderThan));
    }

    /**
     * Cleans up the registered executors and stops the worker pool.
     */
    @Override
    public void close() {
        executorRegistry.close();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(POOL_TERMINATION_TIMEOUT_SECONDS, SECONDS)) {
                LOG.warn("Worker pool did not terminate in {} seconds, forcing shutdown",
                        POOL_TERMINATION_TIMEOUT_SECONDS);
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private CompletableFuture<TestResult> runWithRetries(TestScenario scenario, TestExecutor executor,
                                                         RetryPolicy retryPolicy, RetryState retryState,
                                                         CompletableFuture<TestResult> execution,
                                                         AtomicReference<CompletableFuture<TestResult>> runInFlight) {
        if (execution.isDone()) {
            return failedFuture(new CancellationException("Execution of scenario '%s' was cancelled"
                    .formatted(scenario.id())));
        }
        int attempt = retryState.incrementAttempts();
        CompletableFuture<TestResult> run;
        try {
            run = executor.executeTest(scenario);
        } catch (RuntimeException e) {
            run = failedFuture(e);
        }
        if (run == null) {
            run = failedFuture(new IllegalStateException("Executor returned no result"));
        }
        runInFlight.set(run);
        if (execution.isCancelled()) {
            run.cancel(true);
        }

        return run
                .handle((result, error) -> {
                    if (error != null) {
                        throw new TestExecutionException("Executor '%s' failed while running scenario '%s'"
                                .formatted(executor.getName(), scenario.id()), unwrapAsyncFailure(error));
                    }
                    if (result == null) {
                        throw new TestExecutionException("Executor '%s' returned no result for scenario '%s'"
                                .formatted(executor.getName(), scenario.id()), null);
                    }
                    if (!result.isCompleted()) {
                        result.complete();
                    }
                    return result;
                })
                .thenCompose(result -> {
                    if (result.isPassed() || attempt > retryPolicy.maxRetries() || execution.isDone()) {
                        return completedFuture(result.withRetryAttempts(attempt - 1));
                    }
                    long delayMillis = retryPolicy.getDelayBeforeRetry(attempt);
                    LOG.warn("Attempt {} of scenario '{}' failed: {}. Retrying in {} ms", attempt, scenario.id(),
                            result.getMessage(), delayMillis);
                    Executor delayedExecutor = CompletableFuture.delayedExecutor(delayMillis, MILLISECONDS, workerPool);
                    return CompletableFuture.runAsync(() -> {
                    }, delayedExecutor).thenCompose(ignored -> runWithRetries(scenario, executor, retryPolicy,
                            retryState, execution, runInFlight));
                });
    }

    private static CompletableFuture<HealthCheckResult> checkHealth(TestExecutor executor, long timeoutMillis) {
        long start = System.nanoTime();
        CompletableFuture<HealthCheckResult> check;
        try {
            check = executor.performHealthCheck();
        } catch (RuntimeException e) {
            check = failedFuture(e);
        }
        if (check == null) {
            check = failedFuture(new IllegalStateException("Executor returned no health check"));
        }
        return check
                .orTimeout(timeoutMillis, MILLISECONDS)
                .handle((health, error) -> {
                    if (error == null && health != null) {
                        return health;
                    }
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    Throwable cause = error == null
                            ? new IllegalStateException("Executor returned no health check result")
                            : unwrapAsyncFailure(error);
                    String reason = cause instanceof TimeoutException
                            ? "timed out after %d ms".formatted(timeoutMillis)
                            : cause.getMessage();
                    LOG.warn("Health check of executor '{}' failed: {}", executor.getName(), reason);
                    return HealthCheckResult.unhealthy("Health check failed: %s".formatted(reason), elapsed);
                });
    }

    private CompletableFuture<TestScenario> loadScenario(String scenarioId) {
        return persist(() -> repository.getScenario(scenarioId), "load scenario '%s'".formatted(scenarioId))
                .thenApply(scenario -> scenario.orElseThrow(() -> new ScenarioNotFoundException(scenarioId)));
    }

    private CompletableFuture<Boolean> update(TestScenario scenario) {
        return persist(() -> repository.updateScenario(scenario), "update scenario '%s'".formatted(scenario.id()))
                .thenApply(updated -> {
                    if (!updated) {
                        throw new ScenarioNotFoundException(scenario.id());
                    }
                    return true;
                });
    }

    private static TestScenario requireValid(TestScenario scenario) {
        List<String> errors = scenario.validate();
        if (!errors.isEmpty()) {
            LOG.warn("Scenario '{}' failed validation: {}", scenario.title(), errors);
            throw new ScenarioValidationException(scenario.title(), errors);
        }
        return scenario;
    }

    private <T> CompletableFuture<T> generate(Supplier<T> operation, String description) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return operation.get();
            } catch (TestAutomationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ScenarioGenerationException("Failed to %s".formatted(description), e);
            }
        }, workerPool);
    }

    private static <T> CompletableFuture<T> persist(Supplier<CompletableFuture<T>> operation, String description) {
        CompletableFuture<T> future;
        try {
            future = operation.get();
        } catch (RuntimeException e) {
            future = failedFuture(e);
        }
        return future.handle((value, error) -> {
            if (error == null) {
                return value;
            }
            Throwable cause = unwrapAsyncFailure(error);
            if (cause instanceof TestAutomationException testAutomationException) {
                throw testAutomationException;
            }
            throw new PersistenceException("Failed to %s".formatted(description), cause);
        });
    }
}
