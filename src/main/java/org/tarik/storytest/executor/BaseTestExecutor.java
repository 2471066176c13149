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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.storytest.dto.ExecutorCapabilities;
import org.tarik.storytest.dto.ExecutorValidationResult;
import org.tarik.storytest.dto.HealthCheckResult;
import org.tarik.storytest.dto.StepResult;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.model.ParameterValue;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.model.TestStep;
import org.tarik.storytest.model.TestType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.time.Instant.now;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.tarik.storytest.StoryTestConfig.getExecutorThreadPoolSize;
import static org.tarik.storytest.utils.CommonUtils.isBlank;
import static org.tarik.storytest.utils.CommonUtils.sleepMillis;

/**
 * Common part of all executors: runs the enabled steps of a scenario in order on the executor's own thread pool,
 * honouring waits, step and scenario timeouts, continue-on-failure flags and cancellation.
 * <p>
 * Subclasses only implement {@link #executeStep(TestStep, ExecutionContext)} and {@link #isHealthy()}, and may hook
 * into the per-test lifecycle with {@link #beforeExecution(ExecutionContext)} and
 * {@link #afterExecution(ExecutionContext)}. The latter always runs, including after a cancellation.
 */
public abstract class BaseTestExecutor implements TestExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(BaseTestExecutor.class);

    public static final Set<String> UI_ACTIONS = Set.of("navigate", "click", "double_click", "right_click", "hover",
            "enter_text", "clear_text", "select_option", "select_checkbox", "upload_file", "switch_frame",
            "switch_window", "scroll", "verify_text", "verify_element", "verify_attribute", "take_screenshot",
            "execute_script", "drag_drop");
    private static final Set<String> API_SPECIAL_ACTIONS = Set.of("extract_value", "set_variable");

    private final String name;
    private final Set<TestType> supportedTypes;
    private final int maxParallelExecutions;
    private final ExecutorService stepExecutor;
    private final ExecutorService healthCheckExecutor;
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    protected BaseTestExecutor(@NotNull String name, @NotNull Set<TestType> supportedTypes) {
        this(name, supportedTypes, getExecutorThreadPoolSize());
    }

    protected BaseTestExecutor(@NotNull String name, @NotNull Set<TestType> supportedTypes,
                               int maxParallelExecutions) {
        this.name = name;
        this.supportedTypes = Set.copyOf(supportedTypes);
        this.maxParallelExecutions = maxParallelExecutions;
        this.stepExecutor = Executors.newFixedThreadPool(maxParallelExecutions);
        this.healthCheckExecutor = Executors.newSingleThreadExecutor();
    }

    /**
     * Performs the action of a single step.
     *
     * @return outcome of the action. Failed assertions must be reported as a failed outcome, not as an exception.
     */
    protected abstract StepOutcome executeStep(@NotNull TestStep step, @NotNull ExecutionContext context);

    protected abstract boolean isHealthy();

    /**
     * Actions this executor understands. Used by the pre-flight validation and reported as part of the capabilities.
     */
    protected abstract Set<String> getSupportedActions();

    protected void beforeExecution(@NotNull ExecutionContext context) {
    }

    protected void afterExecution(@NotNull ExecutionContext context) {
    }

    protected Optional<String> captureScreenshot(@NotNull TestStep step, @NotNull ExecutionContext context) {
        return Optional.empty();
    }

    protected boolean onInitialize(@NotNull Map<String, ParameterValue> configuration) {
        return true;
    }

    protected void onCleanup() {
    }

    @Override
    public @NotNull String getName() {
        return name;
    }

    @Override
    public boolean canExecute(@NotNull TestType testType) {
        return supportedTypes.contains(testType);
    }

    @Override
    public @NotNull CompletableFuture<TestResult> executeTest(@NotNull TestScenario scenario) {
        CompletableFuture<TestResult> resultFuture = new CompletableFuture<>();
        Future<?> worker = stepExecutor.submit(() -> runScenario(scenario, resultFuture));
        resultFuture.whenComplete((result, error) -> {
            if (resultFuture.isCancelled()) {
                LOG.info("Execution of scenario '{}' by '{}' was cancelled", scenario.id(), name);
                worker.cancel(true);
            }
        });
        return resultFuture;
    }

    private void runScenario(TestScenario scenario, CompletableFuture<TestResult> resultFuture) {
        var context = new ExecutionContext(scenario);
        var result = TestResult.start(scenario.id(), scenario.environment(), name, context.getStartedAt(),
                List.of(name, scenario.type().name()));
        LOG.info("Starting execution of scenario '{}' ({}) by '{}'", scenario.title(), scenario.id(), name);
        try {
            beforeExecution(context);
            for (TestStep step : scenario.getExecutableSteps()) {
                if (Thread.currentThread().isInterrupted() || resultFuture.isDone()) {
                    LOG.info("Stopping execution of scenario '{}' before step {}", scenario.id(), step.order());
                    resultFuture.completeExceptionally(new IllegalStateException(
                            "Execution of scenario '%s' was interrupted".formatted(scenario.id())));
                    return;
                }
                if (context.isScenarioTimedOut()) {
                    result.fail("Scenario exceeded its timeout of %d ms".formatted(scenario.timeout().toMillis()));
                    break;
                }
                var stepResult = runStep(step, context);
                result.addStepResult(stepResult);
                if (!stepResult.passed() && !step.continueOnFailure()) {
                    LOG.warn("Step {} of scenario '{}' failed, stopping execution", step.order(), scenario.id());
                    break;
                }
            }
            result.complete();
            LOG.info("Execution of scenario '{}' completed. Passed: {}", scenario.id(), result.isPassed());
            resultFuture.complete(result);
        } catch (Throwable e) {
            // Errors too, the worker's own future is never read
            if (resultFuture.isCancelled()) {
                LOG.info("Execution of scenario '{}' stopped after cancellation", scenario.id());
            } else {
                LOG.error("Executor '{}' failed while running scenario '{}'", name, scenario.id(), e);
                resultFuture.completeExceptionally(e);
            }
        } finally {
            try {
                afterExecution(context);
            } catch (RuntimeException e) {
                LOG.error("Cleanup after scenario '{}' failed in executor '{}'", scenario.id(), name, e);
            }
        }
    }

    private StepResult runStep(TestStep step, ExecutionContext context) {
        Instant startedAt = now();
        try {
            sleepMillis(step.waitBefore().toMillis());
            StepOutcome outcome = executeStep(step, context);
            Duration elapsed = Duration.between(startedAt, now());
            String screenshot = step.takeScreenshot() ? captureScreenshot(step, context).orElse(null) : null;
            if (step.timeout() != null && elapsed.compareTo(step.timeout()) > 0) {
                return StepResult.failed(step, startedAt, "Step exceeded its timeout of %d ms (took %d ms)"
                        .formatted(step.timeout().toMillis(), elapsed.toMillis()), outcome.actualResult(), screenshot);
            }
            if (!outcome.passed()) {
                String message = isBlank(outcome.message()) ? "Step '%s' failed".formatted(step.getDisplayName())
                        : outcome.message();
                return StepResult.failed(step, startedAt, message, outcome.actualResult(), screenshot);
            }
            sleepMillis(step.waitAfter().toMillis());
            return StepResult.passed(step, startedAt, outcome.actualResult(), screenshot);
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            LOG.warn("Step {} ({}) threw an exception", step.order(), step.action(), e);
            return StepResult.failed(step, startedAt, "Step execution failed: %s".formatted(e.getMessage()), null,
                    null);
        }
    }

    @Override
    public @NotNull ExecutorValidationResult validateScenario(@NotNull TestScenario scenario) {
        List<String> problems = new ArrayList<>();
        if (!canExecute(scenario.type())) {
            problems.add("Executor '%s' does not support test type '%s'".formatted(name, scenario.type()));
        }
        if (scenario.getExecutableSteps().isEmpty()) {
            problems.add("Scenario has no enabled steps");
        }
        Set<String> supportedActions = getSupportedActions();
        for (TestStep step : scenario.getExecutableSteps()) {
            String action = step.normalizedAction();
            if (!supportedActions.contains(action)) {
                problems.add("Action '%s' is not supported by executor '%s'".formatted(step.action(), name));
            } else if (isUiAction(action)) {
                problems.addAll(validateUiStep(step));
            } else if (isApiAction(action)) {
                problems.addAll(validateApiStep(step));
            }
        }
        return ExecutorValidationResult.from(problems);
    }

    @Override
    public @NotNull ExecutorCapabilities getCapabilities() {
        return new ExecutorCapabilities(supportedTypes, getSupportedActions(), maxParallelExecutions,
                supportsScreenshots(), false);
    }

    protected boolean supportsScreenshots() {
        return false;
    }

    @Override
    public @NotNull CompletableFuture<HealthCheckResult> performHealthCheck() {
        return CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            boolean healthy = isHealthy();
            Duration responseTime = Duration.ofNanos(System.nanoTime() - start);
            String message = healthy ? "Executor '%s' is healthy".formatted(name)
                    : "Executor '%s' reported an unhealthy state".formatted(name);
            return new HealthCheckResult(healthy, message, responseTime);
        }, healthCheckExecutor);
    }

    @Override
    public boolean initialize(@NotNull Map<String, ParameterValue> configuration) {
        if (!initialized.compareAndSet(false, true)) {
            LOG.warn("Executor '{}' is already initialized", name);
            return true;
        }
        boolean success = onInitialize(configuration);
        if (!success) {
            initialized.set(false);
        }
        return success;
    }

    @Override
    public void cleanup() {
        if (initialized.compareAndSet(true, false)) {
            try {
                onCleanup();
            } finally {
                healthCheckExecutor.shutdownNow();
                stepExecutor.shutdownNow();
                try {
                    if (!stepExecutor.awaitTermination(5, SECONDS)) {
                        LOG.warn("Executor '{}' did not terminate in time", name);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    public static boolean isUiAction(String action) {
        return action != null && UI_ACTIONS.contains(action.toLowerCase());
    }

    public static boolean isApiAction(String action) {
        if (action == null) {
            return false;
        }
        String normalized = action.toLowerCase();
        return normalized.startsWith("api_") || normalized.startsWith("verify_")
                || API_SPECIAL_ACTIONS.contains(normalized);
    }

    protected static List<String> validateUiStep(TestStep step) {
        List<String> errors = new ArrayList<>();
        if (isBlank(step.target())) {
            errors.add("UI step '%s' requires a target element".formatted(step.action()));
        }
        switch (step.normalizedAction()) {
            case "enter_text", "type" -> requireParameter(step, "value",
                    "Text input actions require a 'value' parameter", errors);
            case "select_option" -> requireParameter(step, "option",
                    "Select option actions require an 'option' parameter", errors);
            case "upload_file" -> requireParameter(step, "filePath",
                    "File upload actions require a 'filePath' parameter", errors);
            default -> {
                // No action-specific parameters
            }
        }
        return errors;
    }

    protected static List<String> validateApiStep(TestStep step) {
        List<String> errors = new ArrayList<>();
        String action = step.normalizedAction();
        if (action.startsWith("api_") && isBlank(step.target())) {
            errors.add("API step '%s' requires a target URL".formatted(step.action()));
        }
        switch (action) {
            case "api_post", "api_put", "api_patch" -> requireParameter(step, "body",
                    "HTTP POST/PUT/PATCH actions require a 'body' parameter", errors);
            case "verify_status_code" -> requireParameter(step, "expectedCode",
                    "Status code verification requires an 'expectedCode' parameter", errors);
            case "verify_header" -> requireParameter(step, "headerName",
                    "Header verification requires a 'headerName' parameter", errors);
            default -> {
                // No action-specific parameters
            }
        }
        return errors;
    }

    /**
     * Returns the text of a step parameter with context variables substituted.
     */
    protected static Optional<String> resolveParameter(TestStep step, String key, ExecutionContext context) {
        return step.getParameterValue(key)
                .map(ParameterValue::asText)
                .map(context::resolve);
    }

    private static void requireParameter(TestStep step, String key, String message, List<String> errors) {
        if (!step.hasParameter(key)) {
            errors.add(message);
        }
    }
}
