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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.storytest.dto.ExecutorValidationResult;
import org.tarik.storytest.dto.HealthCheckResult;
import org.tarik.storytest.dto.StepResult;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.model.ParameterValue;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.model.TestStep;
import org.tarik.storytest.model.TestType;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tarik.storytest.model.TestType.API;
import static org.tarik.storytest.model.TestType.UI;

@DisplayName("BaseTestExecutor Tests")
class BaseTestExecutorTest {
    private RecordingExecutor executor;

    static class RecordingExecutor extends BaseTestExecutor {
        final List<String> executedTargets = new CopyOnWriteArrayList<>();
        final AtomicBoolean afterExecutionCalled = new AtomicBoolean();
        final BiFunction<TestStep, ExecutionContext, StepOutcome> behaviour;
        boolean healthy = true;

        RecordingExecutor(BiFunction<TestStep, ExecutionContext, StepOutcome> behaviour) {
            super("recording-executor", Set.of(UI), 2);
            this.behaviour = behaviour;
        }

        @Override
        protected StepOutcome executeStep(@NotNull TestStep step, @NotNull ExecutionContext context) {
            executedTargets.add(step.target());
            return behaviour.apply(step, context);
        }

        @Override
        protected boolean isHealthy() {
            return healthy;
        }

        @Override
        protected Set<String> getSupportedActions() {
            return Set.of("navigate", "click", "enter_text", "verify");
        }

        @Override
        protected void afterExecution(@NotNull ExecutionContext context) {
            afterExecutionCalled.set(true);
        }
    }

    private static TestStep step(int order, String action, String target) {
        return TestStep.builder().order(order).action(action).target(target).build();
    }

    private static TestScenario scenario(List<TestStep> steps) {
        return TestScenario.builder().title("Flow").projectId("p1").steps(steps).build();
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.cleanup();
        }
    }

    private RecordingExecutor newExecutor(BiFunction<TestStep, ExecutionContext, StepOutcome> behaviour) {
        executor = new RecordingExecutor(behaviour);
        assertThat(executor.initialize(Map.of())).isTrue();
        return executor;
    }

    @Test
    @DisplayName("Should run enabled steps in order and pass")
    void shouldRunStepsInOrder() {
        // Given
        newExecutor((step, context) -> StepOutcome.success(step.target()));
        TestScenario scenario = scenario(List.of(step(2, "click", "#second"), step(1, "navigate", "/first"),
                step(3, "click", "#disabled").toBuilder().enabled(false).build()));

        // When
        TestResult result = executor.executeTest(scenario).join();

        // Then
        assertThat(result.isCompleted()).isTrue();
        assertThat(result.isPassed()).isTrue();
        assertThat(result.getExecutedBy()).isEqualTo("recording-executor");
        assertThat(result.getScenarioId()).isEqualTo(scenario.id());
        assertThat(executor.executedTargets).containsExactly("/first", "#second");
        assertThat(result.getStepResults()).extracting(StepResult::actualResult).containsExactly("/first", "#second");
        assertThat(executor.afterExecutionCalled).isTrue();
    }

    @Test
    @DisplayName("Should stop at the first failed required step")
    void shouldStopAtRequiredFailure() {
        // Given
        newExecutor((step, context) -> step.target().equals("#broken")
                ? StepOutcome.failure("Element not found", null) : StepOutcome.success(null));
        TestScenario scenario = scenario(List.of(step(1, "navigate", "/"), step(2, "click", "#broken"),
                step(3, "click", "#never")));

        // When
        TestResult result = executor.executeTest(scenario).join();

        // Then
        assertThat(result.isPassed()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Test failed at step: click #broken");
        assertThat(executor.executedTargets).containsExactly("/", "#broken");
    }

    @Test
    @DisplayName("Should continue after a failed optional step")
    void shouldContinueAfterOptionalFailure() {
        // Given
        newExecutor((step, context) -> step.target().equals("#banner")
                ? StepOutcome.failure("Banner missing", null) : StepOutcome.success(null));
        TestScenario scenario = scenario(List.of(
                step(1, "click", "#banner").toBuilder().continueOnFailure(true).build(),
                step(2, "click", "#next")));

        // When
        TestResult result = executor.executeTest(scenario).join();

        // Then
        assertThat(result.isPassed()).isTrue();
        assertThat(result.getStepResults()).extracting(StepResult::passed).containsExactly(false, true);
    }

    @Test
    @DisplayName("Step exceptions should become failed steps")
    void shouldTurnStepExceptionIntoFailure() {
        // Given
        newExecutor((step, context) -> {
            throw new IllegalStateException("Driver crashed");
        });

        // When
        TestResult result = executor.executeTest(scenario(List.of(step(1, "click", "#a")))).join();

        // Then
        assertThat(result.isPassed()).isFalse();
        assertThat(result.getStepResults().get(0).message()).isEqualTo("Step execution failed: Driver crashed");
    }

    @Test
    @DisplayName("Step exceeding its timeout should fail")
    void shouldFailStepOnTimeout() {
        // Given
        newExecutor((step, context) -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StepOutcome.success(null);
        });
        TestStep slowStep = step(1, "click", "#slow").toBuilder().timeout(Duration.ofMillis(5)).build();

        // When
        TestResult result = executor.executeTest(scenario(List.of(slowStep))).join();

        // Then
        assertThat(result.isPassed()).isFalse();
        assertThat(result.getStepResults().get(0).message()).startsWith("Step exceeded its timeout of 5 ms");
    }

    @Test
    @DisplayName("Errors thrown by a step should fail the run instead of leaving it pending")
    void shouldCompleteExceptionallyOnStepError() {
        // Given
        newExecutor((step, context) -> {
            throw new AssertionError("Driver assertion");
        });

        // When
        CompletableFuture<TestResult> run = executor.executeTest(scenario(List.of(step(1, "click", "#a"))));

        // Then
        assertThatThrownBy(() -> run.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(AssertionError.class)
                .hasRootCauseMessage("Driver assertion");
    }

    @Test
    @DisplayName("Scenario exceeding its timeout should fail and skip the remaining steps")
    void shouldStopWhenScenarioTimesOut() {
        // Given
        newExecutor((step, context) -> {
            if (step.target().equals("#slow")) {
                try {
                    Thread.sleep(150);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return StepOutcome.success(null);
        });
        TestScenario scenario = scenario(List.of(step(1, "click", "#slow"), step(2, "click", "#skipped")))
                .toBuilder()
                .timeout(Duration.ofMillis(50))
                .build();

        // When
        TestResult result = executor.executeTest(scenario).join();

        // Then
        assertThat(result.isPassed()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Scenario exceeded its timeout of 50 ms");
        assertThat(result.getStepResults()).extracting(StepResult::passed).containsExactly(true);
        assertThat(executor.executedTargets).containsExactly("#slow");
    }

    @Test
    @DisplayName("Placeholders should be resolved from test data and variables set by steps")
    void shouldResolveVariables() {
        // Given
        newExecutor((step, context) -> {
            if (step.normalizedAction().equals("navigate")) {
                context.setVariable("token", ParameterValue.of("abc"));
                return StepOutcome.success(null);
            }
            return StepOutcome.success(BaseTestExecutor.resolveParameter(step, "value", context).orElse(null));
        });
        TestScenario scenario = scenario(List.of(step(1, "navigate", "/"),
                step(2, "enter_text", "#field").toBuilder().parameter("value", "{{user}}:{{token}}:{{unknown}}")
                        .build()))
                .toBuilder()
                .testData(Map.of("user", ParameterValue.of("jane")))
                .build();

        // When
        TestResult result = executor.executeTest(scenario).join();

        // Then
        assertThat(result.getStepResults().get(1).actualResult()).isEqualTo("jane:abc:{{unknown}}");
    }

    @Test
    @DisplayName("Cancelling the run should stop further steps and still clean up")
    void shouldStopOnCancellation() throws InterruptedException {
        // Given
        CountDownLatch firstStepStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        newExecutor((step, context) -> {
            firstStepStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StepOutcome.success(null);
        });
        TestScenario scenario = scenario(List.of(step(1, "click", "#a"), step(2, "click", "#b")));

        // When
        CompletableFuture<TestResult> run = executor.executeTest(scenario);
        assertThat(firstStepStarted.await(5, TimeUnit.SECONDS)).isTrue();
        run.cancel(true);
        release.countDown();

        // Then
        assertThat(run).isCancelled();
        long deadline = System.currentTimeMillis() + 5000;
        while (!executor.afterExecutionCalled.get() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(executor.afterExecutionCalled).isTrue();
        assertThat(executor.executedTargets).containsExactly("#a");
    }

    @Test
    @DisplayName("Validation should report unsupported types, actions and missing parameters")
    void shouldValidateScenario() {
        // Given
        newExecutor((step, context) -> StepOutcome.success(null));
        TestScenario scenario = scenario(List.of(step(1, "drag", "#a"), step(2, "enter_text", "#b")))
                .toBuilder().type(API).build();

        // When
        ExecutorValidationResult validation = executor.validateScenario(scenario);

        // Then
        assertThat(validation.canExecute()).isFalse();
        assertThat(validation.messages()).containsExactly(
                "Executor 'recording-executor' does not support test type 'API'",
                "Action 'drag' is not supported by executor 'recording-executor'",
                "Text input actions require a 'value' parameter");
    }

    @Test
    @DisplayName("Health check and capabilities should reflect the executor")
    void shouldReportHealthAndCapabilities() {
        // Given
        newExecutor((step, context) -> StepOutcome.success(null));
        executor.healthy = false;

        // When
        HealthCheckResult health = executor.performHealthCheck().join();

        // Then
        assertThat(health.healthy()).isFalse();
        assertThat(health.message()).isEqualTo("Executor 'recording-executor' reported an unhealthy state");
        assertThat(executor.getCapabilities().supportedTypes()).containsExactly(UI);
        assertThat(executor.getCapabilities().maxParallelExecutions()).isEqualTo(2);
        assertThat(executor.canExecute(TestType.UI)).isTrue();
        assertThat(executor.canExecute(API)).isFalse();
    }

    @Test
    @DisplayName("Health check should answer while all step threads are busy")
    void shouldCheckHealthWhileStepThreadsAreBusy() throws Exception {
        // Given
        CountDownLatch stepsStarted = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        newExecutor((step, context) -> {
            stepsStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StepOutcome.success(null);
        });
        CompletableFuture<TestResult> firstRun = executor.executeTest(scenario(List.of(step(1, "click", "#a"))));
        CompletableFuture<TestResult> secondRun = executor.executeTest(scenario(List.of(step(1, "click", "#b"))));
        assertThat(stepsStarted.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            // When
            HealthCheckResult health = executor.performHealthCheck().get(1, TimeUnit.SECONDS);

            // Then
            assertThat(health.healthy()).isTrue();
        } finally {
            release.countDown();
        }
        assertThat(firstRun.join().isPassed()).isTrue();
        assertThat(secondRun.join().isPassed()).isTrue();
    }

    @Test
    @DisplayName("Action classification should follow the action vocabularies")
    void shouldClassifyActions() {
        assertThat(BaseTestExecutor.isUiAction("CLICK")).isTrue();
        assertThat(BaseTestExecutor.isApiAction("api_get")).isTrue();
        assertThat(BaseTestExecutor.isApiAction("verify_status_code")).isTrue();
        assertThat(BaseTestExecutor.isApiAction("extract_value")).isTrue();
        assertThat(BaseTestExecutor.isUiAction(null)).isFalse();
        assertThat(BaseTestExecutor.isApiAction("navigate")).isFalse();
    }
}
