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
package org.tarik.storytest.agents;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.storytest.error.RetryPolicy;
import org.tarik.storytest.exceptions.ScenarioNotFoundException;
import org.tarik.storytest.exceptions.TestExecutionException;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.storytest.agents.AgentExecutionResult.ExecutionStatus.ERROR;
import static org.tarik.storytest.agents.AgentExecutionResult.ExecutionStatus.SUCCESS;

class BaseAiAgentRetryTest {

    // Concrete implementation for testing default methods
    static class TestAgent implements BaseAiAgent {
        private RetryPolicy retryPolicy;

        public void setRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
        }

        @Override
        public RetryPolicy getRetryPolicy() {
            return retryPolicy;
        }
    }

    private final TestAgent agent = new TestAgent();

    @Test
    @DisplayName("Should succeed on first attempt without retries")
    void shouldSucceedOnFirstAttempt() {
        // Given
        agent.setRetryPolicy(new RetryPolicy(3, 10, 100, 2.0, 1000));
        Supplier<String> action = () -> "Success";

        // When
        AgentExecutionResult<String> result = agent.executeWithRetry(action);

        // Then
        assertThat(result.executionStatus()).isEqualTo(SUCCESS);
        assertThat(result.resultPayload()).isEqualTo("Success");
        assertThat(result.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry and succeed eventually")
    void shouldRetryAndSucceed() {
        // Given
        agent.setRetryPolicy(new RetryPolicy(3, 10, 100, 2.0, 1000));
        AtomicInteger attempts = new AtomicInteger(0);
        Supplier<String> action = () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new RuntimeException("Transient error");
            }
            return "Success";
        };

        // When
        AgentExecutionResult<String> result = agent.executeWithRetry(action);

        // Then
        assertThat(result.executionStatus()).isEqualTo(SUCCESS);
        assertThat(result.resultPayload()).isEqualTo("Success");
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should fail after max retries")
    void shouldFailAfterMaxRetries() {
        // Given
        agent.setRetryPolicy(new RetryPolicy(2, 10, 100, 2.0, 1000));
        AtomicInteger attempts = new AtomicInteger(0);
        Supplier<String> action = () -> {
            attempts.incrementAndGet();
            throw new RuntimeException("Persistent error");
        };

        // When
        AgentExecutionResult<String> result = agent.executeWithRetry(action);

        // Then
        assertThat(result.executionStatus()).isEqualTo(ERROR);
        assertThat(result.message()).isEqualTo("Persistent error");
        assertThat(result.resultPayload()).isNull();
        assertThat(attempts.get()).isEqualTo(3); // Initial + 2 retries
    }

    @Test
    @DisplayName("Should fail on timeout")
    void shouldFailOnTimeout() {
        // Given
        // Short timeout, long delay
        agent.setRetryPolicy(new RetryPolicy(10, 100, 100, 1.0, 50));
        AtomicInteger attempts = new AtomicInteger(0);
        Supplier<String> action = () -> {
            attempts.incrementAndGet();
            throw new RuntimeException("Slow error");
        };

        // When
        AgentExecutionResult<String> result = agent.executeWithRetry(action);

        // Then
        assertThat(result.executionStatus()).isEqualTo(ERROR);
        assertThat(result.message()).isEqualTo("Slow error");
        assertThat(attempts.get()).isLessThan(11);
    }

    @Test
    @DisplayName("Should not retry errors of a non-retryable category")
    void shouldNotRetryNonRetryableCategory() {
        // Given
        agent.setRetryPolicy(new RetryPolicy(3, 10, 100, 2.0, 1000));
        AtomicInteger attempts = new AtomicInteger(0);
        Supplier<String> action = () -> {
            attempts.incrementAndGet();
            throw new ScenarioNotFoundException("s-1");
        };

        // When
        AgentExecutionResult<String> result = agent.executeWithRetry(action);

        // Then
        assertThat(result.executionStatus()).isEqualTo(ERROR);
        assertThat(result.message()).isEqualTo("Test scenario with ID 's-1' was not found");
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry errors of a retryable category")
    void shouldRetryRetryableCategory() {
        // Given
        agent.setRetryPolicy(new RetryPolicy(1, 10, 100, 2.0, 1000));
        AtomicInteger attempts = new AtomicInteger(0);
        Supplier<String> action = () -> {
            attempts.incrementAndGet();
            throw new TestExecutionException("Model timed out", null);
        };

        // When
        AgentExecutionResult<String> result = agent.executeWithRetry(action);

        // Then
        assertThat(result.executionStatus()).isEqualTo(ERROR);
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should retry on predicate match")
    void shouldRetryOnPredicateMatch() {
        // Given
        agent.setRetryPolicy(new RetryPolicy(3, 10, 10, 1.0, 1000));
        AtomicInteger attempts = new AtomicInteger(0);
        Supplier<String> action = () -> {
            attempts.incrementAndGet();
            return "Failed";
        };

        // When
        AgentExecutionResult<String> result = agent.executeWithRetry(action, "Failed"::equals);

        // Then
        assertThat(result.executionStatus()).isEqualTo(ERROR);
        assertThat(result.message()).contains("Retry explicitly requested by the task");
        assertThat(attempts.get()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should succeed when predicate stops matching")
    void shouldSucceedWhenPredicateStopsMatching() {
        // Given
        agent.setRetryPolicy(new RetryPolicy(3, 10, 10, 1.0, 1000));
        AtomicInteger attempts = new AtomicInteger(0);
        Supplier<String> action = () -> attempts.incrementAndGet() < 3 ? "Failed" : "Success";

        // When
        AgentExecutionResult<String> result = agent.executeWithRetry(action, "Failed"::equals);

        // Then
        assertThat(result.executionStatus()).isEqualTo(SUCCESS);
        assertThat(result.resultPayload()).isEqualTo("Success");
        assertThat(attempts.get()).isEqualTo(3);
    }
}
