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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.storytest.error.ErrorCategory;
import org.tarik.storytest.error.RetryPolicy;
import org.tarik.storytest.error.RetryState;
import org.tarik.storytest.exceptions.TestAutomationException;

import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static java.time.Instant.now;
import static org.tarik.storytest.agents.AgentExecutionResult.ExecutionStatus.ERROR;
import static org.tarik.storytest.agents.AgentExecutionResult.ExecutionStatus.SUCCESS;
import static org.tarik.storytest.error.ErrorCategory.NOT_FOUND;
import static org.tarik.storytest.error.ErrorCategory.VALIDATION_FAILURE;
import static org.tarik.storytest.utils.CommonUtils.sleepMillis;

public interface BaseAiAgent {
    Logger LOG = LoggerFactory.getLogger(BaseAiAgent.class);
    Set<ErrorCategory> NON_RETRYABLE_CATEGORIES = Set.of(NOT_FOUND, VALIDATION_FAILURE);

    RetryPolicy getRetryPolicy();

    default String getAgentTaskDescription() {
        return "Executing agent task";
    }

    /**
     * Calls the model until it returns a result which doesn't match the retry condition, the policy runs out of
     * retries or its timeout expires. Errors of a non-retryable category end the execution immediately.
     */
    default <T> AgentExecutionResult<T> executeWithRetry(Supplier<T> action, Predicate<T> retryCondition) {
        RetryPolicy policy = getRetryPolicy();
        RetryState retryState = new RetryState();
        String taskDescription = getAgentTaskDescription();

        while (true) {
            int attempt = retryState.incrementAttempts();
            try {
                T result = action.get();
                if (retryCondition != null && retryCondition.test(result)) {
                    String message = "Retry explicitly requested by the task because it has the following result: "
                            + result;
                    if (!canRetry(policy, retryState, message, taskDescription)) {
                        return new AgentExecutionResult<>(ERROR, message, attempt, null, now());
                    }
                    continue;
                }
                return new AgentExecutionResult<>(SUCCESS, "Execution successful", attempt, result, now());
            } catch (TestAutomationException e) {
                if (NON_RETRYABLE_CATEGORIES.contains(e.getErrorCategory())) {
                    LOG.error("Non-retryable error occurred while {}", taskDescription, e);
                    return new AgentExecutionResult<>(ERROR, e.getMessage(), attempt, null, now());
                }
                LOG.error("Got error while executing action for task: {}. Retrying...", taskDescription, e);
                if (!canRetry(policy, retryState, e.getMessage(), taskDescription)) {
                    return new AgentExecutionResult<>(ERROR, e.getMessage(), attempt, null, now());
                }
            } catch (RuntimeException e) {
                LOG.error("Got error while executing action for task: {}. Retrying...", taskDescription, e);
                if (!canRetry(policy, retryState, e.getMessage(), taskDescription)) {
                    return new AgentExecutionResult<>(ERROR, e.getMessage(), attempt, null, now());
                }
            }
        }
    }

    default <T> AgentExecutionResult<T> executeWithRetry(Supplier<T> action) {
        return executeWithRetry(action, null);
    }

    private boolean canRetry(RetryPolicy policy, RetryState retryState, String message, String taskDescription) {
        int attempt = retryState.getAttempts();
        long elapsedTime = retryState.getElapsedTime();
        if (policy.isTimedOut(elapsedTime) || attempt > policy.maxRetries()) {
            LOG.error("Operation for task '{}' failed after {} attempts (elapsed: {}ms). Last error: {}",
                    taskDescription, attempt, elapsedTime, message);
            return false;
        }

        long delayMillis = policy.getDelayBeforeRetry(attempt);
        LOG.warn("Attempt {} for task '{}' failed: {}. Retrying in {}ms...", attempt, taskDescription, message,
                delayMillis);
        sleepMillis(delayMillis);
        return true;
    }
}
