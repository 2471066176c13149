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

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

import static org.tarik.storytest.agents.AgentExecutionResult.ExecutionStatus.SUCCESS;

/**
 * Outcome of an agent call made under a retry policy.
 *
 * @param executionStatus status of the last attempt
 * @param message         human-readable description of the outcome
 * @param attempts        number of attempts made, including the successful one
 * @param resultPayload   value returned by the model, {@code null} unless the execution succeeded
 * @param timestamp       moment the execution finished
 */
public record AgentExecutionResult<T>(ExecutionStatus executionStatus,
                                      String message,
                                      int attempts,
                                      @Nullable T resultPayload,
                                      Instant timestamp) {

    public boolean success() {
        return executionStatus == SUCCESS;
    }

    public enum ExecutionStatus {
        SUCCESS, ERROR
    }
}
