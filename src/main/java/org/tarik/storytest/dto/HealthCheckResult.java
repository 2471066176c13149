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

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Outcome of an executor liveness probe.
 *
 * @param healthy      whether the executor can accept work
 * @param message      human-readable details
 * @param responseTime time the probe took
 */
public record HealthCheckResult(boolean healthy, @NotNull String message, @NotNull Duration responseTime) {

    public static HealthCheckResult unhealthy(@NotNull String message, @NotNull Duration responseTime) {
        return new HealthCheckResult(false, message, responseTime);
    }
}
