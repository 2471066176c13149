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
import org.jetbrains.annotations.Nullable;
import org.tarik.storytest.model.TestStep;

import java.time.Duration;
import java.time.Instant;

import static java.time.Instant.now;

/**
 * Represents the result of a single test step execution.
 */
public record StepResult(@NotNull String stepId,
                         @NotNull String stepName,
                         String action,
                         String target,
                         boolean passed,
                         @Nullable String message,
                         @Nullable String expectedResult,
                         @Nullable String actualResult,
                         @NotNull Instant startedAt,
                         @NotNull Instant completedAt,
                         @Nullable String screenshotReference,
                         boolean required) {

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }

    public static StepResult passed(@NotNull TestStep step, @NotNull Instant startedAt, @Nullable String actualResult,
                                    @Nullable String screenshotReference) {
        return new StepResult(step.id(), step.getDisplayName(), step.action(), step.target(), true,
                "Step completed successfully", step.expectedResult(), actualResult, startedAt, now(),
                screenshotReference, !step.continueOnFailure());
    }

    public static StepResult failed(@NotNull TestStep step, @NotNull Instant startedAt, @NotNull String message,
                                    @Nullable String actualResult, @Nullable String screenshotReference) {
        return new StepResult(step.id(), step.getDisplayName(), step.action(), step.target(), false, message,
                step.expectedResult(), actualResult, startedAt, now(), screenshotReference, !step.continueOnFailure());
    }

    /**
     * Provides a human-friendly string representation of the step result, formatted for console readability.
     */
    @Override
    public @NotNull String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("StepResult:\n");
        sb.append("  - Step: ").append(stepName).append("\n");
        sb.append("  - Status: ").append(passed ? "PASSED" : "FAILED").append(required ? "" : " (optional)")
                .append("\n");
        if (!passed && message != null && !message.isBlank()) {
            sb.append("  - Error: ").append(message).append("\n");
        }
        if (actualResult != null) {
            sb.append("  - Actual Result: ").append(actualResult).append("\n");
        }
        sb.append("  - Screenshot: ").append(screenshotReference != null ? screenshotReference : "Not Available")
                .append("\n");
        sb.append("  - Duration: ").append(duration().toMillis()).append(" ms");
        return sb.toString();
    }
}
