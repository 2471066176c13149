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
import org.tarik.storytest.model.TestEnvironment;
import org.tarik.storytest.model.TestType;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Aggregated execution statistics of a project within a time window. Pass rates are percentages in [0, 100].
 */
public record TestStatistics(@NotNull String projectId,
                             @NotNull Instant from,
                             @NotNull Instant to,
                             int totalScenarios,
                             int totalExecutions,
                             int passedExecutions,
                             int failedExecutions,
                             double passRate,
                             @NotNull Duration averageDuration,
                             @NotNull Map<TestType, TypeStatistics> statsByType,
                             @NotNull Map<TestEnvironment, EnvironmentStatistics> statsByEnvironment,
                             @NotNull List<DailyStatistics> dailyTrends) {

    public record TypeStatistics(int scenarioCount, int executionCount, double passRate,
                                 @NotNull Duration averageDuration) {
    }

    public record EnvironmentStatistics(int executionCount, int passedCount, double passRate,
                                        @NotNull Duration averageDuration) {
    }

    public record DailyStatistics(@NotNull LocalDate date, int executionCount, int passedCount, int failedCount,
                                  double passRate) {
    }
}
