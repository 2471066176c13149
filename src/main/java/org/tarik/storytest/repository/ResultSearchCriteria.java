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
package org.tarik.storytest.repository;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.model.TestEnvironment;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNullElse;
import static org.tarik.storytest.StoryTestConfig.getDefaultPageSize;
import static org.tarik.storytest.repository.ScenarioSearchCriteria.containsIgnoreCase;
import static org.tarik.storytest.utils.CommonUtils.isBlank;

/**
 * Filter, sort and page settings of a result search. The project filter is resolved by the repository since results
 * only reference their scenario.
 */
public record ResultSearchCriteria(@Nullable String scenarioId,
                                   @Nullable String projectId,
                                   @Nullable Boolean passed,
                                   @Nullable TestEnvironment environment,
                                   @Nullable String executedBy,
                                   @Nullable Instant executedFrom,
                                   @Nullable Instant executedTo,
                                   @Nullable Duration minDuration,
                                   @Nullable Duration maxDuration,
                                   @NotNull Set<String> executionTags,
                                   int pageNumber,
                                   int pageSize,
                                   @NotNull ResultSortField sortBy,
                                   boolean sortDescending) {

    public ResultSearchCriteria {
        checkArgument(pageNumber >= 1, "Page number must be at least 1, got %s", pageNumber);
        checkArgument(pageSize >= 1, "Page size must be at least 1, got %s", pageSize);
        executionTags = Set.copyOf(requireNonNullElse(executionTags, Set.of()));
        sortBy = requireNonNullElse(sortBy, ResultSortField.STARTED_AT);
    }

    /**
     * Checks every filter except the project one.
     */
    public boolean matches(@NotNull TestResult result) {
        return (scenarioId == null || scenarioId.equals(result.getScenarioId()))
                && (passed == null || passed == result.isPassed())
                && (environment == null || environment == result.getEnvironment())
                && (isBlank(executedBy) || containsIgnoreCase(result.getExecutedBy(), executedBy))
                && (executedFrom == null || !result.getStartedAt().isBefore(executedFrom))
                && (executedTo == null || !result.getStartedAt().isAfter(executedTo))
                && (minDuration == null || result.getDuration().compareTo(minDuration) >= 0)
                && (maxDuration == null || result.getDuration().compareTo(maxDuration) <= 0)
                && (executionTags.isEmpty() || result.getExecutionTags().stream().anyMatch(executionTags::contains));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String scenarioId;
        private String projectId;
        private Boolean passed;
        private TestEnvironment environment;
        private String executedBy;
        private Instant executedFrom;
        private Instant executedTo;
        private Duration minDuration;
        private Duration maxDuration;
        private Set<String> executionTags = Set.of();
        private int pageNumber = 1;
        private int pageSize = getDefaultPageSize();
        private ResultSortField sortBy = ResultSortField.STARTED_AT;
        private boolean sortDescending = true;

        private Builder() {
        }

        public Builder scenarioId(String scenarioId) {
            this.scenarioId = scenarioId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder passed(Boolean passed) {
            this.passed = passed;
            return this;
        }

        public Builder environment(TestEnvironment environment) {
            this.environment = environment;
            return this;
        }

        public Builder executedBy(String executedBy) {
            this.executedBy = executedBy;
            return this;
        }

        public Builder executedBetween(Instant from, Instant to) {
            this.executedFrom = from;
            this.executedTo = to;
            return this;
        }

        public Builder durationBetween(Duration min, Duration max) {
            this.minDuration = min;
            this.maxDuration = max;
            return this;
        }

        public Builder executionTags(List<String> executionTags) {
            this.executionTags = Set.copyOf(executionTags);
            return this;
        }

        public Builder page(int pageNumber, int pageSize) {
            this.pageNumber = pageNumber;
            this.pageSize = pageSize;
            return this;
        }

        public Builder sortBy(ResultSortField sortBy, boolean descending) {
            this.sortBy = sortBy;
            this.sortDescending = descending;
            return this;
        }

        public ResultSearchCriteria build() {
            return new ResultSearchCriteria(scenarioId, projectId, passed, environment, executedBy, executedFrom,
                    executedTo, minDuration, maxDuration, executionTags, pageNumber, pageSize, sortBy, sortDescending);
        }
    }
}
