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
import org.tarik.storytest.model.TestPriority;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.model.TestStatus;
import org.tarik.storytest.model.TestType;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNullElse;
import static org.tarik.storytest.StoryTestConfig.getDefaultPageSize;
import static org.tarik.storytest.utils.CommonUtils.isBlank;

/**
 * Filter, sort and page settings of a scenario search. Unset filters match everything; tags match if the scenario
 * carries any of them. Text filters ignore case.
 */
public record ScenarioSearchCriteria(@Nullable String projectId,
                                     @Nullable TestType type,
                                     @Nullable TestStatus status,
                                     @Nullable TestPriority priority,
                                     @NotNull Set<String> tags,
                                     @Nullable String createdBy,
                                     @Nullable Instant createdFrom,
                                     @Nullable Instant createdTo,
                                     @Nullable String searchText,
                                     int pageNumber,
                                     int pageSize,
                                     @NotNull ScenarioSortField sortBy,
                                     boolean sortDescending) {

    public ScenarioSearchCriteria {
        checkArgument(pageNumber >= 1, "Page number must be at least 1, got %s", pageNumber);
        checkArgument(pageSize >= 1, "Page size must be at least 1, got %s", pageSize);
        tags = Set.copyOf(requireNonNullElse(tags, Set.of()));
        sortBy = requireNonNullElse(sortBy, ScenarioSortField.CREATED_AT);
    }

    public boolean matches(@NotNull TestScenario scenario) {
        return (projectId == null || projectId.equals(scenario.projectId()))
                && (type == null || type == scenario.type())
                && (status == null || status == scenario.status())
                && (priority == null || priority == scenario.priority())
                && (tags.isEmpty() || scenario.tags().stream().anyMatch(tags::contains))
                && (isBlank(createdBy) || containsIgnoreCase(scenario.createdBy(), createdBy))
                && (createdFrom == null || !scenario.createdAt().isBefore(createdFrom))
                && (createdTo == null || !scenario.createdAt().isAfter(createdTo))
                && (isBlank(searchText) || containsIgnoreCase(scenario.title(), searchText)
                || containsIgnoreCase(scenario.description(), searchText));
    }

    static boolean containsIgnoreCase(String value, String part) {
        return value != null && value.toLowerCase().contains(part.toLowerCase());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String projectId;
        private TestType type;
        private TestStatus status;
        private TestPriority priority;
        private Set<String> tags = Set.of();
        private String createdBy;
        private Instant createdFrom;
        private Instant createdTo;
        private String searchText;
        private int pageNumber = 1;
        private int pageSize = getDefaultPageSize();
        private ScenarioSortField sortBy = ScenarioSortField.CREATED_AT;
        private boolean sortDescending = true;

        private Builder() {
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder type(TestType type) {
            this.type = type;
            return this;
        }

        public Builder status(TestStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(TestPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = Set.copyOf(tags);
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdFrom(Instant createdFrom) {
            this.createdFrom = createdFrom;
            return this;
        }

        public Builder createdTo(Instant createdTo) {
            this.createdTo = createdTo;
            return this;
        }

        public Builder searchText(String searchText) {
            this.searchText = searchText;
            return this;
        }

        public Builder page(int pageNumber, int pageSize) {
            this.pageNumber = pageNumber;
            this.pageSize = pageSize;
            return this;
        }

        public Builder sortBy(ScenarioSortField sortBy, boolean descending) {
            this.sortBy = sortBy;
            this.sortDescending = descending;
            return this;
        }

        public ScenarioSearchCriteria build() {
            return new ScenarioSearchCriteria(projectId, type, status, priority, tags, createdBy, createdFrom,
                    createdTo, searchText, pageNumber, pageSize, sortBy, sortDescending);
        }
    }
}
