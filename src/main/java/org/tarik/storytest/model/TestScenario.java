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
package org.tarik.storytest.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static java.time.Instant.now;
import static java.util.Comparator.comparingInt;
import static java.util.Objects.requireNonNullElse;
import static org.tarik.storytest.model.TestEnvironment.DEVELOPMENT;
import static org.tarik.storytest.model.TestPriority.MEDIUM;
import static org.tarik.storytest.model.TestStatus.DRAFT;
import static org.tarik.storytest.model.TestType.UI;
import static org.tarik.storytest.utils.CommonUtils.isBlank;

/**
 * An executable test scenario derived from a user story. Instances are immutable; the repository and the service
 * replace the whole object on every change.
 */
public record TestScenario(@NotNull String id,
                           String title,
                           @Nullable String description,
                           @Nullable String originalUserStory,
                           @NotNull TestType type,
                           @NotNull TestStatus status,
                           @NotNull TestPriority priority,
                           @NotNull TestEnvironment environment,
                           String projectId,
                           @NotNull List<TestStep> steps,
                           @NotNull List<String> tags,
                           @NotNull List<String> preconditions,
                           @NotNull List<String> expectedOutcomes,
                           @NotNull Instant createdAt,
                           @NotNull Instant updatedAt,
                           @Nullable String createdBy,
                           @Nullable Duration timeout,
                           int retryCount,
                           boolean canRunInParallel,
                           @NotNull Map<String, ParameterValue> metadata,
                           @NotNull Map<String, ParameterValue> configuration,
                           @NotNull Map<String, ParameterValue> testData) {
    private static final String COPY_SUFFIX = " (Copy)";

    public TestScenario {
        id = isBlank(id) ? newId() : id;
        type = requireNonNullElse(type, UI);
        status = requireNonNullElse(status, DRAFT);
        priority = requireNonNullElse(priority, MEDIUM);
        environment = requireNonNullElse(environment, DEVELOPMENT);
        steps = List.copyOf(requireNonNullElse(steps, List.of()));
        tags = List.copyOf(requireNonNullElse(tags, List.of()));
        preconditions = List.copyOf(requireNonNullElse(preconditions, List.of()));
        expectedOutcomes = List.copyOf(requireNonNullElse(expectedOutcomes, List.of()));
        createdAt = requireNonNullElse(createdAt, now());
        updatedAt = requireNonNullElse(updatedAt, createdAt);
        metadata = Map.copyOf(requireNonNullElse(metadata, Map.of()));
        configuration = Map.copyOf(requireNonNullElse(configuration, Map.of()));
        testData = Map.copyOf(requireNonNullElse(testData, Map.of()));
    }

    /**
     * Checks the structural validity of this scenario and all of its steps.
     *
     * @return list of human-readable errors, empty if the scenario can be persisted and executed
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>(validateContent());
        if (isBlank(projectId)) {
            errors.add("Project ID is required");
        }
        return errors;
    }

    /**
     * Same as {@link #validate()} without the project assignment, for scenarios which haven't been assigned to a
     * project yet.
     */
    public List<String> validateContent() {
        List<String> errors = new ArrayList<>();
        if (isBlank(title)) {
            errors.add("Title is required");
        }
        if (steps.isEmpty()) {
            errors.add("At least one test step is required");
        }
        for (TestStep step : steps) {
            step.validate().forEach(error -> errors.add("Step '%s': %s".formatted(step.action(), error)));
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            errors.add("Timeout must be positive");
        }
        if (retryCount < 0) {
            errors.add("Retry count cannot be negative");
        }
        return errors;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }

    /**
     * Returns the enabled steps sorted by their execution order.
     */
    public List<TestStep> getExecutableSteps() {
        return steps.stream()
                .filter(TestStep::enabled)
                .sorted(comparingInt(TestStep::order))
                .toList();
    }

    /**
     * Creates an independent draft copy with new identities for the scenario and each of its steps.
     *
     * @param newTitle title of the copy, or {@code null} to derive it from the current title
     */
    public TestScenario cloneAsDraft(@Nullable String newTitle) {
        var timestamp = now();
        return toBuilder()
                .id(newId())
                .title(isBlank(newTitle) ? title + COPY_SUFFIX : newTitle)
                .status(DRAFT)
                .steps(steps.stream().map(TestStep::copyWithNewId).toList())
                .createdAt(timestamp)
                .updatedAt(timestamp)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .description(description)
                .originalUserStory(originalUserStory)
                .type(type)
                .status(status)
                .priority(priority)
                .environment(environment)
                .projectId(projectId)
                .steps(steps)
                .tags(tags)
                .preconditions(preconditions)
                .expectedOutcomes(expectedOutcomes)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .createdBy(createdBy)
                .timeout(timeout)
                .retryCount(retryCount)
                .canRunInParallel(canRunInParallel)
                .metadata(metadata)
                .configuration(configuration)
                .testData(testData);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    public static class Builder {
        private String id;
        private String title;
        private String description;
        private String originalUserStory;
        private TestType type = UI;
        private TestStatus status = DRAFT;
        private TestPriority priority = MEDIUM;
        private TestEnvironment environment = DEVELOPMENT;
        private String projectId;
        private List<TestStep> steps = new ArrayList<>();
        private List<String> tags = new ArrayList<>();
        private List<String> preconditions = new ArrayList<>();
        private List<String> expectedOutcomes = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;
        private String createdBy;
        private Duration timeout;
        private int retryCount;
        private boolean canRunInParallel = true;
        private Map<String, ParameterValue> metadata = new HashMap<>();
        private Map<String, ParameterValue> configuration = new HashMap<>();
        private Map<String, ParameterValue> testData = new HashMap<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder originalUserStory(String originalUserStory) {
            this.originalUserStory = originalUserStory;
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

        public Builder environment(TestEnvironment environment) {
            this.environment = environment;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder steps(List<TestStep> steps) {
            this.steps = new ArrayList<>(steps);
            return this;
        }

        public Builder step(TestStep step) {
            this.steps.add(step);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags);
            return this;
        }

        public Builder preconditions(List<String> preconditions) {
            this.preconditions = new ArrayList<>(preconditions);
            return this;
        }

        public Builder expectedOutcomes(List<String> expectedOutcomes) {
            this.expectedOutcomes = new ArrayList<>(expectedOutcomes);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder canRunInParallel(boolean canRunInParallel) {
            this.canRunInParallel = canRunInParallel;
            return this;
        }

        public Builder metadata(Map<String, ParameterValue> metadata) {
            this.metadata = new HashMap<>(metadata);
            return this;
        }

        public Builder metadataEntry(String key, ParameterValue value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder configuration(Map<String, ParameterValue> configuration) {
            this.configuration = new HashMap<>(configuration);
            return this;
        }

        public Builder testData(Map<String, ParameterValue> testData) {
            this.testData = new HashMap<>(testData);
            return this;
        }

        public TestScenario build() {
            return new TestScenario(id, title, description, originalUserStory, type, status, priority, environment,
                    projectId, steps, tags, preconditions, expectedOutcomes, createdAt, updatedAt, createdBy, timeout,
                    retryCount, canRunInParallel, metadata, configuration, testData);
        }
    }
}
