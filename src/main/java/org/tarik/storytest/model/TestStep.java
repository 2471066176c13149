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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static java.time.Duration.ZERO;
import static java.util.Objects.requireNonNullElse;
import static java.util.Optional.ofNullable;
import static org.tarik.storytest.utils.CommonUtils.isBlank;

/**
 * A single action within a test scenario. Instances are immutable, changes are made through {@link #toBuilder()}.
 * <p>
 * Parameters are resolved from {@link #parameters()} first and from {@link #stepData()} second.
 */
public record TestStep(@NotNull String id,
                       int order,
                       String action,
                       String target,
                       @Nullable String description,
                       @Nullable String expectedResult,
                       @NotNull Map<String, ParameterValue> parameters,
                       @NotNull Map<String, ParameterValue> stepData,
                       @NotNull List<String> prerequisites,
                       @Nullable Duration timeout,
                       @NotNull Duration waitBefore,
                       @NotNull Duration waitAfter,
                       boolean continueOnFailure,
                       boolean takeScreenshot,
                       @NotNull List<ValidationRule> validationRules,
                       boolean enabled,
                       @NotNull List<String> tags) {

    public TestStep {
        id = isBlank(id) ? newId() : id;
        parameters = Map.copyOf(requireNonNullElse(parameters, Map.of()));
        stepData = Map.copyOf(requireNonNullElse(stepData, Map.of()));
        prerequisites = List.copyOf(requireNonNullElse(prerequisites, List.of()));
        waitBefore = requireNonNullElse(waitBefore, ZERO);
        waitAfter = requireNonNullElse(waitAfter, ZERO);
        validationRules = List.copyOf(requireNonNullElse(validationRules, List.of()));
        tags = List.copyOf(requireNonNullElse(tags, List.of()));
    }

    public Optional<ParameterValue> getParameterValue(@NotNull String key) {
        return ofNullable(parameters.get(key)).or(() -> ofNullable(stepData.get(key)));
    }

    public boolean hasParameter(@NotNull String key) {
        return getParameterValue(key).isPresent();
    }

    /**
     * Checks the structural validity of this step.
     *
     * @return list of human-readable errors, empty if the step is valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (isBlank(action)) {
            errors.add("Action is required");
        }
        if (isBlank(target)) {
            errors.add("Target is required");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            errors.add("Timeout must be positive");
        }
        if (waitBefore.isNegative()) {
            errors.add("WaitBefore cannot be negative");
        }
        if (waitAfter.isNegative()) {
            errors.add("WaitAfter cannot be negative");
        }
        if (!isBlank(action)) {
            switch (normalizedAction()) {
                case "enter_text", "type" -> requireParameter(errors, "value",
                        "Text input actions require a 'value' parameter");
                case "api_post", "api_put", "api_patch" -> requireParameter(errors, "body",
                        "HTTP POST/PUT/PATCH actions require a 'body' parameter");
                case "wait" -> requireParameter(errors, "duration", "Wait actions require a 'duration' parameter");
                case "verify", "assert" -> requireParameter(errors, "expected",
                        "Verification actions require an 'expected' parameter");
                default -> {
                    // No action-specific parameters
                }
            }
        }
        return errors;
    }

    /**
     * Returns the lower-cased action verb, or an empty string if no action is set.
     */
    public String normalizedAction() {
        return action == null ? "" : action.trim().toLowerCase();
    }

    public String getDisplayName() {
        return isBlank(description) ? "%s %s".formatted(action, target) : description;
    }

    public TestStep copyWithNewId() {
        return toBuilder().id(newId()).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .order(order)
                .action(action)
                .target(target)
                .description(description)
                .expectedResult(expectedResult)
                .parameters(parameters)
                .stepData(stepData)
                .prerequisites(prerequisites)
                .timeout(timeout)
                .waitBefore(waitBefore)
                .waitAfter(waitAfter)
                .continueOnFailure(continueOnFailure)
                .takeScreenshot(takeScreenshot)
                .validationRules(validationRules)
                .enabled(enabled)
                .tags(tags);
    }

    public static Builder builder() {
        return new Builder();
    }

    private void requireParameter(List<String> errors, String key, String message) {
        if (!hasParameter(key)) {
            errors.add(message);
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    public static class Builder {
        private String id;
        private int order;
        private String action;
        private String target;
        private String description;
        private String expectedResult;
        private Map<String, ParameterValue> parameters = new HashMap<>();
        private Map<String, ParameterValue> stepData = new HashMap<>();
        private List<String> prerequisites = new ArrayList<>();
        private Duration timeout;
        private Duration waitBefore = ZERO;
        private Duration waitAfter = ZERO;
        private boolean continueOnFailure;
        private boolean takeScreenshot;
        private List<ValidationRule> validationRules = new ArrayList<>();
        private boolean enabled = true;
        private List<String> tags = new ArrayList<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder expectedResult(String expectedResult) {
            this.expectedResult = expectedResult;
            return this;
        }

        public Builder parameters(Map<String, ParameterValue> parameters) {
            this.parameters = new HashMap<>(parameters);
            return this;
        }

        public Builder parameter(String key, String value) {
            return parameter(key, ParameterValue.of(value));
        }

        public Builder parameter(String key, ParameterValue value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder stepData(Map<String, ParameterValue> stepData) {
            this.stepData = new HashMap<>(stepData);
            return this;
        }

        public Builder stepDataEntry(String key, ParameterValue value) {
            this.stepData.put(key, value);
            return this;
        }

        public Builder prerequisites(List<String> prerequisites) {
            this.prerequisites = new ArrayList<>(prerequisites);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder waitBefore(Duration waitBefore) {
            this.waitBefore = waitBefore;
            return this;
        }

        public Builder waitAfter(Duration waitAfter) {
            this.waitAfter = waitAfter;
            return this;
        }

        public Builder continueOnFailure(boolean continueOnFailure) {
            this.continueOnFailure = continueOnFailure;
            return this;
        }

        public Builder takeScreenshot(boolean takeScreenshot) {
            this.takeScreenshot = takeScreenshot;
            return this;
        }

        public Builder validationRules(List<ValidationRule> validationRules) {
            this.validationRules = new ArrayList<>(validationRules);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags);
            return this;
        }

        public TestStep build() {
            return new TestStep(id, order, action, target, description, expectedResult, parameters, stepData,
                    prerequisites, timeout, waitBefore, waitAfter, continueOnFailure, takeScreenshot, validationRules,
                    enabled, tags);
        }
    }
}
