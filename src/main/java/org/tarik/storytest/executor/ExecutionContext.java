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
package org.tarik.storytest.executor;

import org.jetbrains.annotations.NotNull;
import org.tarik.storytest.model.ParameterValue;
import org.tarik.storytest.model.TestScenario;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.time.Instant.now;
import static java.util.Optional.ofNullable;

/**
 * State of a single scenario run: the variables extracted or set by previous steps and the scenario deadline.
 * Variables start out as the scenario's test data.
 */
public class ExecutionContext {
    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{\\s*([\\w.-]+)\\s*}}");

    private final TestScenario scenario;
    private final Instant startedAt;
    private final Map<String, ParameterValue> variables = new ConcurrentHashMap<>();

    public ExecutionContext(@NotNull TestScenario scenario) {
        this(scenario, now());
    }

    ExecutionContext(@NotNull TestScenario scenario, @NotNull Instant startedAt) {
        this.scenario = scenario;
        this.startedAt = startedAt;
        this.variables.putAll(scenario.testData());
    }

    public TestScenario getScenario() {
        return scenario;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setVariable(@NotNull String name, @NotNull ParameterValue value) {
        variables.put(name, value);
    }

    public Optional<ParameterValue> getVariable(@NotNull String name) {
        return ofNullable(variables.get(name));
    }

    /**
     * Replaces every {@code {{name}}} placeholder with the value of the corresponding variable. Unknown placeholders
     * are left untouched.
     */
    public String resolve(String template) {
        if (template == null || !template.contains("{{")) {
            return template;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            String replacement = getVariable(matcher.group(1))
                    .map(ParameterValue::asText)
                    .orElse(matcher.group());
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    public boolean isScenarioTimedOut() {
        Duration timeout = scenario.timeout();
        return timeout != null && Duration.between(startedAt, now()).compareTo(timeout) > 0;
    }
}
