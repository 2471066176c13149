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

import dev.langchain4j.model.output.structured.Description;

import java.util.List;

@Description("Test scenario derived from a user story")
public record GeneratedScenario(
        @Description("Short title of the scenario")
        String title,
        @Description("One or two sentences describing what the scenario verifies")
        String description,
        @Description("Type of the test, one of UI, API, MIXED, DATABASE, PERFORMANCE")
        String testType,
        @Description("Priority of the test, one of LOW, MEDIUM, HIGH, CRITICAL")
        String priority,
        @Description("Keywords classifying the scenario")
        List<String> tags,
        @Description("Conditions which must hold before the first step")
        List<String> preconditions,
        @Description("Observable outcomes of a successful run")
        List<String> expectedOutcomes,
        @Description("Ordered steps of the scenario")
        List<GeneratedStep> steps) {

    @Description("Single executable step")
    public record GeneratedStep(
            @Description("Action verb, e.g. navigate, click, enter_text, verify, api_get, api_post, verify_status_code")
            String action,
            @Description("Selector, URL or endpoint the action is applied to")
            String target,
            @Description("Human-readable description of the step")
            String description,
            @Description("What should be observed after the step")
            String expectedResult,
            @Description("Action parameters, e.g. 'value' for enter_text or 'expected' for verify")
            List<GeneratedParameter> parameters) {
    }

    @Description("Named parameter of a step")
    public record GeneratedParameter(
            @Description("Parameter name")
            String name,
            @Description("Parameter value")
            String value) {
    }
}
