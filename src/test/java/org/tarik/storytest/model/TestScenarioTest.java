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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.storytest.model.TestStatus.ACTIVE;
import static org.tarik.storytest.model.TestStatus.DRAFT;

@DisplayName("TestScenario Tests")
class TestScenarioTest {

    private static TestScenario validScenario() {
        return TestScenario.builder()
                .title("Login Test")
                .projectId("project-1")
                .status(ACTIVE)
                .step(TestStep.builder().order(2).action("click").target("#login-button").build())
                .step(TestStep.builder().order(1).action("navigate").target("/login").build())
                .build();
    }

    @Test
    @DisplayName("Should apply defaults for omitted fields")
    void shouldApplyDefaults() {
        // When
        TestScenario scenario = TestScenario.builder().title("Title").build();

        // Then
        assertThat(scenario.id()).isNotBlank();
        assertThat(scenario.type()).isEqualTo(TestType.UI);
        assertThat(scenario.status()).isEqualTo(DRAFT);
        assertThat(scenario.priority()).isEqualTo(TestPriority.MEDIUM);
        assertThat(scenario.environment()).isEqualTo(TestEnvironment.DEVELOPMENT);
        assertThat(scenario.updatedAt()).isEqualTo(scenario.createdAt());
    }

    @Test
    @DisplayName("Should be valid with title, project and a valid step")
    void shouldBeValid() {
        assertThat(validScenario().validate()).isEmpty();
        assertThat(validScenario().isValid()).isTrue();
    }

    @Test
    @DisplayName("Should report missing title, project and steps")
    void shouldReportMissingFields() {
        // Given
        TestScenario scenario = TestScenario.builder().title(" ").build();

        // When
        var errors = scenario.validate();

        // Then
        assertThat(errors).containsExactlyInAnyOrder("Title is required", "Project ID is required",
                "At least one test step is required");
    }

    @Test
    @DisplayName("Should prefix step errors with the step action")
    void shouldReportStepErrors() {
        // Given
        TestScenario scenario = validScenario().toBuilder()
                .step(TestStep.builder().order(3).action("enter_text").target("#username").build())
                .retryCount(-1)
                .timeout(Duration.ofSeconds(-5))
                .build();

        // When
        var errors = scenario.validate();

        // Then
        assertThat(errors).containsExactlyInAnyOrder(
                "Step 'enter_text': Text input actions require a 'value' parameter",
                "Timeout must be positive",
                "Retry count cannot be negative");
    }

    @Test
    @DisplayName("Executable steps should be the enabled ones in order")
    void executableStepsShouldBeOrdered() {
        // Given
        TestScenario scenario = validScenario().toBuilder()
                .step(TestStep.builder().order(0).action("wait").target("page").enabled(false).build())
                .build();

        // When
        List<TestStep> executable = scenario.getExecutableSteps();

        // Then
        assertThat(executable).extracting(TestStep::action).containsExactly("navigate", "click");
    }

    @Test
    @DisplayName("Clone should be an independent draft")
    void cloneShouldBeDraftWithNewIds() {
        // Given
        TestScenario original = validScenario();

        // When
        TestScenario defaultTitled = original.cloneAsDraft(null);
        TestScenario renamed = original.cloneAsDraft("Other");

        // Then
        assertThat(defaultTitled.id()).isNotEqualTo(original.id());
        assertThat(defaultTitled.title()).isEqualTo("Login Test (Copy)");
        assertThat(defaultTitled.status()).isEqualTo(DRAFT);
        assertThat(defaultTitled.steps()).extracting(TestStep::id)
                .doesNotContainAnyElementsOf(original.steps().stream().map(TestStep::id).toList());
        assertThat(renamed.title()).isEqualTo("Other");
        assertThat(original.status()).isEqualTo(ACTIVE);
    }
}
