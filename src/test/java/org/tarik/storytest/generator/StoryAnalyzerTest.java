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
package org.tarik.storytest.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.storytest.model.TestType.API;
import static org.tarik.storytest.model.TestType.UI;

@DisplayName("StoryAnalyzer Tests")
class StoryAnalyzerTest {
    private final StoryAnalyzer analyzer = new StoryAnalyzer();

    @Test
    @DisplayName("Should extract URLs without trailing punctuation")
    void shouldExtractUrls() {
        // When
        StoryAnalysis analysis = analyzer.analyze(
                "Open https://app.example.com/login, then https://app.example.com/login. Also visit http://.");

        // Then
        assertThat(analysis.urls()).containsExactly("https://app.example.com/login");
        assertThat(analysis.primaryUrl()).contains("https://app.example.com/login");
    }

    @Test
    @DisplayName("Should extract credentials given as user/password pair")
    void shouldExtractCredentialsPair() {
        // When
        StoryAnalysis analysis = analyzer.analyze("As a user I want to sign in with credentials admin/secret.");

        // Then
        assertThat(analysis.getUsername()).contains("admin");
        assertThat(analysis.getPassword()).contains("secret");
        assertThat(analysis.hasCredentials()).isTrue();
        assertThat(analysis.category()).isEqualTo(ScenarioCategory.LOGIN);
    }

    @Test
    @DisplayName("Should prefer an email as username and read the password keyword")
    void shouldExtractEmailAndPassword() {
        // When
        StoryAnalysis analysis = analyzer.analyze("Login as jane.doe@example.com with password: Pa55word!");

        // Then
        assertThat(analysis.getUsername()).contains("jane.doe@example.com");
        assertThat(analysis.getPassword()).contains("Pa55word");
    }

    @Test
    @DisplayName("Should not take an email from inside a URL")
    void shouldIgnoreEmailInsideUrl() {
        // When
        StoryAnalysis analysis = analyzer.analyze("Open https://user@example.com/home and check the page");

        // Then
        assertThat(analysis.getUsername()).isEmpty();
        assertThat(analysis.hasCredentials()).isFalse();
    }

    @Test
    @DisplayName("Should collect quoted values in order")
    void shouldCollectQuotedValues() {
        // When
        StoryAnalysis analysis = analyzer.analyze("Request a quote for \"250000\" in \"NY\"");

        // Then
        assertThat(analysis.quotedValues()).containsExactly("250000", "NY");
        assertThat(analysis.firstQuotedValue()).contains("250000");
        assertThat(analysis.category()).isEqualTo(ScenarioCategory.QUOTE);
    }

    @ParameterizedTest(name = "''{0}'' should be {1}")
    @CsvSource({
            "Submit a claim via the claims API, API",
            "The payment service must accept cards, API",
            "I want to log in, UI",
            "I want a rapid page load, UI"
    })
    @DisplayName("Should detect the test type from API keywords")
    void shouldDetectTestType(String story, String expectedType) {
        assertThat(analyzer.analyze(story).testType().name()).isEqualTo(expectedType);
    }

    @Test
    @DisplayName("Should treat null as an empty story")
    void shouldHandleNull() {
        // When
        StoryAnalysis analysis = analyzer.analyze(null);

        // Then
        assertThat(analysis.urls()).isEmpty();
        assertThat(analysis.quotedValues()).isEmpty();
        assertThat(analysis.category()).isEqualTo(ScenarioCategory.GENERIC);
        assertThat(analysis.testType()).isEqualTo(UI);
    }

    @Test
    @DisplayName("Category priority should follow declaration order")
    void shouldPickFirstMatchingCategory() {
        assertThat(ScenarioCategory.detect("Login to get a quote")).isEqualTo(ScenarioCategory.QUOTE);
        assertThat(ScenarioCategory.detect("Pay the claim")).isEqualTo(ScenarioCategory.CLAIM);
        assertThat(ScenarioCategory.fromTag("PAYMENT")).contains(ScenarioCategory.PAYMENT);
        assertThat(ScenarioCategory.fromTag("unknown")).isEmpty();
        assertThat(analyzer.analyze("Check the orders endpoint").testType()).isEqualTo(API);
    }
}
