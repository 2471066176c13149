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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.storytest.dto.StepResult;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.dto.TestStatistics;
import org.tarik.storytest.model.TestEnvironment;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.model.TestStep;
import org.tarik.storytest.model.TestType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tarik.storytest.model.TestEnvironment.STAGING;
import static org.tarik.storytest.model.TestEnvironment.TESTING;
import static org.tarik.storytest.model.TestStatus.ACTIVE;
import static org.tarik.storytest.model.TestStatus.DRAFT;
import static org.tarik.storytest.model.TestType.API;
import static org.tarik.storytest.model.TestType.UI;

@DisplayName("InMemoryTestRepository Tests")
class InMemoryTestRepositoryTest {
    private static final Instant BASE_TIME = Instant.parse("2025-04-01T12:00:00Z");
    private static final TestStep STEP = TestStep.builder().order(1).action("click").target("#go").build();

    private final InMemoryTestRepository repository = new InMemoryTestRepository();

    static TestScenario scenario(String projectId, String title, TestType type, Instant createdAt) {
        return TestScenario.builder()
                .title(title)
                .projectId(projectId)
                .type(type)
                .createdAt(createdAt)
                .step(STEP)
                .build();
    }

    static TestResult result(String scenarioId, Instant startedAt, boolean passed, long durationSeconds,
                             TestEnvironment environment) {
        TestResult result = TestResult.start(scenarioId, environment, "executor", startedAt, List.of());
        result.addStepResult(passed ? StepResult.passed(STEP, startedAt, null, null)
                : StepResult.failed(STEP, startedAt, "failed", null, null));
        result.complete(startedAt.plusSeconds(durationSeconds));
        return result;
    }

    @Test
    @DisplayName("Saved scenario should be readable by ID")
    void shouldSaveAndLoadScenario() {
        // Given
        TestScenario scenario = scenario("p1", "Login", UI, BASE_TIME);

        // When
        String id = repository.saveScenario(scenario).join();
        Optional<TestScenario> loaded = repository.getScenario(id).join();

        // Then
        assertThat(id).isEqualTo(scenario.id());
        assertThat(loaded).isPresent();
        assertThat(loaded.get().title()).isEqualTo("Login");
        assertThat(loaded.get().steps()).isEqualTo(scenario.steps());
        assertThat(loaded.get().updatedAt()).isAfterOrEqualTo(scenario.updatedAt());
        assertThat(repository.getScenario("missing").join()).isEmpty();
    }

    @Test
    @DisplayName("Project scenarios should be returned oldest first")
    void shouldListProjectScenarios() {
        // Given
        repository.saveScenario(scenario("p1", "Second", UI, BASE_TIME.plusSeconds(10))).join();
        repository.saveScenario(scenario("p1", "First", UI, BASE_TIME)).join();
        repository.saveScenario(scenario("p2", "Other", UI, BASE_TIME)).join();

        // When
        List<TestScenario> scenarios = repository.getScenariosByProject("p1").join();

        // Then
        assertThat(scenarios).extracting(TestScenario::title).containsExactly("First", "Second");
        assertThat(repository.getScenariosByProject("unknown").join()).isEmpty();
    }

    @Test
    @DisplayName("Search should filter, sort and page scenarios")
    void shouldSearchScenarios() {
        // Given
        IntStream.range(0, 5).forEach(i -> repository.saveScenario(
                scenario("p1", "Checkout " + i, i % 2 == 0 ? UI : API, BASE_TIME.plusSeconds(i))).join());
        repository.saveScenario(scenario("p2", "Checkout other", UI, BASE_TIME)).join();

        // When
        List<TestScenario> uiPageOne = repository.searchScenarios(ScenarioSearchCriteria.builder()
                .projectId("p1")
                .type(UI)
                .page(1, 2)
                .build()).join();
        List<TestScenario> uiPageTwo = repository.searchScenarios(ScenarioSearchCriteria.builder()
                .projectId("p1")
                .type(UI)
                .page(2, 2)
                .build()).join();
        List<TestScenario> byTitle = repository.searchScenarios(ScenarioSearchCriteria.builder()
                .searchText("CHECKOUT")
                .sortBy(ScenarioSortField.TITLE, false)
                .build()).join();

        // Then
        assertThat(uiPageOne).extracting(TestScenario::title).containsExactly("Checkout 4", "Checkout 2");
        assertThat(uiPageTwo).extracting(TestScenario::title).containsExactly("Checkout 0");
        assertThat(byTitle).extracting(TestScenario::title).containsExactly("Checkout 0", "Checkout 1",
                "Checkout 2", "Checkout 3", "Checkout 4", "Checkout other");
    }

    @Test
    @DisplayName("Search should match scenarios carrying any of the tags")
    void shouldSearchByTagsAndStatus() {
        // Given
        repository.saveScenario(scenario("p1", "A", UI, BASE_TIME).toBuilder()
                .tags(List.of("smoke")).status(ACTIVE).build()).join();
        repository.saveScenario(scenario("p1", "B", UI, BASE_TIME).toBuilder()
                .tags(List.of("regression")).build()).join();
        repository.saveScenario(scenario("p1", "C", UI, BASE_TIME)).join();

        // When
        List<TestScenario> tagged = repository.searchScenarios(ScenarioSearchCriteria.builder()
                .tags(List.of("smoke", "regression"))
                .sortBy(ScenarioSortField.TITLE, false)
                .build()).join();
        List<TestScenario> drafts = repository.searchScenarios(ScenarioSearchCriteria.builder()
                .status(DRAFT)
                .sortBy(ScenarioSortField.TITLE, false)
                .build()).join();

        // Then
        assertThat(tagged).extracting(TestScenario::title).containsExactly("A", "B");
        assertThat(drafts).extracting(TestScenario::title).containsExactly("B", "C");
    }

    @Test
    @DisplayName("Invalid page settings should be rejected")
    void shouldRejectInvalidPaging() {
        assertThatThrownBy(() -> ScenarioSearchCriteria.builder().page(0, 10).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResultSearchCriteria.builder().page(1, 0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Update should replace an existing scenario and be idempotent")
    void shouldUpdateScenario() {
        // Given
        TestScenario scenario = scenario("p1", "Login", UI, BASE_TIME);
        repository.saveScenario(scenario).join();
        TestScenario updated = scenario.toBuilder().title("Login v2").status(ACTIVE).build();

        // When
        boolean first = repository.updateScenario(updated).join();
        TestScenario afterFirst = repository.getScenario(scenario.id()).join().orElseThrow();
        boolean second = repository.updateScenario(updated).join();
        TestScenario afterSecond = repository.getScenario(scenario.id()).join().orElseThrow();

        // Then
        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(afterFirst).isEqualTo(updated);
        assertThat(afterSecond).isEqualTo(afterFirst);
        assertThat(repository.updateScenario(scenario("p1", "Unknown", UI, BASE_TIME)).join()).isFalse();
    }

    @Test
    @DisplayName("Delete should remove the scenario with its results")
    void shouldDeleteScenarioWithResults() {
        // Given
        TestScenario scenario = scenario("p1", "Login", UI, BASE_TIME);
        repository.saveScenario(scenario).join();
        repository.saveResult(result(scenario.id(), BASE_TIME, true, 1, TESTING)).join();

        // When
        boolean deleted = repository.deleteScenario(scenario.id()).join();

        // Then
        assertThat(deleted).isTrue();
        assertThat(repository.getScenario(scenario.id()).join()).isEmpty();
        assertThat(repository.getResults(scenario.id()).join()).isEmpty();
        assertThat(repository.deleteScenario(scenario.id()).join()).isFalse();
    }

    @Test
    @DisplayName("History should be returned newest first")
    void shouldReturnHistoryNewestFirst() {
        // Given
        TestResult older = result("s1", BASE_TIME, false, 1, TESTING);
        TestResult newer = result("s1", BASE_TIME.plusSeconds(60), true, 1, TESTING);
        repository.saveResult(older).join();
        repository.saveResult(newer).join();

        // When
        List<TestResult> history = repository.getResults("s1").join();

        // Then
        assertThat(history).extracting(TestResult::getId).containsExactly(newer.getId(), older.getId());
    }

    @Test
    @DisplayName("Running results should not be stored")
    void shouldRejectRunningResult() {
        // Given
        TestResult running = TestResult.start("s1", TESTING, "executor");

        // When
        CompletableFuture<String> saved = repository.saveResult(running);

        // Then
        assertThat(saved).isCompletedExceptionally();
        assertThat(repository.getResults("s1").join()).isEmpty();
    }

    @Test
    @DisplayName("Concurrent appends should all be kept")
    void shouldKeepConcurrentAppends() {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            // When
            List<CompletableFuture<String>> saves = IntStream.range(0, 200)
                    .mapToObj(i -> CompletableFuture.supplyAsync(() -> repository.saveResult(
                            result("s" + (i % 3), BASE_TIME.plusSeconds(i), true, 1, TESTING)).join(), pool))
                    .toList();
            saves.forEach(CompletableFuture::join);

            // Then
            int total = IntStream.range(0, 3).map(i -> repository.getResults("s" + i).join().size()).sum();
            assertThat(total).isEqualTo(200);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Result search should resolve the project and filter by outcome and environment")
    void shouldSearchResults() {
        // Given
        TestScenario first = scenario("p1", "First", UI, BASE_TIME);
        TestScenario second = scenario("p1", "Second", API, BASE_TIME);
        TestScenario foreign = scenario("p2", "Foreign", UI, BASE_TIME);
        List.of(first, second, foreign).forEach(scenario -> repository.saveScenario(scenario).join());
        TestResult slowFailure = result(first.id(), BASE_TIME, false, 30, STAGING);
        TestResult fastFailure = result(second.id(), BASE_TIME.plusSeconds(5), false, 2, STAGING);
        repository.saveResult(slowFailure).join();
        repository.saveResult(fastFailure).join();
        repository.saveResult(result(second.id(), BASE_TIME, true, 1, STAGING)).join();
        repository.saveResult(result(foreign.id(), BASE_TIME, false, 1, STAGING)).join();

        // When
        List<TestResult> failures = repository.searchResults(ResultSearchCriteria.builder()
                .projectId("p1")
                .passed(false)
                .environment(STAGING)
                .sortBy(ResultSortField.DURATION, true)
                .build()).join();
        List<TestResult> longRuns = repository.searchResults(ResultSearchCriteria.builder()
                .durationBetween(Duration.ofSeconds(10), null)
                .build()).join();

        // Then
        assertThat(failures).extracting(TestResult::getId).containsExactly(slowFailure.getId(), fastFailure.getId());
        assertThat(longRuns).extracting(TestResult::getId).containsExactly(slowFailure.getId());
    }

    @Test
    @DisplayName("Statistics should aggregate only the project results within the range")
    void shouldCalculateStatistics() {
        // Given
        TestScenario scenario = scenario("p1", "Login", UI, BASE_TIME);
        repository.saveScenario(scenario).join();
        repository.saveResult(result(scenario.id(), BASE_TIME, true, 2, TESTING)).join();
        repository.saveResult(result(scenario.id(), BASE_TIME.plusSeconds(60), false, 4, TESTING)).join();
        repository.saveResult(result(scenario.id(), BASE_TIME.minusSeconds(3600), false, 4, TESTING)).join();

        // When
        TestStatistics statistics = repository.getTestStatistics("p1", BASE_TIME, BASE_TIME.plusSeconds(120)).join();

        // Then
        assertThat(statistics.totalScenarios()).isEqualTo(1);
        assertThat(statistics.totalExecutions()).isEqualTo(2);
        assertThat(statistics.passedExecutions()).isEqualTo(1);
        assertThat(statistics.passRate()).isEqualTo(50.0);
        assertThat(statistics.averageDuration()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("Statistics of an empty project should have a zero pass rate")
    void shouldCalculateEmptyStatistics() {
        // When
        TestStatistics statistics = repository.getTestStatistics("empty", BASE_TIME, BASE_TIME.plusSeconds(1)).join();

        // Then
        assertThat(statistics.totalExecutions()).isZero();
        assertThat(statistics.passRate()).isZero();
        assertThat(statistics.averageDuration()).isEqualTo(Duration.ZERO);
        assertThat(statistics.dailyTrends()).isEmpty();
        assertThat(repository.getTestStatistics("empty", BASE_TIME, BASE_TIME.minusSeconds(1)))
                .isCompletedExceptionally();
    }

    @Test
    @DisplayName("Archiving should remove only results started before the cutoff")
    void shouldArchiveOldResults() {
        // Given
        TestScenario scenario = scenario("p1", "Login", UI, BASE_TIME);
        repository.saveScenario(scenario).join();
        repository.saveResult(result(scenario.id(), BASE_TIME.minusSeconds(7200), true, 1, TESTING)).join();
        repository.saveResult(result(scenario.id(), BASE_TIME.minusSeconds(3600), true, 1, TESTING)).join();
        repository.saveResult(result("other", BASE_TIME.minusSeconds(3600), true, 1, TESTING)).join();
        TestResult recent = result(scenario.id(), BASE_TIME, true, 1, TESTING);
        repository.saveResult(recent).join();

        // When
        int archived = repository.archiveOldResults(BASE_TIME).join();

        // Then
        assertThat(archived).isEqualTo(3);
        assertThat(repository.getResults(scenario.id()).join()).extracting(TestResult::getId)
                .containsExactly(recent.getId());
        assertThat(repository.getResults("other").join()).isEmpty();
        assertThat(repository.getScenario(scenario.id()).join()).isPresent();
        assertThat(repository.archiveOldResults(BASE_TIME).join()).isZero();
    }
}
