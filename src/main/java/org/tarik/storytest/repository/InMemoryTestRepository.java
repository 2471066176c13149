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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.dto.TestStatistics;
import org.tarik.storytest.model.TestScenario;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;
import static java.time.Instant.now;
import static java.util.Comparator.comparing;
import static java.util.Optional.ofNullable;
import static java.util.stream.Collectors.toSet;

/**
 * Thread-safe repository keeping everything in memory.
 * <p>
 * Scenarios live in a concurrent map keyed by ID. The execution history of each scenario is an immutable list which
 * is replaced on every append under the lock of that scenario's key only, so concurrent appends for different
 * scenarios never contend and readers always see consistent snapshots.
 */
public class InMemoryTestRepository implements TestRepository {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTestRepository.class);
    private final ConcurrentMap<String, TestScenario> scenarios = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<TestResult>> resultsByScenarioId = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<String> saveScenario(@NotNull TestScenario scenario) {
        return supply(() -> {
            var stored = scenario.toBuilder().updatedAt(now()).build();
            scenarios.put(stored.id(), stored);
            LOG.debug("Saved scenario '{}' ({})", stored.title(), stored.id());
            return stored.id();
        });
    }

    @Override
    public CompletableFuture<Optional<TestScenario>> getScenario(@NotNull String scenarioId) {
        return supply(() -> ofNullable(scenarios.get(scenarioId)));
    }

    @Override
    public CompletableFuture<List<TestScenario>> getScenariosByProject(@NotNull String projectId) {
        return supply(() -> scenarios.values().stream()
                .filter(scenario -> projectId.equals(scenario.projectId()))
                .sorted(comparing(TestScenario::createdAt).thenComparing(TestScenario::id))
                .toList());
    }

    @Override
    public CompletableFuture<List<TestScenario>> searchScenarios(@NotNull ScenarioSearchCriteria criteria) {
        return supply(() -> {
            Comparator<TestScenario> comparator = criteria.sortBy().getComparator();
            if (criteria.sortDescending()) {
                comparator = comparator.reversed();
            }
            var matching = scenarios.values().stream()
                    .filter(criteria::matches)
                    .sorted(comparator.thenComparing(TestScenario::id));
            return page(matching, criteria.pageNumber(), criteria.pageSize());
        });
    }

    @Override
    public CompletableFuture<Boolean> updateScenario(@NotNull TestScenario scenario) {
        return supply(() -> {
            boolean updated = scenarios.replace(scenario.id(), scenario) != null;
            if (!updated) {
                LOG.warn("Scenario '{}' can't be updated because it doesn't exist", scenario.id());
            }
            return updated;
        });
    }

    @Override
    public CompletableFuture<Boolean> deleteScenario(@NotNull String scenarioId) {
        return supply(() -> {
            boolean deleted = scenarios.remove(scenarioId) != null;
            var removedResults = resultsByScenarioId.remove(scenarioId);
            LOG.debug("Deleted scenario '{}': {}, removed results: {}", scenarioId, deleted,
                    removedResults == null ? 0 : removedResults.size());
            return deleted;
        });
    }

    @Override
    public CompletableFuture<String> saveResult(@NotNull TestResult result) {
        return supply(() -> {
            checkArgument(result.isCompleted(), "Only completed results can be saved, result %s is still running",
                    result.getId());
            resultsByScenarioId.compute(result.getScenarioId(), (scenarioId, existing) -> {
                List<TestResult> updated = new ArrayList<>(existing == null ? List.of() : existing);
                updated.add(result);
                return List.copyOf(updated);
            });
            return result.getId();
        });
    }

    @Override
    public CompletableFuture<List<TestResult>> getResults(@NotNull String scenarioId) {
        return supply(() -> resultsByScenarioId.getOrDefault(scenarioId, List.of()).stream()
                .sorted(comparing(TestResult::getStartedAt).reversed())
                .toList());
    }

    @Override
    public CompletableFuture<List<TestResult>> searchResults(@NotNull ResultSearchCriteria criteria) {
        return supply(() -> {
            Set<String> projectScenarioIds = criteria.projectId() == null ? null : scenarios.values().stream()
                    .filter(scenario -> criteria.projectId().equals(scenario.projectId()))
                    .map(TestScenario::id)
                    .collect(toSet());
            Comparator<TestResult> comparator = criteria.sortBy().getComparator();
            if (criteria.sortDescending()) {
                comparator = comparator.reversed();
            }
            var matching = allResults()
                    .filter(result -> projectScenarioIds == null || projectScenarioIds.contains(result.getScenarioId()))
                    .filter(criteria::matches)
                    .sorted(comparator.thenComparing(TestResult::getId));
            return page(matching, criteria.pageNumber(), criteria.pageSize());
        });
    }

    @Override
    public CompletableFuture<TestStatistics> getTestStatistics(@NotNull String projectId, @NotNull Instant from,
                                                               @NotNull Instant to) {
        return supply(() -> {
            checkArgument(!from.isAfter(to), "Statistics range start %s is after its end %s", from, to);
            List<TestScenario> projectScenarios = scenarios.values().stream()
                    .filter(scenario -> projectId.equals(scenario.projectId()))
                    .toList();
            Collection<TestResult> results = allResults().toList();
            return StatisticsCalculator.calculate(projectId, from, to, projectScenarios, results);
        });
    }

    @Override
    public CompletableFuture<Integer> archiveOldResults(@NotNull Instant olderThan) {
        return supply(() -> {
            AtomicInteger removed = new AtomicInteger();
            for (String scenarioId : resultsByScenarioId.keySet()) {
                resultsByScenarioId.computeIfPresent(scenarioId, (id, existing) -> {
                    List<TestResult> kept = existing.stream()
                            .filter(result -> !result.getStartedAt().isBefore(olderThan))
                            .toList();
                    removed.addAndGet(existing.size() - kept.size());
                    return kept.isEmpty() ? null : kept;
                });
            }
            LOG.info("Archived {} results which started before {}", removed.get(), olderThan);
            return removed.get();
        });
    }

    private Stream<TestResult> allResults() {
        return resultsByScenarioId.values().stream().flatMap(List::stream);
    }

    private static <T> List<T> page(Stream<T> items, int pageNumber, int pageSize) {
        return items
                .skip((long) (pageNumber - 1) * pageSize)
                .limit(pageSize)
                .toList();
    }

    private static <T> CompletableFuture<T> supply(Supplier<T> operation) {
        try {
            return CompletableFuture.completedFuture(operation.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
