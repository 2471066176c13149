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
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.dto.TestStatistics;
import org.tarik.storytest.dto.TestStatistics.DailyStatistics;
import org.tarik.storytest.dto.TestStatistics.EnvironmentStatistics;
import org.tarik.storytest.dto.TestStatistics.TypeStatistics;
import org.tarik.storytest.model.TestEnvironment;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.model.TestType;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static java.time.ZoneOffset.UTC;
import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.toList;
import static java.util.stream.Collectors.toSet;

/**
 * Aggregation formulas behind {@link TestStatistics}. Every rate is a percentage and is 0 for an empty set of
 * results; every average duration is zero for an empty set.
 */
public class StatisticsCalculator {

    public static TestStatistics calculate(@NotNull String projectId, @NotNull Instant from, @NotNull Instant to,
                                           @NotNull Collection<TestScenario> projectScenarios,
                                           @NotNull Collection<TestResult> results) {
        Set<String> projectScenarioIds = projectScenarios.stream().map(TestScenario::id).collect(toSet());
        List<TestResult> projectResults = results.stream()
                .filter(result -> projectScenarioIds.contains(result.getScenarioId()))
                .filter(result -> !result.getStartedAt().isBefore(from) && !result.getStartedAt().isAfter(to))
                .toList();

        int passed = countPassed(projectResults);
        return new TestStatistics(
                projectId,
                from,
                to,
                projectScenarios.size(),
                projectResults.size(),
                passed,
                projectResults.size() - passed,
                passRate(projectResults),
                averageDuration(projectResults),
                statsByType(projectScenarios, projectResults),
                statsByEnvironment(projectResults),
                dailyTrends(projectResults));
    }

    static double passRate(Collection<TestResult> results) {
        return results.isEmpty() ? 0 : countPassed(results) * 100.0 / results.size();
    }

    static Duration averageDuration(Collection<TestResult> results) {
        if (results.isEmpty()) {
            return Duration.ZERO;
        }
        long totalNanos = results.stream().mapToLong(result -> result.getDuration().toNanos()).sum();
        return Duration.ofNanos(totalNanos / results.size());
    }

    private static int countPassed(Collection<TestResult> results) {
        return (int) results.stream().filter(TestResult::isPassed).count();
    }

    private static Map<TestType, TypeStatistics> statsByType(Collection<TestScenario> scenarios,
                                                             List<TestResult> results) {
        Map<TestType, TypeStatistics> statsByType = new EnumMap<>(TestType.class);
        scenarios.stream()
                .collect(groupingBy(TestScenario::type))
                .forEach((type, typeScenarios) -> {
                    Set<String> ids = typeScenarios.stream().map(TestScenario::id).collect(toSet());
                    List<TestResult> typeResults = results.stream()
                            .filter(result -> ids.contains(result.getScenarioId()))
                            .toList();
                    statsByType.put(type, new TypeStatistics(typeScenarios.size(), typeResults.size(),
                            passRate(typeResults), averageDuration(typeResults)));
                });
        return statsByType;
    }

    private static Map<TestEnvironment, EnvironmentStatistics> statsByEnvironment(List<TestResult> results) {
        Map<TestEnvironment, EnvironmentStatistics> statsByEnvironment = new EnumMap<>(TestEnvironment.class);
        results.stream()
                .collect(groupingBy(TestResult::getEnvironment))
                .forEach((environment, environmentResults) -> statsByEnvironment.put(environment,
                        new EnvironmentStatistics(environmentResults.size(), countPassed(environmentResults),
                                passRate(environmentResults), averageDuration(environmentResults))));
        return statsByEnvironment;
    }

    private static List<DailyStatistics> dailyTrends(List<TestResult> results) {
        Map<LocalDate, List<TestResult>> resultsByDate = results.stream()
                .collect(groupingBy(result -> LocalDate.ofInstant(result.getStartedAt(), UTC), TreeMap::new,
                        toList()));
        return resultsByDate.entrySet().stream()
                .map(entry -> {
                    int passed = countPassed(entry.getValue());
                    return new DailyStatistics(entry.getKey(), entry.getValue().size(), passed,
                            entry.getValue().size() - passed, passRate(entry.getValue()));
                })
                .toList();
    }
}
