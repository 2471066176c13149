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

import org.tarik.storytest.dto.TestResult;

import java.time.Instant;
import java.util.Comparator;

import static java.util.Comparator.comparing;
import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsFirst;
import static java.util.stream.Stream.of;

/**
 * Fields result searches can be sorted by.
 */
public enum ResultSortField {
    STARTED_AT(comparing(TestResult::getStartedAt)),
    COMPLETED_AT(comparing(TestResult::getCompletedAt, nullsFirst(Comparator.<Instant>naturalOrder()))),
    DURATION(comparing(TestResult::getDuration)),
    PASSED(comparing(TestResult::isPassed)),
    ENVIRONMENT(comparing(TestResult::getEnvironment)),
    EXECUTED_BY(comparing(TestResult::getExecutedBy, nullsFirst(naturalOrder())));

    private final Comparator<TestResult> comparator;

    ResultSortField(Comparator<TestResult> comparator) {
        this.comparator = comparator;
    }

    public Comparator<TestResult> getComparator() {
        return comparator;
    }

    /**
     * Resolves a field by name, ignoring case and underscores. Unknown names fall back to {@link #STARTED_AT}.
     */
    public static ResultSortField fromName(String name) {
        if (name == null) {
            return STARTED_AT;
        }
        String normalized = name.replace("_", "").trim();
        return of(values())
                .filter(field -> field.name().replace("_", "").equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(STARTED_AT);
    }
}
