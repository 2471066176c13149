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

import org.tarik.storytest.model.TestScenario;

import java.util.Comparator;

import static java.util.Comparator.comparing;
import static java.util.Comparator.nullsFirst;
import static java.util.stream.Stream.of;

/**
 * Fields scenario searches can be sorted by.
 */
public enum ScenarioSortField {
    TITLE(comparing(TestScenario::title, nullsFirst(String.CASE_INSENSITIVE_ORDER))),
    TYPE(comparing(TestScenario::type)),
    STATUS(comparing(TestScenario::status)),
    PRIORITY(comparing(TestScenario::priority)),
    CREATED_AT(comparing(TestScenario::createdAt)),
    UPDATED_AT(comparing(TestScenario::updatedAt)),
    CREATED_BY(comparing(TestScenario::createdBy, nullsFirst(String.CASE_INSENSITIVE_ORDER)));

    private final Comparator<TestScenario> comparator;

    ScenarioSortField(Comparator<TestScenario> comparator) {
        this.comparator = comparator;
    }

    public Comparator<TestScenario> getComparator() {
        return comparator;
    }

    /**
     * Resolves a field by name, ignoring case and underscores ("createdAt", "CREATED_AT"). Unknown names fall back to
     * {@link #CREATED_AT}.
     */
    public static ScenarioSortField fromName(String name) {
        if (name == null) {
            return CREATED_AT;
        }
        String normalized = name.replace("_", "").trim();
        return of(values())
                .filter(field -> field.name().replace("_", "").equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(CREATED_AT);
    }
}
