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

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Outcome of an executor's pre-flight check of a scenario.
 *
 * @param canExecute whether the executor is able to run the scenario as it is
 * @param messages   problems found, or notes about the scenario
 */
public record ExecutorValidationResult(boolean canExecute, @NotNull List<String> messages) {
    public ExecutorValidationResult {
        messages = List.copyOf(messages);
    }

    public static ExecutorValidationResult from(@NotNull List<String> problems) {
        return new ExecutorValidationResult(problems.isEmpty(), problems);
    }
}
