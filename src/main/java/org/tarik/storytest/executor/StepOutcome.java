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

import org.jetbrains.annotations.Nullable;

/**
 * What a concrete executor reports back after performing a single step action.
 */
public record StepOutcome(boolean passed, @Nullable String message, @Nullable String actualResult) {

    public static StepOutcome success(@Nullable String actualResult) {
        return new StepOutcome(true, null, actualResult);
    }

    public static StepOutcome failure(String message, @Nullable String actualResult) {
        return new StepOutcome(false, message, actualResult);
    }
}
