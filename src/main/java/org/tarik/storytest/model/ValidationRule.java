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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Additional assertion attached to a step, evaluated by the executor after the step action.
 *
 * @param validationType kind of check, e.g. "text_equals" or "status_code"
 * @param expectedValue  value the check compares against
 * @param target         optional locator overriding the step target
 * @param errorMessage   message reported when the check fails
 * @param required       whether a failed check fails the step
 */
public record ValidationRule(@NotNull String validationType,
                             @Nullable String expectedValue,
                             @Nullable String target,
                             @Nullable String errorMessage,
                             boolean required) {
}
