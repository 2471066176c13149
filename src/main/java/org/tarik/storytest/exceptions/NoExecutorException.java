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
package org.tarik.storytest.exceptions;

import org.tarik.storytest.model.TestType;

import static org.tarik.storytest.error.ErrorCategory.NO_EXECUTOR;

/**
 * Thrown when no registered executor can run scenarios of the requested type.
 */
public class NoExecutorException extends TestAutomationException {
    private final TestType testType;

    public NoExecutorException(TestType testType) {
        super("No executor available for test type '%s'".formatted(testType), NO_EXECUTOR);
        this.testType = testType;
    }

    public TestType getTestType() {
        return testType;
    }
}
