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

import static org.tarik.storytest.error.ErrorCategory.EXECUTION_FAILURE;

/**
 * Thrown when an executor faults while running a scenario. A failed assertion is never reported this way, it
 * results in a failed step result instead.
 */
public class TestExecutionException extends TestAutomationException {
    public TestExecutionException(String message, Throwable cause) {
        super(message, EXECUTION_FAILURE, cause);
    }
}
