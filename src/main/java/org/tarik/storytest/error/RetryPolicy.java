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
package org.tarik.storytest.error;

/**
 * Configuration for retry logic.
 *
 * @param maxRetries         Maximum number of retry attempts.
 * @param initialDelayMillis Initial delay before the first retry in
 *                           milliseconds.
 * @param maxDelayMillis     Maximum delay between retries in milliseconds.
 * @param backoffMultiplier  Multiplier for exponential backoff.
 * @param timeoutMillis      Total timeout for the operation including retries, 0 means no timeout.
 */
public record RetryPolicy(
        int maxRetries,
        long initialDelayMillis,
        long maxDelayMillis,
        double backoffMultiplier,
        long timeoutMillis) {

    /**
     * Returns the delay to wait before the given retry attempt (1-based), capped by {@link #maxDelayMillis()}.
     */
    public long getDelayBeforeRetry(int attempt) {
        long delayMillis = (long) (initialDelayMillis * Math.pow(backoffMultiplier, Math.max(0, attempt - 1)));
        return Math.min(delayMillis, maxDelayMillis);
    }

    public boolean isTimedOut(long elapsedMillis) {
        return timeoutMillis > 0 && elapsedMillis > timeoutMillis;
    }
}
