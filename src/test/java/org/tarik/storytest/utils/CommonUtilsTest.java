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
package org.tarik.storytest.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.storytest.model.ParameterValue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tarik.storytest.utils.CommonUtils.*;

@DisplayName("CommonUtils Tests")
class CommonUtilsTest {

    @Test
    @DisplayName("parseStringAsInteger: Should parse valid and reject invalid input")
    void parseInteger() {
        assertThat(parseStringAsInteger(" 42 ")).contains(42);
        assertThat(parseStringAsInteger("4.2")).isEmpty();
        assertThat(parseStringAsInteger(null)).isEmpty();
    }

    @Test
    @DisplayName("parseStringAsDouble: Should parse valid and reject invalid input")
    void parseDouble() {
        assertThat(parseStringAsDouble("2.5")).contains(2.5);
        assertThat(parseStringAsDouble("abc")).isEmpty();
        assertThat(parseStringAsDouble("")).isEmpty();
    }

    @Test
    @DisplayName("isBlank / isNotBlank: Should treat whitespace as blank")
    void blankChecks() {
        assertThat(isBlank(null)).isTrue();
        assertThat(isBlank(" \t")).isTrue();
        assertThat(isNotBlank("a")).isTrue();
    }

    @Test
    @DisplayName("truncate: Should shorten only long strings")
    void truncateStrings() {
        assertThat(truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(truncate("abc", 3)).isEqualTo("abc");
        assertThat(truncate(null, 3)).isNull();
    }

    @Test
    @DisplayName("unwrapAsyncFailure: Should return the innermost non-wrapper cause")
    void unwrapFailures() {
        IllegalStateException cause = new IllegalStateException("root");

        assertThat(unwrapAsyncFailure(new CompletionException(new ExecutionException(cause)))).isSameAs(cause);
        assertThat(unwrapAsyncFailure(cause)).isSameAs(cause);
        CompletionException withoutCause = new CompletionException("no cause", null);
        assertThat(unwrapAsyncFailure(withoutCause)).isSameAs(withoutCause);
        assertThatThrownBy(() -> CompletableFuture.failedFuture(cause).join())
                .satisfies(error -> assertThat(unwrapAsyncFailure(error)).isSameAs(cause));
    }

    @Test
    @DisplayName("sleepMillis: Should restore the interrupt flag")
    void sleepRestoresInterrupt() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> sleepMillis(10)).isInstanceOf(IllegalStateException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("getObjectPrettyPrinted: Should write parameter values as plain JSON")
    void prettyPrintParameterValues() {
        Map<String, ParameterValue> values = Map.of("list", ParameterValue.from(List.of(1, "a", true)));

        assertThat(getObjectPrettyPrinted(values)).hasValueSatisfying(json ->
                assertThat(json.replaceAll("\\s", "")).isEqualTo("{\"list\":[1,\"a\",true]}"));
    }
}
