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
package org.tarik.storytest.generator;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.storytest.model.TestType;

import java.util.List;
import java.util.Optional;

import static java.util.Optional.ofNullable;

/**
 * Facts extracted from a user story.
 *
 * @param urls         URLs in order of appearance, without duplicates
 * @param username     first e-mail address or the user named next to the credentials, if any
 * @param password     password found next to a password keyword, if any
 * @param quotedValues strings quoted in the story, usable as test data
 * @param category     keyword category which selects the step template
 * @param testType     {@link TestType#API} if the story talks about an API, a service or an endpoint
 */
public record StoryAnalysis(@NotNull List<String> urls,
                            @Nullable String username,
                            @Nullable String password,
                            @NotNull List<String> quotedValues,
                            @NotNull ScenarioCategory category,
                            @NotNull TestType testType) {

    public StoryAnalysis {
        urls = List.copyOf(urls);
        quotedValues = List.copyOf(quotedValues);
    }

    public Optional<String> primaryUrl() {
        return urls.stream().findFirst();
    }

    public Optional<String> firstQuotedValue() {
        return quotedValues.stream().findFirst();
    }

    public boolean hasCredentials() {
        return username != null || password != null;
    }

    public Optional<String> getUsername() {
        return ofNullable(username);
    }

    public Optional<String> getPassword() {
        return ofNullable(password);
    }
}
