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

import org.jetbrains.annotations.Nullable;
import org.tarik.storytest.model.TestType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.regex.Pattern.CASE_INSENSITIVE;
import static org.tarik.storytest.model.TestType.API;
import static org.tarik.storytest.model.TestType.UI;

/**
 * Pattern-based extraction of URLs, credentials, quoted test data and the keyword category from a user story.
 */
public class StoryAnalyzer {
    private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+");
    private static final String URL_TRAILING_PUNCTUATION = ".,;:!?)]}'\"";
    private static final Pattern EMAIL_PATTERN = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern PASSWORD_PATTERN = Pattern.compile("\\b(?:password|pwd|pass)\\b[:\\s]+([^\\s,]+)",
            CASE_INSENSITIVE);
    private static final Pattern CREDENTIALS_PATTERN = Pattern.compile(
            "\\bcredentials?[:\\s]+([^\\s,/]+)\\s*/\\s*([^\\s,]+)", CASE_INSENSITIVE);
    private static final Pattern QUOTED_PATTERN = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern API_PATTERN = Pattern.compile("\\b(apis?|services?|endpoints?)\\b", CASE_INSENSITIVE);

    /**
     * Analyzes the story. A {@code null} story is treated as an empty one.
     */
    public StoryAnalysis analyze(@Nullable String userStory) {
        String story = userStory == null ? "" : userStory;
        List<String> urls = extractUrls(story);
        // URLs can contain '@' and keywords, so the remaining patterns run on the text without them
        String text = URL_PATTERN.matcher(story).replaceAll(" ");

        String username = null;
        String password = null;
        Matcher credentialsMatcher = CREDENTIALS_PATTERN.matcher(text);
        if (credentialsMatcher.find()) {
            username = credentialsMatcher.group(1);
            password = stripTrailingPunctuation(credentialsMatcher.group(2));
        }
        Matcher emailMatcher = EMAIL_PATTERN.matcher(text);
        if (emailMatcher.find()) {
            username = emailMatcher.group();
        }
        Matcher passwordMatcher = PASSWORD_PATTERN.matcher(text);
        if (password == null && passwordMatcher.find()) {
            password = stripTrailingPunctuation(passwordMatcher.group(1));
        }

        List<String> quotedValues = new ArrayList<>();
        Matcher quotedMatcher = QUOTED_PATTERN.matcher(text);
        while (quotedMatcher.find()) {
            quotedValues.add(quotedMatcher.group(1));
        }

        TestType testType = API_PATTERN.matcher(text).find() ? API : UI;
        return new StoryAnalysis(urls, username, password, quotedValues, ScenarioCategory.detect(text), testType);
    }

    private static List<String> extractUrls(String story) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = URL_PATTERN.matcher(story);
        while (matcher.find()) {
            String url = stripTrailingPunctuation(matcher.group());
            if (url.indexOf("://") + 3 < url.length()) {
                urls.add(url);
            }
        }
        return List.copyOf(urls);
    }

    private static String stripTrailingPunctuation(String value) {
        int end = value.length();
        while (end > 0 && URL_TRAILING_PUNCTUATION.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(0, end);
    }
}
