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

import java.util.Optional;
import java.util.regex.Pattern;

import static java.util.Arrays.stream;
import static java.util.regex.Pattern.CASE_INSENSITIVE;

/**
 * Domain keyword categories a user story can fall into. The declaration order is the matching priority: the first
 * category whose pattern is found in the story wins.
 */
public enum ScenarioCategory {
    QUOTE("\\bquotes?\\b", "Quote Generation Test", "/quote", "/api/quotes",
            "A quote is calculated and displayed"),
    LOGIN("\\blog\\s?in\\b|\\bsign\\s?in\\b|authenticat", "Login Test", "/login", "/api/auth/login",
            "The user is logged in and redirected to the home page"),
    CLAIM("\\bclaims?\\b", "Claim Submission Test", "/claims", "/api/claims",
            "The claim is submitted and a confirmation is displayed"),
    PAYMENT("\\bpay(ment)?s?\\b", "Payment Processing Test", "/payment", "/api/payments",
            "The payment is processed and a receipt is displayed"),
    GENERIC(null, "Page Verification Test", "/", "/", "The page loads successfully");

    private final Pattern pattern;
    private final String title;
    private final String defaultPath;
    private final String defaultApiPath;
    private final String expectedOutcome;

    ScenarioCategory(String regex, String title, String defaultPath, String defaultApiPath, String expectedOutcome) {
        this.pattern = regex == null ? null : Pattern.compile(regex, CASE_INSENSITIVE);
        this.title = title;
        this.defaultPath = defaultPath;
        this.defaultApiPath = defaultApiPath;
        this.expectedOutcome = expectedOutcome;
    }

    public static ScenarioCategory detect(String text) {
        return stream(values())
                .filter(category -> category.pattern != null && category.pattern.matcher(text).find())
                .findFirst()
                .orElse(GENERIC);
    }

    /**
     * Looks up a category by the tag the generator assigns to it.
     */
    public static Optional<ScenarioCategory> fromTag(String tag) {
        return stream(values())
                .filter(category -> category.getTag().equalsIgnoreCase(tag))
                .findFirst();
    }

    public String getTag() {
        return name().toLowerCase();
    }

    public String getTitle() {
        return title;
    }

    public String getDefaultPath() {
        return defaultPath;
    }

    public String getDefaultApiPath() {
        return defaultApiPath;
    }

    public String getExpectedOutcome() {
        return expectedOutcome;
    }
}
