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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.storytest.dto.ScenarioValidationResult;
import org.tarik.storytest.dto.StepResult;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.model.ParameterValue;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.model.TestStep;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.time.Instant.now;
import static java.util.Collections.unmodifiableMap;
import static java.util.Comparator.comparingInt;
import static java.util.Objects.requireNonNullElse;
import static java.util.stream.Collectors.toSet;
import static org.tarik.storytest.generator.ScenarioCategory.GENERIC;
import static org.tarik.storytest.generator.ScenarioCategory.LOGIN;
import static org.tarik.storytest.generator.ScenarioCategory.PAYMENT;
import static org.tarik.storytest.model.TestEnvironment.TESTING;
import static org.tarik.storytest.model.TestPriority.HIGH;
import static org.tarik.storytest.model.TestPriority.MEDIUM;
import static org.tarik.storytest.model.TestStatus.DRAFT;
import static org.tarik.storytest.model.TestStatus.GENERATED;
import static org.tarik.storytest.model.TestType.API;
import static org.tarik.storytest.model.TestType.UI;
import static org.tarik.storytest.utils.CommonUtils.isBlank;
import static org.tarik.storytest.utils.CommonUtils.isNotBlank;
import static org.tarik.storytest.utils.CommonUtils.truncate;

/**
 * Deterministic generator which builds scenarios from canned step templates selected by the keyword category of the
 * story. It needs no network access and never fails on malformed input, which makes it the fallback of the
 * model-backed generator.
 */
public class RuleBasedScenarioGenerator implements ScenarioGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(RuleBasedScenarioGenerator.class);
    public static final String DEFAULT_USERNAME = "test@example.com";
    public static final String DEFAULT_PASSWORD = "password123";
    public static final String GENERATED_TAG = "generated";
    public static final String SUGGESTED_TAG = "suggested";
    public static final String NEGATIVE_TAG = "negative";
    private static final String CREATED_BY = "rule-based-generator";
    private static final String DEFAULT_PRECONDITION = "Application should be accessible";
    private static final String PAGE_LOADED = "Page loads successfully";
    private static final String ERROR_MESSAGE_SELECTOR = ".error-message";
    private static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration REFINED_WAIT = Duration.ofMillis(500);
    private static final int MAX_DESCRIPTION_LENGTH = 200;
    private static final int MAX_RECOMMENDED_STEPS = 20;
    private static final Set<String> INTERACTION_ACTIONS = Set.of("navigate", "click", "double_click", "right_click",
            "enter_text", "type", "select_option", "select_checkbox", "upload_file", "drag_drop");

    private final StoryAnalyzer storyAnalyzer;

    public RuleBasedScenarioGenerator() {
        this(new StoryAnalyzer());
    }

    public RuleBasedScenarioGenerator(@NotNull StoryAnalyzer storyAnalyzer) {
        this.storyAnalyzer = storyAnalyzer;
    }

    @Override
    public TestScenario generate(@Nullable String userStory, @Nullable String projectContext) {
        String story = userStory == null ? "" : userStory;
        StoryAnalysis analysis = storyAnalyzer.analyze(story);
        ScenarioCategory category = analysis.category();
        var builder = TestScenario.builder()
                .title(category.getTitle())
                .description("Generated from user story: %s".formatted(
                        isBlank(story) ? "<empty>" : truncate(story.trim(), MAX_DESCRIPTION_LENGTH)))
                .originalUserStory(story)
                .type(analysis.testType())
                .status(GENERATED)
                .priority(category == LOGIN || category == PAYMENT ? HIGH : MEDIUM)
                .environment(TESTING)
                .steps(buildSteps(analysis))
                .tags(List.of(category.getTag(), GENERATED_TAG))
                .preconditions(List.of(DEFAULT_PRECONDITION))
                .expectedOutcomes(List.of(category.getExpectedOutcome()))
                .createdBy(CREATED_BY)
                .metadataEntry("generator", ParameterValue.of("rule_based"))
                .metadataEntry("category", ParameterValue.of(category.getTag()))
                .testData(extractTestData(analysis));
        if (isNotBlank(projectContext)) {
            builder.metadataEntry("projectContext", ParameterValue.of(projectContext));
        }
        TestScenario scenario = builder.build();
        LOG.info("Generated {} scenario '{}' with {} steps for the '{}' category", scenario.type(), scenario.title(),
                scenario.steps().size(), category.getTag());
        return scenario;
    }

    @Override
    public List<TestStep> refineSteps(@NotNull List<TestStep> steps, @Nullable String feedback) {
        String normalizedFeedback = feedback == null ? "" : feedback.toLowerCase();
        boolean addScreenshots = normalizedFeedback.contains("screenshot");
        boolean extendTimeouts = normalizedFeedback.contains("timeout") || normalizedFeedback.contains("slow");
        boolean continueOnFailedChecks = normalizedFeedback.contains("continue");
        boolean addWaits = normalizedFeedback.contains("wait") || normalizedFeedback.contains("flaky");

        List<TestStep> orderedSteps = steps.stream().sorted(comparingInt(TestStep::order)).toList();
        List<TestStep> refinedSteps = new ArrayList<>();
        for (TestStep step : orderedSteps) {
            var builder = step.toBuilder().order(refinedSteps.size() + 1);
            if (addScreenshots) {
                builder.takeScreenshot(true);
            }
            if (extendTimeouts) {
                builder.timeout(step.timeout() == null ? DEFAULT_STEP_TIMEOUT : step.timeout().multipliedBy(2));
            }
            if (continueOnFailedChecks && isVerification(step)) {
                builder.continueOnFailure(true);
            }
            if (addWaits && INTERACTION_ACTIONS.contains(step.normalizedAction())) {
                builder.waitAfter(step.waitAfter().plus(REFINED_WAIT));
            }
            refinedSteps.add(builder.build());
        }
        LOG.debug("Refined {} steps (screenshots: {}, timeouts: {}, continue on failure: {}, waits: {})",
                refinedSteps.size(), addScreenshots, extendTimeouts, continueOnFailedChecks, addWaits);
        return refinedSteps;
    }

    @Override
    public String analyzeFailure(@NotNull TestResult result) {
        if (result.isPassed()) {
            return "Test passed, there are no failures to analyze";
        }
        List<StepResult> stepResults = result.getStepResults();
        long passedSteps = stepResults.stream().filter(StepResult::passed).count();
        Optional<StepResult> firstFailure = result.getFirstFailure();
        if (firstFailure.isEmpty()) {
            return "Test failed before any step failed: %s. %d of %d executed steps passed."
                    .formatted(result.getMessage(), passedSteps, stepResults.size());
        }

        StepResult failedStep = firstFailure.get();
        StringBuilder analysis = new StringBuilder("Test failed at step '%s' (%s on '%s'): %s."
                .formatted(failedStep.stepName(), failedStep.action(), failedStep.target(),
                        requireNonNullElse(failedStep.message(), "no failure message")));
        analysis.append(" %d of %d executed steps passed.".formatted(passedSteps, stepResults.size()));
        if (isNotBlank(failedStep.expectedResult()) && isNotBlank(failedStep.actualResult())) {
            analysis.append(" Expected '%s' but got '%s'.".formatted(failedStep.expectedResult(),
                    failedStep.actualResult()));
        }
        analysis.append(' ').append(getHint(failedStep));
        return analysis.toString();
    }

    @Override
    public Map<String, ParameterValue> generateTestData(@NotNull TestScenario scenario, @Nullable String requirements) {
        Map<String, ParameterValue> testData = new LinkedHashMap<>(scenario.testData());
        for (TestStep step : scenario.getExecutableSteps()) {
            step.parameters().forEach((name, value) -> {
                String key = testData.containsKey(name) ? "%s_%d".formatted(name, step.order()) : name;
                testData.putIfAbsent(key, value);
            });
        }
        if (scenario.tags().contains(LOGIN.getTag())) {
            testData.putIfAbsent("username", ParameterValue.of(DEFAULT_USERNAME));
            testData.putIfAbsent("password", ParameterValue.of(DEFAULT_PASSWORD));
        }

        String normalizedRequirements = requirements == null ? "" : requirements.toLowerCase();
        if (normalizedRequirements.contains("email")) {
            testData.putIfAbsent("email", ParameterValue.of("test.user@example.com"));
        }
        if (normalizedRequirements.contains("invalid") || normalizedRequirements.contains("negative")) {
            testData.putIfAbsent("invalidEmail", ParameterValue.of("invalid-email"));
            testData.putIfAbsent("invalidPassword", ParameterValue.of("wrong-password"));
        }
        if (normalizedRequirements.contains("boundary") || normalizedRequirements.contains("edge")) {
            testData.putIfAbsent("emptyString", ParameterValue.of(""));
            testData.putIfAbsent("longString", ParameterValue.of("a".repeat(256)));
        }
        if (normalizedRequirements.contains("number") || normalizedRequirements.contains("numeric")
                || normalizedRequirements.contains("amount")) {
            testData.putIfAbsent("positiveNumber", ParameterValue.of(100));
            testData.putIfAbsent("zero", ParameterValue.of(0));
            testData.putIfAbsent("negativeNumber", ParameterValue.of(-1));
        }
        if (normalizedRequirements.contains("date")) {
            testData.putIfAbsent("futureDate", ParameterValue.of("2030-01-01"));
            testData.putIfAbsent("pastDate", ParameterValue.of("2000-01-01"));
        }
        return unmodifiableMap(testData);
    }

    @Override
    public List<TestScenario> optimizeScenarios(@NotNull List<TestScenario> scenarios) {
        return scenarios.stream().map(RuleBasedScenarioGenerator::optimize).toList();
    }

    @Override
    public List<TestScenario> suggestAdditionalTests(@NotNull List<TestScenario> existingScenarios,
                                                     @Nullable String context) {
        Set<ScenarioCategory> coveredCategories = EnumSet.noneOf(ScenarioCategory.class);
        existingScenarios.forEach(scenario -> scenario.tags().stream()
                .map(ScenarioCategory::fromTag)
                .flatMap(Optional::stream)
                .forEach(coveredCategories::add));
        if (isNotBlank(context)) {
            coveredCategories.add(ScenarioCategory.detect(context));
        }
        coveredCategories.remove(GENERIC);

        if (coveredCategories.isEmpty()) {
            var smokeTest = generate(context, null);
            return List.of(smokeTest.toBuilder()
                    .status(DRAFT)
                    .tags(List.of(smokeTest.tags().get(0), SUGGESTED_TAG))
                    .build());
        }

        Set<String> existingTitles = existingScenarios.stream()
                .map(TestScenario::title)
                .filter(Objects::nonNull)
                .map(String::toLowerCase)
                .collect(toSet());
        List<TestScenario> suggestions = new ArrayList<>();
        for (ScenarioCategory category : coveredCategories) {
            String title = "%s - Invalid Input".formatted(category.getTitle());
            if (!existingTitles.contains(title.toLowerCase())) {
                suggestions.add(buildNegativeScenario(category, title, findEntryPoint(existingScenarios, category)));
            }
        }
        LOG.info("Suggested {} additional scenarios for {} covered categories", suggestions.size(),
                coveredCategories.size());
        return suggestions;
    }

    @Override
    public ScenarioValidationResult validateScenario(@NotNull TestScenario scenario) {
        List<String> issues = scenario.validate();
        List<String> suggestions = new ArrayList<>();
        List<String> missingCoverage = new ArrayList<>();
        List<String> recommendedAssertions = new ArrayList<>();
        int score = 100 - issues.size() * 20;

        List<TestStep> steps = scenario.getExecutableSteps();
        if (steps.stream().noneMatch(RuleBasedScenarioGenerator::isVerification)) {
            missingCoverage.add("No step verifies the outcome of the scenario");
            recommendedAssertions.add(steps.isEmpty() ? "Add a verify step checking the expected outcome"
                    : "Add a verify step after '%s'".formatted(steps.get(steps.size() - 1).getDisplayName()));
            score -= 20;
        }
        if (scenario.type() == API && steps.stream().noneMatch(step -> "verify_status_code".equals(step.normalizedAction()))) {
            recommendedAssertions.add("Verify the response status code");
            score -= 10;
        }
        long stepsWithoutExpectation = steps.stream().filter(step -> isBlank(step.expectedResult())).count();
        if (stepsWithoutExpectation > 0) {
            suggestions.add("%d step(s) have no expected result".formatted(stepsWithoutExpectation));
            score -= 5;
        }
        if (scenario.expectedOutcomes().isEmpty()) {
            suggestions.add("Describe the expected outcomes of the scenario");
            score -= 5;
        }
        if (scenario.preconditions().isEmpty()) {
            suggestions.add("List the preconditions of the scenario");
            score -= 5;
        }
        if (steps.size() > MAX_RECOMMENDED_STEPS) {
            suggestions.add("Split the scenario, it has %d steps".formatted(steps.size()));
            score -= 10;
        }
        if (!scenario.tags().contains(NEGATIVE_TAG)) {
            missingCoverage.add("Negative cases are not covered");
        }
        int qualityScore = Math.max(0, Math.min(100, score));
        return new ScenarioValidationResult(issues.isEmpty(), qualityScore, issues, suggestions, missingCoverage,
                recommendedAssertions);
    }

    private static List<TestStep> buildSteps(StoryAnalysis analysis) {
        List<TestStep.Builder> templateSteps;
        if (analysis.category() == GENERIC) {
            templateSteps = List.of(step("verify", analysis.primaryUrl().orElse("page"), "Verify that the page loads",
                    PAGE_LOADED).parameter("expected", PAGE_LOADED));
        } else if (analysis.testType() == API) {
            templateSteps = buildApiSteps(analysis);
        } else {
            templateSteps = buildUiSteps(analysis);
        }

        List<TestStep> steps = new ArrayList<>();
        for (TestStep.Builder templateStep : templateSteps) {
            steps.add(templateStep.order(steps.size() + 1).build());
        }
        return steps;
    }

    private static List<TestStep.Builder> buildUiSteps(StoryAnalysis analysis) {
        ScenarioCategory category = analysis.category();
        String entryPoint = analysis.primaryUrl().orElse(category.getDefaultPath());
        List<TestStep.Builder> steps = new ArrayList<>();
        steps.add(step("navigate", entryPoint, "Open %s".formatted(entryPoint), "Page is loaded"));
        switch (category) {
            case LOGIN -> {
                steps.add(step("enter_text", "#username", "Enter the username", "Username is entered")
                        .parameter("value", analysis.getUsername().orElse(DEFAULT_USERNAME)));
                steps.add(step("enter_text", "#password", "Enter the password", "Password is entered")
                        .parameter("value", analysis.getPassword().orElse(DEFAULT_PASSWORD)));
                steps.add(step("click", "#login-button", "Click the login button", "Login form is submitted"));
                steps.add(step("verify", "#user-menu", "Verify that the user is logged in", "User is logged in")
                        .parameter("expected", "User is logged in"));
            }
            case QUOTE -> {
                steps.add(step("enter_text", "#coverage-amount", "Enter the coverage amount", "Amount is entered")
                        .parameter("value", analysis.firstQuotedValue().orElse("100000")));
                steps.add(step("enter_text", "#zip-code", "Enter the ZIP code", "ZIP code is entered")
                        .parameter("value", "10001"));
                steps.add(step("click", "#get-quote-button", "Request the quote", "Quote request is submitted"));
                steps.add(step("verify", "#quote-result", "Verify that the quote is displayed", "Quote is displayed")
                        .parameter("expected", "Quote amount is displayed"));
            }
            case CLAIM -> {
                steps.add(step("click", "#new-claim-button", "Start a new claim", "Claim form is displayed"));
                steps.add(step("enter_text", "#claim-description", "Describe the claim", "Description is entered")
                        .parameter("value", analysis.firstQuotedValue().orElse("Water damage in the kitchen")));
                steps.add(step("click", "#submit-claim-button", "Submit the claim", "Claim is submitted"));
                steps.add(step("verify", "#claim-confirmation", "Verify the claim confirmation",
                        "Confirmation is displayed").parameter("expected", "Claim submitted successfully"));
            }
            case PAYMENT -> {
                steps.add(step("enter_text", "#card-number", "Enter the card number", "Card number is entered")
                        .parameter("value", "4111111111111111"));
                steps.add(step("enter_text", "#card-expiry", "Enter the expiry date", "Expiry date is entered")
                        .parameter("value", "12/30"));
                steps.add(step("enter_text", "#card-cvv", "Enter the CVV", "CVV is entered")
                        .parameter("value", "123"));
                steps.add(step("click", "#pay-button", "Submit the payment", "Payment is submitted"));
                steps.add(step("verify", "#payment-confirmation", "Verify the payment confirmation",
                        "Confirmation is displayed").parameter("expected", "Payment processed successfully"));
            }
            default -> {
                // Generic stories have no template beyond the page check
            }
        }
        return steps;
    }

    private static List<TestStep.Builder> buildApiSteps(StoryAnalysis analysis) {
        ScenarioCategory category = analysis.category();
        String endpoint = analysis.primaryUrl().orElse(category.getDefaultApiPath());
        return List.of(
                step("api_get", endpoint, "Check that the endpoint responds", "Endpoint is reachable"),
                step("api_post", endpoint, "Submit a %s request".formatted(category.getTag()), "Request is accepted")
                        .parameter("body", ParameterValue.from(buildRequestBody(analysis))),
                step("verify_status_code", "response", "Verify the response status code", "Status code is 200")
                        .parameter("expectedCode", "200"));
    }

    private static Map<String, Object> buildRequestBody(StoryAnalysis analysis) {
        Map<String, Object> body = new LinkedHashMap<>();
        switch (analysis.category()) {
            case LOGIN -> {
                body.put("username", analysis.getUsername().orElse(DEFAULT_USERNAME));
                body.put("password", analysis.getPassword().orElse(DEFAULT_PASSWORD));
            }
            case QUOTE -> body.put("coverageAmount", analysis.firstQuotedValue().orElse("100000"));
            case CLAIM -> body.put("description", analysis.firstQuotedValue().orElse("Water damage in the kitchen"));
            case PAYMENT -> {
                body.put("cardNumber", "4111111111111111");
                body.put("amount", "100.00");
            }
            default -> body.put("data", analysis.firstQuotedValue().orElse("test"));
        }
        return body;
    }

    private static Map<String, ParameterValue> extractTestData(StoryAnalysis analysis) {
        Map<String, ParameterValue> testData = new LinkedHashMap<>();
        analysis.primaryUrl().ifPresent(url -> testData.put("url", ParameterValue.of(url)));
        if (analysis.category() == LOGIN || analysis.hasCredentials()) {
            testData.put("username", ParameterValue.of(analysis.getUsername().orElse(DEFAULT_USERNAME)));
            testData.put("password", ParameterValue.of(analysis.getPassword().orElse(DEFAULT_PASSWORD)));
        }
        List<String> quotedValues = analysis.quotedValues();
        for (int i = 0; i < quotedValues.size(); i++) {
            testData.put("value%d".formatted(i + 1), ParameterValue.of(quotedValues.get(i)));
        }
        return testData;
    }

    private static TestScenario optimize(TestScenario scenario) {
        List<TestStep> optimizedSteps = new ArrayList<>();
        TestStep previous = null;
        for (TestStep step : scenario.getExecutableSteps()) {
            if (previous != null && isDuplicate(previous, step)) {
                continue;
            }
            optimizedSteps.add(step.toBuilder()
                    .order(optimizedSteps.size() + 1)
                    .timeout(step.timeout() == null ? DEFAULT_STEP_TIMEOUT : step.timeout())
                    .build());
            previous = step;
        }
        if (optimizedSteps.isEmpty()) {
            LOG.warn("Scenario '{}' has no enabled steps, leaving it unchanged", scenario.id());
            return scenario;
        }
        LOG.debug("Optimized scenario '{}': {} of {} steps kept", scenario.id(), optimizedSteps.size(),
                scenario.steps().size());
        return scenario.toBuilder().steps(optimizedSteps).updatedAt(now()).build();
    }

    private static boolean isDuplicate(TestStep previous, TestStep current) {
        return previous.normalizedAction().equals(current.normalizedAction())
                && Objects.equals(previous.target(), current.target())
                && previous.parameters().equals(current.parameters());
    }

    private static String findEntryPoint(List<TestScenario> scenarios, ScenarioCategory category) {
        return scenarios.stream()
                .filter(scenario -> scenario.tags().contains(category.getTag()))
                .flatMap(scenario -> scenario.getExecutableSteps().stream())
                .filter(step -> "navigate".equals(step.normalizedAction()) && isNotBlank(step.target()))
                .map(TestStep::target)
                .findFirst()
                .orElse(category.getDefaultPath());
    }

    private static TestScenario buildNegativeScenario(ScenarioCategory category, String title, String entryPoint) {
        List<TestStep.Builder> templateSteps = new ArrayList<>();
        templateSteps.add(step("navigate", entryPoint, "Open %s".formatted(entryPoint), "Page is loaded"));
        String expectedError;
        switch (category) {
            case LOGIN -> {
                templateSteps.add(step("enter_text", "#username", "Enter an unknown username", "Username is entered")
                        .parameter("value", "invalid-user@example.com"));
                templateSteps.add(step("enter_text", "#password", "Enter a wrong password", "Password is entered")
                        .parameter("value", "wrong-password"));
                templateSteps.add(step("click", "#login-button", "Click the login button", "Login is rejected"));
                expectedError = "Invalid username or password";
            }
            case QUOTE -> {
                templateSteps.add(step("enter_text", "#coverage-amount", "Enter a negative amount",
                        "Amount is entered").parameter("value", "-1"));
                templateSteps.add(step("click", "#get-quote-button", "Request the quote", "Request is rejected"));
                expectedError = "Coverage amount must be positive";
            }
            case CLAIM -> {
                templateSteps.add(step("click", "#new-claim-button", "Start a new claim", "Claim form is displayed"));
                templateSteps.add(step("click", "#submit-claim-button", "Submit the empty claim",
                        "Submission is rejected"));
                expectedError = "Claim description is required";
            }
            case PAYMENT -> {
                templateSteps.add(step("enter_text", "#card-number", "Enter an invalid card number",
                        "Card number is entered").parameter("value", "1234"));
                templateSteps.add(step("click", "#pay-button", "Submit the payment", "Payment is rejected"));
                expectedError = "Card number is invalid";
            }
            default -> expectedError = "Validation error is displayed";
        }
        templateSteps.add(step("verify", ERROR_MESSAGE_SELECTOR, "Verify the error message", expectedError)
                .parameter("expected", expectedError));

        List<TestStep> steps = new ArrayList<>();
        for (TestStep.Builder templateStep : templateSteps) {
            steps.add(templateStep.order(steps.size() + 1).build());
        }
        return TestScenario.builder()
                .title(title)
                .description("Verifies that invalid input is rejected during the %s flow".formatted(category.getTag()))
                .type(UI)
                .status(DRAFT)
                .priority(MEDIUM)
                .environment(TESTING)
                .steps(steps)
                .tags(List.of(category.getTag(), SUGGESTED_TAG, NEGATIVE_TAG))
                .preconditions(List.of(DEFAULT_PRECONDITION))
                .expectedOutcomes(List.of(expectedError))
                .createdBy(CREATED_BY)
                .build();
    }

    private static String getHint(StepResult failedStep) {
        String action = failedStep.action() == null ? "" : failedStep.action().toLowerCase();
        String message = failedStep.message() == null ? "" : failedStep.message().toLowerCase();
        if (message.contains("timeout")) {
            return "The step exceeded its timeout, check the responsiveness of the environment or increase the timeout.";
        } else if (action.startsWith("api_") || action.equals("verify_status_code")) {
            return "Check that the service endpoint is reachable and returns the expected response.";
        } else if (action.startsWith("verify") || action.startsWith("assert")) {
            return "Compare the expected value with the actual content, the expectation may be outdated.";
        } else if (INTERACTION_ACTIONS.contains(action)) {
            return "Check that the target '%s' still matches an element on the page.".formatted(failedStep.target());
        } else {
            return "Review the step configuration and the application logs.";
        }
    }

    private static boolean isVerification(TestStep step) {
        String action = step.normalizedAction();
        return action.startsWith("verify") || action.startsWith("assert");
    }

    private static TestStep.Builder step(String action, String target, String description, String expectedResult) {
        return TestStep.builder()
                .action(action)
                .target(target)
                .description(description)
                .expectedResult(expectedResult);
    }
}
