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

import dev.langchain4j.model.chat.ChatModel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.storytest.StoryTestConfig;
import org.tarik.storytest.agents.AgentExecutionResult;
import org.tarik.storytest.agents.FailureAnalysisAgent;
import org.tarik.storytest.agents.ScenarioGenerationAgent;
import org.tarik.storytest.dto.GeneratedScenario;
import org.tarik.storytest.dto.GeneratedScenario.GeneratedParameter;
import org.tarik.storytest.dto.GeneratedScenario.GeneratedStep;
import org.tarik.storytest.dto.ScenarioValidationResult;
import org.tarik.storytest.dto.TestResult;
import org.tarik.storytest.model.ParameterValue;
import org.tarik.storytest.model.TestPriority;
import org.tarik.storytest.model.TestScenario;
import org.tarik.storytest.model.TestStep;
import org.tarik.storytest.model.TestType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dev.langchain4j.service.AiServices.builder;
import static java.util.Objects.requireNonNullElse;
import static org.tarik.storytest.generator.RuleBasedScenarioGenerator.GENERATED_TAG;
import static org.tarik.storytest.model.ModelFactory.getChatModel;
import static org.tarik.storytest.model.TestEnvironment.TESTING;
import static org.tarik.storytest.model.TestStatus.GENERATED;
import static org.tarik.storytest.utils.CommonUtils.getObjectPrettyPrinted;
import static org.tarik.storytest.utils.CommonUtils.isBlank;
import static org.tarik.storytest.utils.CommonUtils.isNotBlank;
import static org.tarik.storytest.utils.PromptUtils.loadSystemPrompt;

/**
 * Generator backed by a chat model. Scenario generation and failure analysis are delegated to the model; whenever
 * the model fails or returns something which isn't a valid scenario, the rule-based generator takes over. All other
 * operations are rule-based.
 */
public class AiScenarioGenerator implements ScenarioGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(AiScenarioGenerator.class);
    private static final String AI_TAG = "ai";
    private static final String CREATED_BY = "ai-generator";

    private final ScenarioGenerationAgent scenarioGenerationAgent;
    private final FailureAnalysisAgent failureAnalysisAgent;
    private final RuleBasedScenarioGenerator fallbackGenerator;

    public AiScenarioGenerator(@NotNull ScenarioGenerationAgent scenarioGenerationAgent,
                               @NotNull FailureAnalysisAgent failureAnalysisAgent,
                               @NotNull RuleBasedScenarioGenerator fallbackGenerator) {
        this.scenarioGenerationAgent = scenarioGenerationAgent;
        this.failureAnalysisAgent = failureAnalysisAgent;
        this.fallbackGenerator = fallbackGenerator;
    }

    /**
     * Creates the generator with agents built from the configured model provider and prompt versions.
     */
    public static AiScenarioGenerator createFromConfig() {
        ChatModel chatModel = getChatModel(StoryTestConfig.getModelName(), StoryTestConfig.getModelProvider());
        var scenarioGenerationPrompt = loadSystemPrompt("scenario_generator",
                StoryTestConfig.getScenarioGenerationAgentPromptVersion(), "scenario_generation_prompt.txt");
        var failureAnalysisPrompt = loadSystemPrompt("failure_analyzer",
                StoryTestConfig.getFailureAnalysisAgentPromptVersion(), "failure_analysis_prompt.txt");
        var scenarioGenerationAgent = builder(ScenarioGenerationAgent.class)
                .chatModel(chatModel)
                .systemMessageProvider(memoryId -> scenarioGenerationPrompt)
                .build();
        var failureAnalysisAgent = builder(FailureAnalysisAgent.class)
                .chatModel(chatModel)
                .systemMessageProvider(memoryId -> failureAnalysisPrompt)
                .build();
        return new AiScenarioGenerator(scenarioGenerationAgent, failureAnalysisAgent, new RuleBasedScenarioGenerator());
    }

    @Override
    public TestScenario generate(@Nullable String userStory, @Nullable String projectContext) {
        String story = userStory == null ? "" : userStory;
        if (isBlank(story)) {
            LOG.warn("User story is empty, using rule-based generation");
            return fallbackGenerator.generate(story, projectContext);
        }
        try {
            AgentExecutionResult<GeneratedScenario> result = scenarioGenerationAgent.executeWithRetry(
                    () -> scenarioGenerationAgent.generateScenario(story, requireNonNullElse(projectContext, "")),
                    AiScenarioGenerator::isGeneratedScenarioIncomplete);
            if (!result.success() || result.resultPayload() == null) {
                LOG.warn("Model couldn't generate a scenario after {} attempt(s): {}. Using rule-based generation.",
                        result.attempts(), result.message());
                return fallbackGenerator.generate(story, projectContext);
            }

            TestScenario scenario = toScenario(result.resultPayload(), story, projectContext);
            List<String> errors = scenario.validateContent();
            if (!errors.isEmpty()) {
                LOG.warn("Model generated an invalid scenario ({}). Using rule-based generation.", errors);
                return fallbackGenerator.generate(story, projectContext);
            }
            LOG.info("Model generated scenario '{}' with {} steps", scenario.title(), scenario.steps().size());
            return scenario;
        } catch (RuntimeException e) {
            LOG.error("Model-based scenario generation failed, using rule-based generation", e);
            return fallbackGenerator.generate(story, projectContext);
        }
    }

    @Override
    public String analyzeFailure(@NotNull TestResult result) {
        if (result.isPassed()) {
            return fallbackGenerator.analyzeFailure(result);
        }
        String resultDescription = getObjectPrettyPrinted(result).orElseGet(result::toString);
        AgentExecutionResult<String> analysis = failureAnalysisAgent.executeWithRetry(
                () -> failureAnalysisAgent.analyzeFailure(resultDescription), text -> isBlank(text));
        if (analysis.success() && isNotBlank(analysis.resultPayload())) {
            return analysis.resultPayload().trim();
        }
        LOG.warn("Model couldn't analyze the failure of result {}: {}. Using rule-based analysis.", result.getId(),
                analysis.message());
        return fallbackGenerator.analyzeFailure(result);
    }

    @Override
    public List<TestStep> refineSteps(@NotNull List<TestStep> steps, @Nullable String feedback) {
        return fallbackGenerator.refineSteps(steps, feedback);
    }

    @Override
    public Map<String, ParameterValue> generateTestData(@NotNull TestScenario scenario, @Nullable String requirements) {
        return fallbackGenerator.generateTestData(scenario, requirements);
    }

    @Override
    public List<TestScenario> optimizeScenarios(@NotNull List<TestScenario> scenarios) {
        return fallbackGenerator.optimizeScenarios(scenarios);
    }

    @Override
    public List<TestScenario> suggestAdditionalTests(@NotNull List<TestScenario> existingScenarios,
                                                     @Nullable String context) {
        return fallbackGenerator.suggestAdditionalTests(existingScenarios, context);
    }

    @Override
    public ScenarioValidationResult validateScenario(@NotNull TestScenario scenario) {
        return fallbackGenerator.validateScenario(scenario);
    }

    private static boolean isGeneratedScenarioIncomplete(GeneratedScenario generatedScenario) {
        return generatedScenario == null || isBlank(generatedScenario.title()) || generatedScenario.steps() == null
                || generatedScenario.steps().isEmpty();
    }

    private static TestScenario toScenario(GeneratedScenario generatedScenario, String story,
                                           @Nullable String projectContext) {
        List<TestStep> steps = new ArrayList<>();
        for (GeneratedStep generatedStep : generatedScenario.steps()) {
            if (generatedStep == null) {
                continue;
            }
            var stepBuilder = TestStep.builder()
                    .order(steps.size() + 1)
                    .action(generatedStep.action())
                    .target(generatedStep.target())
                    .description(generatedStep.description())
                    .expectedResult(generatedStep.expectedResult());
            for (GeneratedParameter parameter : requireNonNullElse(generatedStep.parameters(),
                    List.<GeneratedParameter>of())) {
                if (parameter != null && isNotBlank(parameter.name())) {
                    stepBuilder.parameter(parameter.name(), requireNonNullElse(parameter.value(), ""));
                }
            }
            steps.add(stepBuilder.build());
        }

        Set<String> tags = new LinkedHashSet<>(requireNonNullElse(generatedScenario.tags(), List.of()));
        tags.add(GENERATED_TAG);
        tags.add(AI_TAG);
        var builder = TestScenario.builder()
                .title(generatedScenario.title())
                .description(generatedScenario.description())
                .originalUserStory(story)
                .type(parseEnum(TestType.class, generatedScenario.testType(), TestType.UI))
                .status(GENERATED)
                .priority(parseEnum(TestPriority.class, generatedScenario.priority(), TestPriority.MEDIUM))
                .environment(TESTING)
                .steps(steps)
                .tags(List.copyOf(tags))
                .preconditions(requireNonNullElse(generatedScenario.preconditions(), List.of()))
                .expectedOutcomes(requireNonNullElse(generatedScenario.expectedOutcomes(), List.of()))
                .createdBy(CREATED_BY)
                .metadataEntry("generator", ParameterValue.of("ai"))
                .metadataEntry("model", ParameterValue.of(StoryTestConfig.getModelName()));
        if (isNotBlank(projectContext)) {
            builder.metadataEntry("projectContext", ParameterValue.of(projectContext));
        }
        return builder.build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> enumClass, @Nullable String value, E defaultValue) {
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(enumClass, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Model returned unknown {} '{}', using {}", enumClass.getSimpleName(), value, defaultValue);
            return defaultValue;
        }
    }
}
