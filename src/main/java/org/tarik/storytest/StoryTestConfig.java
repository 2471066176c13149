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

package org.tarik.storytest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.storytest.error.RetryPolicy;
import org.tarik.storytest.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.stream;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;

public class StoryTestConfig {
    private static final Logger LOG = LoggerFactory.getLogger(StoryTestConfig.class);
    private static final String CONFIG_FILE = "config.properties";
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value, boolean isSecret) {
    }

    public enum ModelProvider {
        OPENAI,
        GROQ
    }

    public enum GeneratorMode {
        RULE_BASED,
        AI
    }

    // -----------------------------------------------------
    // Execution Config
    private static final ConfigProperty<Integer> EXECUTION_THREAD_POOL_SIZE = loadPropertyAsInteger(
            "execution.thread.pool.size", "EXECUTION_THREAD_POOL_SIZE", "8", false);
    private static final ConfigProperty<Integer> EXECUTOR_THREAD_POOL_SIZE = loadPropertyAsInteger(
            "executor.thread.pool.size", "EXECUTOR_THREAD_POOL_SIZE", "4", false);
    private static final ConfigProperty<Integer> DEFAULT_MAX_CONCURRENCY = loadPropertyAsInteger(
            "execution.default.max.concurrency", "DEFAULT_MAX_CONCURRENCY", "3", false);
    private static final ConfigProperty<Integer> SCENARIO_RETRY_INITIAL_DELAY_MILLIS = loadPropertyAsInteger(
            "execution.retry.initial.delay.millis", "SCENARIO_RETRY_INITIAL_DELAY_MILLIS", "0", false);
    private static final ConfigProperty<Integer> SCENARIO_RETRY_MAX_DELAY_MILLIS = loadPropertyAsInteger(
            "execution.retry.max.delay.millis", "SCENARIO_RETRY_MAX_DELAY_MILLIS", "10000", false);
    private static final ConfigProperty<Double> SCENARIO_RETRY_BACKOFF_MULTIPLIER = loadPropertyAsDouble(
            "execution.retry.backoff.multiplier", "SCENARIO_RETRY_BACKOFF_MULTIPLIER", "2.0", false);

    // Health Check Config
    private static final ConfigProperty<Integer> HEALTH_CHECK_TIMEOUT_MILLIS = loadPropertyAsInteger(
            "health.check.timeout.millis", "HEALTH_CHECK_TIMEOUT_MILLIS", "10000", false);
    private static final ConfigProperty<Integer> HEALTH_CHECK_MAX_CONCURRENCY = loadPropertyAsInteger(
            "health.check.max.concurrency", "HEALTH_CHECK_MAX_CONCURRENCY", "4", false);

    // Repository Config
    private static final ConfigProperty<Integer> DEFAULT_PAGE_SIZE = loadPropertyAsInteger(
            "repository.default.page.size", "REPOSITORY_DEFAULT_PAGE_SIZE", "50", false);

    // Generator Config
    private static final ConfigProperty<GeneratorMode> GENERATOR_MODE = getProperty("generator.mode",
            "GENERATOR_MODE", "rule_based", s -> stream(GeneratorMode.values())
                    .filter(mode -> mode.name().equalsIgnoreCase(s))
                    .findAny()
                    .orElseThrow(() -> new IllegalArgumentException(
                            ("%s is not a supported generator mode. Supported ones: %s".formatted(s,
                                    Arrays.toString(GeneratorMode.values()))))),
            false);

    // Model Config
    private static final ConfigProperty<ModelProvider> MODEL_PROVIDER = getProperty("model.provider",
            "MODEL_PROVIDER", "openai", StoryTestConfig::getModelProvider, false);
    private static final ConfigProperty<String> MODEL_NAME = loadProperty("model.name", "MODEL_NAME",
            "gpt-4o-mini", s -> s, false);
    private static final ConfigProperty<Integer> MAX_OUTPUT_TOKENS = loadPropertyAsInteger("model.max.output.tokens",
            "MAX_OUTPUT_TOKENS", "4000", false);
    private static final ConfigProperty<Double> TEMPERATURE = loadPropertyAsDouble("model.temperature", "TEMPERATURE",
            "0.0", false);
    private static final ConfigProperty<Double> TOP_P = loadPropertyAsDouble("model.top.p", "TOP_P", "1.0", false);
    private static final ConfigProperty<Boolean> MODEL_LOGGING_ENABLED = loadProperty("model.logging.enabled",
            "LOG_MODEL_OUTPUT", "false", Boolean::parseBoolean, false);
    private static final ConfigProperty<Integer> MAX_RETRIES = loadPropertyAsInteger("model.max.retries", "MAX_RETRIES",
            "3", false);

    // OpenAI API Config
    private static final ConfigProperty<String> OPENAI_API_KEY = loadProperty("openai.api.key", "OPENAI_API_KEY", "",
            s -> s, true);
    private static final ConfigProperty<String> OPENAI_API_ENDPOINT = loadProperty("openai.endpoint",
            "OPENAI_API_ENDPOINT", "https://api.openai.com/v1", s -> s, false);

    // Groq API Config
    private static final ConfigProperty<String> GROQ_API_KEY = loadProperty("groq.api.key", "GROQ_API_KEY", "",
            s -> s, true);
    private static final ConfigProperty<String> GROQ_API_ENDPOINT = loadProperty("groq.endpoint", "GROQ_ENDPOINT",
            "https://api.groq.com/openai/v1", s -> s, false);

    // Agent Config
    private static final ConfigProperty<Integer> AGENT_RETRY_MAX_RETRIES = loadPropertyAsInteger(
            "agent.retry.max.retries", "AGENT_RETRY_MAX_RETRIES", "2", false);
    private static final ConfigProperty<Integer> AGENT_RETRY_INITIAL_DELAY_MILLIS = loadPropertyAsInteger(
            "agent.retry.initial.delay.millis", "AGENT_RETRY_INITIAL_DELAY_MILLIS", "1000", false);
    private static final ConfigProperty<Integer> AGENT_RETRY_MAX_DELAY_MILLIS = loadPropertyAsInteger(
            "agent.retry.max.delay.millis", "AGENT_RETRY_MAX_DELAY_MILLIS", "10000", false);
    private static final ConfigProperty<Integer> AGENT_RETRY_TIMEOUT_MILLIS = loadPropertyAsInteger(
            "agent.retry.timeout.millis", "AGENT_RETRY_TIMEOUT_MILLIS", "60000", false);
    private static final ConfigProperty<String> SCENARIO_GENERATION_AGENT_PROMPT_VERSION = loadProperty(
            "scenario.generation.agent.prompt.version", "SCENARIO_GENERATION_AGENT_PROMPT_VERSION", "v1.0.0",
            s -> s, false);
    private static final ConfigProperty<String> FAILURE_ANALYSIS_AGENT_PROMPT_VERSION = loadProperty(
            "failure.analysis.agent.prompt.version", "FAILURE_ANALYSIS_AGENT_PROMPT_VERSION", "v1.0.0",
            s -> s, false);

    // -----------------------------------------------------
    // Execution Config
    public static int getExecutionThreadPoolSize() {
        return EXECUTION_THREAD_POOL_SIZE.value();
    }

    public static int getExecutorThreadPoolSize() {
        return EXECUTOR_THREAD_POOL_SIZE.value();
    }

    public static int getDefaultMaxConcurrency() {
        return DEFAULT_MAX_CONCURRENCY.value();
    }

    /**
     * Builds the back-off policy used when re-running a failed scenario.
     *
     * @param retryCount number of re-runs the scenario declares
     */
    public static RetryPolicy getScenarioRetryPolicy(int retryCount) {
        return new RetryPolicy(
                retryCount,
                SCENARIO_RETRY_INITIAL_DELAY_MILLIS.value(),
                SCENARIO_RETRY_MAX_DELAY_MILLIS.value(),
                SCENARIO_RETRY_BACKOFF_MULTIPLIER.value(),
                0);
    }

    // -----------------------------------------------------
    // Health Check Config
    public static int getHealthCheckTimeoutMillis() {
        return HEALTH_CHECK_TIMEOUT_MILLIS.value();
    }

    public static int getHealthCheckMaxConcurrency() {
        return HEALTH_CHECK_MAX_CONCURRENCY.value();
    }

    // -----------------------------------------------------
    // Repository Config
    public static int getDefaultPageSize() {
        return DEFAULT_PAGE_SIZE.value();
    }

    // -----------------------------------------------------
    // Generator Config
    public static GeneratorMode getGeneratorMode() {
        return GENERATOR_MODE.value();
    }

    // -----------------------------------------------------
    // Model Config
    public static ModelProvider getModelProvider() {
        return MODEL_PROVIDER.value();
    }

    public static String getModelName() {
        return MODEL_NAME.value();
    }

    private static ModelProvider getModelProvider(String s) {
        return stream(ModelProvider.values())
                .filter(provider -> provider.name().equalsIgnoreCase(s))
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException(
                        ("%s is not a supported model provider. Supported ones: %s".formatted(s,
                                Arrays.toString(ModelProvider.values())))));
    }

    public static int getMaxOutputTokens() {
        return MAX_OUTPUT_TOKENS.value();
    }

    public static double getTemperature() {
        return TEMPERATURE.value();
    }

    public static double getTopP() {
        return TOP_P.value();
    }

    public static boolean isModelLoggingEnabled() {
        return MODEL_LOGGING_ENABLED.value();
    }

    public static int getMaxRetries() {
        return MAX_RETRIES.value();
    }

    // -----------------------------------------------------
    // OpenAI API Config
    public static String getOpenAiApiKey() {
        return requireSecret(OPENAI_API_KEY, "openai.api.key", "OPENAI_API_KEY");
    }

    public static String getOpenAiEndpoint() {
        return OPENAI_API_ENDPOINT.value();
    }

    // -----------------------------------------------------
    // Groq API Config
    public static String getGroqApiKey() {
        return requireSecret(GROQ_API_KEY, "groq.api.key", "GROQ_API_KEY");
    }

    public static String getGroqEndpoint() {
        return GROQ_API_ENDPOINT.value();
    }

    // -----------------------------------------------------
    // Agent Config
    public static RetryPolicy getAgentRetryPolicy() {
        return new RetryPolicy(
                AGENT_RETRY_MAX_RETRIES.value(),
                AGENT_RETRY_INITIAL_DELAY_MILLIS.value(),
                AGENT_RETRY_MAX_DELAY_MILLIS.value(),
                2,
                AGENT_RETRY_TIMEOUT_MILLIS.value());
    }

    public static String getScenarioGenerationAgentPromptVersion() {
        return SCENARIO_GENERATION_AGENT_PROMPT_VERSION.value();
    }

    public static String getFailureAnalysisAgentPromptVersion() {
        return FAILURE_ANALYSIS_AGENT_PROMPT_VERSION.value();
    }

    // -----------------------------------------------------
    // Loading
    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = StoryTestConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.error("Cannot find resource file '{}' in classpath.", CONFIG_FILE);
                throw new IOException("Cannot find resource: " + CONFIG_FILE);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file {}", CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static String requireSecret(ConfigProperty<String> property, String key, String envVar) {
        if (CommonUtils.isBlank(property.value())) {
            throw new IllegalStateException(("The value of property '%s' must be either present in the properties " +
                    "file, or in the environment variable '%s'").formatted(key, envVar));
        }
        return property.value();
    }

    private static <T> ConfigProperty<T> loadProperty(String key, String envVar, String defaultValue,
            Function<String, T> converter,
            boolean isSecret) {
        var value = getProperty(key, envVar, defaultValue, isSecret);
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static Optional<String> getProperty(String key, String envVar, boolean isSecret) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            var message = "Using environment variable '%s' for key '%s'".formatted(envVar, key);
            if (!isSecret) {
                message = "%s with value '%s'".formatted(message, envVariableOptional.get());
            }
            LOG.info(message);
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                var message = "Using property file value for key '%s'".formatted(key);
                if (!isSecret) {
                    message = "%s with value '%s'".formatted(message, propertyFileValueOptional.get());
                }
                LOG.info(message);
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue, boolean isSecret) {
        return getProperty(key, envVar, isSecret).orElseGet(() -> {
            LOG.info("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static <T> ConfigProperty<T> getProperty(String key, String envVar, String defaultValue,
            Function<String, T> converter,
            boolean isSecret) {
        String value = getProperty(key, envVar, defaultValue, isSecret);
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static ConfigProperty<Integer> loadPropertyAsInteger(String propertyKey, String envVar, String defaultValue,
            boolean isSecret) {
        var configProperty = getProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Integer value = CommonUtils.parseStringAsInteger(configProperty.value())
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct integer value:%s".formatted(propertyKey,
                                configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }

    private static ConfigProperty<Double> loadPropertyAsDouble(String propertyKey, String envVar, String defaultValue,
            boolean isSecret) {
        var configProperty = getProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Double value = CommonUtils.parseStringAsDouble(configProperty.value())
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct double value:%s".formatted(propertyKey,
                                configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }
}
