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
package org.tarik.storytest.model;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.tarik.storytest.StoryTestConfig.ModelProvider;

import java.util.List;

import static org.tarik.storytest.StoryTestConfig.*;

/**
 * Builds chat models for the configured provider. Groq exposes an OpenAI-compatible API, so both providers share
 * the OpenAI client.
 */
public class ModelFactory {
    private static final int MAX_RETRIES = getMaxRetries();
    private static final int MAX_OUTPUT_TOKENS = getMaxOutputTokens();
    private static final double TEMPERATURE = getTemperature();
    private static final double TOP_P = getTopP();
    private static final boolean LOG_MODEL_OUTPUTS = isModelLoggingEnabled();

    public static ChatModel getChatModel(String modelName, ModelProvider modelProvider) {
        return switch (modelProvider) {
            case OPENAI -> getOpenAiCompatibleModel(modelName, getOpenAiEndpoint(), getOpenAiApiKey());
            case GROQ -> getOpenAiCompatibleModel(modelName, getGroqEndpoint(), getGroqApiKey());
        };
    }

    static ChatModel getOpenAiCompatibleModel(String modelName, String endpoint, String apiKey) {
        return OpenAiChatModel.builder()
                .baseUrl(endpoint)
                .modelName(modelName)
                .maxRetries(MAX_RETRIES)
                .apiKey(apiKey)
                .maxTokens(MAX_OUTPUT_TOKENS)
                .temperature(TEMPERATURE)
                .topP(TOP_P)
                .logRequests(LOG_MODEL_OUTPUTS)
                .logResponses(LOG_MODEL_OUTPUTS)
                .listeners(List.of(new ChatModelEventListener()))
                .build();
    }
}
