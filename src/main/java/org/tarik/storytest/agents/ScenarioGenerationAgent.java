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
package org.tarik.storytest.agents;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;
import org.tarik.storytest.StoryTestConfig;
import org.tarik.storytest.dto.GeneratedScenario;
import org.tarik.storytest.error.RetryPolicy;

public interface ScenarioGenerationAgent extends BaseAiAgent {
    RetryPolicy RETRY_POLICY = StoryTestConfig.getAgentRetryPolicy();

    @UserMessage("""
            User story:
            {{user_story}}

            Project context:
            {{project_context}}""")
    GeneratedScenario generateScenario(@V("user_story") String userStory,
                                       @V("project_context") String projectContext);

    @Override
    default String getAgentTaskDescription() {
        return "Generating test scenario from user story";
    }

    @Override
    default RetryPolicy getRetryPolicy() {
        return RETRY_POLICY;
    }
}
