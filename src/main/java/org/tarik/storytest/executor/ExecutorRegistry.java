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
package org.tarik.storytest.executor;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.storytest.model.ParameterValue;
import org.tarik.storytest.model.TestType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Ordered set of executors. Dispatch picks the first registered executor which can run the requested test type;
 * registering several executors for the same type is allowed, the earliest one wins.
 */
public class ExecutorRegistry implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutorRegistry.class);
    private final List<TestExecutor> executors = new CopyOnWriteArrayList<>();

    public void register(@NotNull TestExecutor executor) {
        register(executor, Map.of());
    }

    /**
     * Initializes the executor with the given configuration and appends it to the dispatch order.
     *
     * @throws IllegalStateException if the executor fails to initialize
     */
    public synchronized void register(@NotNull TestExecutor executor,
                                      @NotNull Map<String, ParameterValue> configuration) {
        checkArgument(executors.stream().noneMatch(existing -> existing.getName().equals(executor.getName())),
                "Executor with name '%s' is already registered", executor.getName());
        boolean initialized;
        try {
            initialized = executor.initialize(configuration);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Executor '%s' failed to initialize".formatted(executor.getName()), e);
        }
        if (!initialized) {
            throw new IllegalStateException("Executor '%s' refused the provided configuration"
                    .formatted(executor.getName()));
        }
        executors.add(executor);
        LOG.info("Registered executor '{}' at position {}", executor.getName(), executors.size());
    }

    public Optional<TestExecutor> findExecutor(@NotNull TestType testType) {
        return executors.stream()
                .filter(executor -> executor.canExecute(testType))
                .findFirst();
    }

    public List<TestExecutor> getExecutors() {
        return List.copyOf(executors);
    }

    /**
     * Cleans up every registered executor. A failing cleanup is logged and doesn't prevent the others.
     */
    @Override
    public synchronized void close() {
        for (TestExecutor executor : executors) {
            try {
                executor.cleanup();
                LOG.info("Executor '{}' cleaned up", executor.getName());
            } catch (RuntimeException e) {
                LOG.error("Cleanup of executor '{}' failed", executor.getName(), e);
            }
        }
        executors.clear();
    }
}
