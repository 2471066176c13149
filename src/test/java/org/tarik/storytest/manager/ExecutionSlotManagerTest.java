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
package org.tarik.storytest.manager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExecutionSlotManager Tests")
class ExecutionSlotManagerTest {

    @Test
    @DisplayName("Should start at most the allowed number of tasks and queue the rest in order")
    void shouldLimitConcurrency() {
        // Given
        ExecutionSlotManager manager = new ExecutionSlotManager(2);
        List<CompletableFuture<Integer>> tasks = new ArrayList<>();
        List<Integer> startOrder = new ArrayList<>();
        List<CompletableFuture<Integer>> results = new ArrayList<>();

        // When
        for (int i = 0; i < 4; i++) {
            int index = i;
            CompletableFuture<Integer> task = new CompletableFuture<>();
            tasks.add(task);
            results.add(manager.submit(() -> {
                startOrder.add(index);
                return task;
            }));
        }

        // Then
        assertThat(startOrder).containsExactly(0, 1);
        assertThat(manager.getActiveTasks()).isEqualTo(2);
        assertThat(manager.getQueuedTasks()).isEqualTo(2);

        tasks.get(1).complete(1);
        assertThat(startOrder).containsExactly(0, 1, 2);
        assertThat(results.get(1)).isCompletedWithValue(1);

        tasks.get(0).complete(0);
        tasks.get(2).complete(2);
        tasks.get(3).complete(3);
        assertThat(startOrder).containsExactly(0, 1, 2, 3);
        assertThat(results).allMatch(CompletableFuture::isDone);
        assertThat(manager.getActiveTasks()).isZero();
        assertThat(manager.getQueuedTasks()).isZero();
        assertThat(manager.getPeakActiveTasks()).isEqualTo(2);
    }

    @Test
    @DisplayName("Failing task should propagate its error and free the slot")
    void shouldReleaseSlotOnFailure() {
        // Given
        ExecutionSlotManager manager = new ExecutionSlotManager(1);
        AtomicInteger started = new AtomicInteger();

        // When
        CompletableFuture<String> failed = manager.submit(() -> {
            started.incrementAndGet();
            throw new IllegalStateException("Boom");
        });
        CompletableFuture<String> next = manager.submit(() -> {
            started.incrementAndGet();
            return CompletableFuture.completedFuture("done");
        });

        // Then
        assertThat(failed).isCompletedExceptionally();
        assertThatThrownBy(failed::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(next).isCompletedWithValue("done");
        assertThat(started).hasValue(2);
        assertThat(manager.getActiveTasks()).isZero();
    }

    @Test
    @DisplayName("Cancelling a queued task should skip it and cancelling a running one should cancel the task")
    void shouldHandleCancellation() {
        // Given
        ExecutionSlotManager manager = new ExecutionSlotManager(1);
        CompletableFuture<String> runningTask = new CompletableFuture<>();
        AtomicInteger queuedStarts = new AtomicInteger();
        CompletableFuture<String> running = manager.submit(() -> runningTask);
        CompletableFuture<String> queued = manager.submit(() -> {
            queuedStarts.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        });
        CompletableFuture<String> last = manager.submit(() -> CompletableFuture.completedFuture("last"));

        // When
        queued.cancel(true);
        running.cancel(true);

        // Then
        assertThat(runningTask).isCancelled();
        assertThat(queuedStarts).hasValue(0);
        assertThat(last).isCompletedWithValue("last");
        assertThat(manager.getActiveTasks()).isZero();
    }

    @Test
    @DisplayName("Long queue of instantly failing tasks should be drained once the slot frees up")
    void shouldDrainLongQueueOfInstantlyCompletingTasks() {
        // Given
        ExecutionSlotManager manager = new ExecutionSlotManager(1);
        CompletableFuture<Integer> blockingTask = new CompletableFuture<>();
        List<CompletableFuture<Integer>> results = new ArrayList<>();
        results.add(manager.submit(() -> blockingTask));
        for (int i = 0; i < 50_000; i++) {
            results.add(manager.submit(() -> CompletableFuture.failedFuture(new IllegalStateException("Missing"))));
        }
        assertThat(manager.getQueuedTasks()).isEqualTo(50_000);

        // When
        blockingTask.complete(1);

        // Then
        assertThat(results).allMatch(CompletableFuture::isDone);
        assertThat(results.get(0)).isCompletedWithValue(1);
        assertThat(results.subList(1, results.size())).allMatch(CompletableFuture::isCompletedExceptionally);
        assertThat(manager.getActiveTasks()).isZero();
        assertThat(manager.getQueuedTasks()).isZero();
        assertThat(manager.getPeakActiveTasks()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a non-positive limit")
    void shouldRejectInvalidLimit() {
        assertThatThrownBy(() -> new ExecutionSlotManager(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
