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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Limits the number of asynchronous tasks in flight. Tasks submitted while all slots are taken are queued and started
 * in submission order as soon as a running task completes. No thread is blocked while waiting for a slot.
 */
public class ExecutionSlotManager {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionSlotManager.class);
    private final Lock lock = new ReentrantLock();
    private final Deque<Runnable> pendingTasks = new ArrayDeque<>();
    private final ThreadLocal<AtomicInteger> pendingReleases = new ThreadLocal<>();
    private final int maxConcurrency;

    private int activeTasks = 0;
    private int peakActiveTasks = 0;

    public ExecutionSlotManager(int maxConcurrency) {
        checkArgument(maxConcurrency > 0, "Max concurrency must be positive, got %s", maxConcurrency);
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Starts the task as soon as a slot is free.
     *
     * @param task supplier of the asynchronous work, invoked only once the slot has been acquired
     * @return future mirroring the task's outcome. Cancelling it cancels the task, or removes it from the queue.
     */
    public <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Runnable start = () -> startTask(task, result);
        boolean startNow;
        lock.lock();
        try {
            startNow = activeTasks < maxConcurrency;
            if (startNow) {
                activeTasks++;
                peakActiveTasks = Math.max(peakActiveTasks, activeTasks);
            } else {
                pendingTasks.addLast(start);
                LOG.debug("All {} slots are busy, task queued. Queued tasks: {}", maxConcurrency, pendingTasks.size());
            }
        } finally {
            lock.unlock();
        }

        if (startNow) {
            start.run();
        }
        return result;
    }

    private <T> void startTask(Supplier<CompletableFuture<T>> task, CompletableFuture<T> result) {
        if (result.isDone()) {
            releaseSlot();
            return;
        }

        CompletableFuture<T> taskFuture;
        try {
            taskFuture = task.get();
        } catch (RuntimeException e) {
            taskFuture = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> runningTask = taskFuture;
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                runningTask.cancel(true);
            }
        });
        runningTask.whenComplete((value, error) -> {
            try {
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(value);
                }
            } finally {
                releaseSlot();
            }
        });
    }

    /**
     * Hands the slot over to the next queued task, or frees it. Tasks which complete while being started release
     * their slot on the same thread; those releases are counted and drained by the outermost call instead of
     * recursing, so a long queue of instantly completing tasks can't exhaust the stack.
     */
    private void releaseSlot() {
        AtomicInteger ownReleases = pendingReleases.get();
        if (ownReleases != null) {
            ownReleases.incrementAndGet();
            return;
        }

        ownReleases = new AtomicInteger(1);
        pendingReleases.set(ownReleases);
        try {
            while (ownReleases.getAndDecrement() > 0) {
                Runnable next = pollNextOrFreeSlot();
                // The slot is handed over to the next queued task without being released
                if (next != null) {
                    next.run();
                }
            }
        } finally {
            pendingReleases.remove();
        }
    }

    private Runnable pollNextOrFreeSlot() {
        lock.lock();
        try {
            Runnable next = pendingTasks.pollFirst();
            if (next == null) {
                activeTasks--;
            }
            LOG.debug("Slot released. Active tasks: {}, queued tasks: {}", activeTasks, pendingTasks.size());
            return next;
        } finally {
            lock.unlock();
        }
    }

    public int getActiveTasks() {
        lock.lock();
        try {
            return activeTasks;
        } finally {
            lock.unlock();
        }
    }

    public int getQueuedTasks() {
        lock.lock();
        try {
            return pendingTasks.size();
        } finally {
            lock.unlock();
        }
    }

    public int getPeakActiveTasks() {
        lock.lock();
        try {
            return peakActiveTasks;
        } finally {
            lock.unlock();
        }
    }
}
