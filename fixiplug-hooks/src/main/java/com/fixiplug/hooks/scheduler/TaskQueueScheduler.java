package com.fixiplug.hooks.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Scheduler that only queues tasks; the owner runs them explicitly.
 * Used by tests and by callers that drive their own event loop.
 */
@Slf4j
public class TaskQueueScheduler implements HookScheduler {

    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void schedule(Runnable task) {
        tasks.addLast(Objects.requireNonNull(task, "task"));
    }

    /**
     * Run the oldest pending task.
     *
     * @return false if nothing was pending
     */
    public boolean runNext() {
        Runnable task;
        synchronized (this) {
            task = tasks.pollFirst();
        }
        if (task == null) {
            return false;
        }
        try {
            task.run();
        } catch (Exception e) {
            log.error("Scheduled hook task failed: {}", e.getMessage(), e);
        }
        return true;
    }

    /**
     * Run tasks, including ones scheduled while running, until none remain.
     *
     * @return number of tasks run
     */
    public int runPending() {
        return runPending(Integer.MAX_VALUE);
    }

    public int runPending(int maxTasks) {
        int ran = 0;
        while (ran < maxTasks && runNext()) {
            ran++;
        }
        return ran;
    }

    public synchronized int pendingCount() {
        return tasks.size();
    }
}
