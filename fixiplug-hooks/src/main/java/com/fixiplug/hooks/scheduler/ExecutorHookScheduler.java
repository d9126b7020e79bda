package com.fixiplug.hooks.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs scheduled hook work on a single daemon thread.
 */
@Slf4j
public class ExecutorHookScheduler implements HookScheduler, AutoCloseable {

    private final ExecutorService executor;

    public ExecutorHookScheduler() {
        this("fixiplug-hooks");
    }

    public ExecutorHookScheduler(String threadName) {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void schedule(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("Scheduled hook task failed: {}", e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Hook scheduler is shut down, dropping task");
        }
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
